package quest.gekko.salesboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.salesboard.config.CacheConfig;
import quest.gekko.salesboard.config.SalesboardProperties;
import quest.gekko.salesboard.domain.*;
import quest.gekko.salesboard.dto.LeaderboardRowView;
import quest.gekko.salesboard.dto.SnapshotView;
import quest.gekko.salesboard.repository.*;
import quest.gekko.salesboard.service.exception.NotFoundException;
import quest.gekko.salesboard.service.exception.ScoringException;
import quest.gekko.salesboard.service.scoring.LeaderboardRanker;
import quest.gekko.salesboard.service.scoring.RankedRow;
import quest.gekko.salesboard.service.scoring.ScoringInput;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Append-only leaderboard history of a period. Each snapshot is written once with all of
 * its rows and never touched again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaderboardService {
    private final PeriodRepository periodRepository;
    private final UserWeekTargetRepository targetRepository;
    private final AchievementRepository achievementRepository;
    private final LeaderboardSnapshotRepository snapshotRepository;
    private final LeaderboardRowRepository rowRepository;
    private final LeaderboardRanker ranker;
    private final SalesboardProperties.Leaderboard leaderboard;
    private final Clock clock;

    @Transactional
    public SnapshotView computeSnapshot(Long periodId, String rulesVersion) {
        Period period = periodRepository.findById(periodId)
                .orElseThrow(() -> new NotFoundException("Period", periodId));
        List<UserWeekTarget> targets = targetRepository.findByPeriodIdOrderByWeekIndexAscCategoryIdAscUserIdAsc(periodId);
        if (targets.isEmpty()) {
            throw ScoringException.notComputed(periodId);
        }
        String version = rulesVersion == null || rulesVersion.isBlank() ? leaderboard.defaultRulesVersion() : rulesVersion.trim();

        Map<String, BigDecimal> targetsByUser = targets.stream()
                .collect(Collectors.groupingBy(UserWeekTarget::getUserId, TreeMap::new,
                        Collectors.reducing(BigDecimal.ZERO, UserWeekTarget::getTargetValue, BigDecimal::add)));
        List<ScoringInput.Entry> achievements = achievementRepository
                .findByShopIdAndOccurredOnBetweenOrderByOccurredOnAsc(period.getShopId(), period.firstDay(), period.lastDay()).stream()
                .map(a -> new ScoringInput.Entry(a.getUserId(), a.getOccurredOn(), a.getAchievedValue()))
                .toList();

        Optional<LeaderboardSnapshot> previous = snapshotRepository.findFirstByPeriodIdOrderByComputedAtDescSequenceNoDesc(periodId);
        Map<String, BigDecimal> previousPct = previous
                .map(s -> rowRepository.findBySnapshotIdOrderByRankAsc(s.getId()).stream()
                        .collect(Collectors.toMap(LeaderboardRow::getUserId, LeaderboardRow::getAchievementPct)))
                .orElse(Map.of());

        List<RankedRow> ranked = ranker.rank(new ScoringInput(period.firstDay(), targetsByUser, achievements, previousPct));

        int sequence = snapshotRepository.findFirstByPeriodIdOrderBySequenceNoDesc(periodId)
                .map(s -> s.getSequenceNo() + 1)
                .orElse(1);
        LeaderboardSnapshot snapshot = new LeaderboardSnapshot();
        snapshot.setPeriodId(periodId);
        snapshot.setSequenceNo(sequence);
        snapshot.setRulesVersion(version);
        snapshot.setComputedAt(Instant.now(clock));
        try {
            snapshot = snapshotRepository.saveAndFlush(snapshot);
        } catch (DataIntegrityViolationException e) {
            if (violates(e, LeaderboardSnapshot.SEQUENCE_CONSTRAINT)) {
                log.warn("Snapshot #{} of period {} lost a concurrent write", sequence, periodId);
                throw ScoringException.conflict(periodId, e);
            }
            throw ScoringException.storageFailed(periodId, e);
        }
        LeaderboardSnapshot owner = snapshot;
        try {
            rowRepository.saveAllAndFlush(ranked.stream().map(r -> toEntity(owner, r)).toList());
        } catch (DataIntegrityViolationException e) {
            throw ScoringException.storageFailed(periodId, e);
        }

        log.info("Snapshot #{} ({}) of period {}: {} ranked users", sequence, version, periodId, ranked.size());
        return SnapshotView.from(snapshot);
    }

    @Transactional(readOnly = true)
    public List<SnapshotView> listSnapshots(Long periodId) {
        requirePeriod(periodId);
        return snapshotRepository.findByPeriodIdOrderByComputedAtDescSequenceNoDesc(periodId).stream()
                .map(SnapshotView::from)
                .toList();
    }

    @Cacheable(CacheConfig.LEADERBOARD_ROWS)
    @Transactional(readOnly = true)
    public List<LeaderboardRowView> getRows(Long snapshotId) {
        if (!snapshotRepository.existsById(snapshotId)) {
            throw new NotFoundException("Snapshot", snapshotId);
        }
        return rowRepository.findBySnapshotIdOrderByRankAsc(snapshotId).stream()
                .map(LeaderboardRowView::from)
                .toList();
    }

    /** Rows of the latest snapshot, empty when the period was never scored. */
    @Transactional(readOnly = true)
    public List<LeaderboardRowView> currentRows(Long periodId) {
        requirePeriod(periodId);
        return snapshotRepository.findFirstByPeriodIdOrderByComputedAtDescSequenceNoDesc(periodId)
                .map(s -> rowRepository.findBySnapshotIdOrderByRankAsc(s.getId()).stream()
                        .map(LeaderboardRowView::from)
                        .toList())
                .orElse(List.of());
    }

    private void requirePeriod(Long periodId) {
        if (!periodRepository.existsById(periodId)) {
            throw new NotFoundException("Period", periodId);
        }
    }

    // Postgres reports the constraint name as declared, H2 upper-cases it inside the message
    static boolean violates(DataIntegrityViolationException e, String constraint) {
        String name = e.getCause() instanceof ConstraintViolationException
                ? ((ConstraintViolationException) e.getCause()).getConstraintName()
                : null;
        String detail = (name != null ? name : "") + " " + e.getMostSpecificCause().getMessage();
        return detail.toLowerCase(Locale.ROOT).contains(constraint);
    }

    private static LeaderboardRow toEntity(LeaderboardSnapshot snapshot, RankedRow r) {
        LeaderboardRow row = new LeaderboardRow();
        row.setSnapshot(snapshot);
        row.setUserId(r.userId());
        row.setRank(r.rank());
        row.setScore(r.score());
        row.setAchievementPct(r.achievementPct());
        row.setTrend(r.trend());
        row.setStreakDays(r.streakDays());
        return row;
    }
}
