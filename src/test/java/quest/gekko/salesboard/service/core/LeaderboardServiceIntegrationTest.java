package quest.gekko.salesboard.service.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import quest.gekko.salesboard.IntegrationTestSupport;
import quest.gekko.salesboard.domain.LeaderboardSnapshot;
import quest.gekko.salesboard.domain.MemberRole;
import quest.gekko.salesboard.domain.Period;
import quest.gekko.salesboard.domain.Trend;
import quest.gekko.salesboard.dto.LeaderboardRowView;
import quest.gekko.salesboard.dto.SnapshotView;
import quest.gekko.salesboard.repository.LeaderboardSnapshotRepository;
import quest.gekko.salesboard.service.exception.NotFoundException;
import quest.gekko.salesboard.service.exception.ScoringException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class LeaderboardServiceIntegrationTest extends IntegrationTestSupport {

    private static final LocalDate MARCH = LocalDate.of(2024, 3, 1);

    @Autowired
    LeaderboardSnapshotRepository snapshotRepository;

    private static LeaderboardSnapshot snapshot(Long periodId, int sequence) {
        LeaderboardSnapshot s = new LeaderboardSnapshot();
        s.setPeriodId(periodId);
        s.setSequenceNo(sequence);
        s.setRulesVersion("v1");
        s.setComputedAt(Instant.now());
        return s;
    }

    @Test
    @DisplayName("Scoring before the first recompute fails with NOT_COMPUTED")
    void snapshotNeedsTargets() {
        Period period = configuredPeriod(newShop());

        ScoringException ex = assertThrows(ScoringException.class, () -> leaderboardService.computeSnapshot(period.getId(), null));

        assertEquals(ScoringException.Reason.NOT_COMPUTED, ex.getReason());
        assertFalse(ex.isRetryable());
        assertTrue(leaderboardService.listSnapshots(period.getId()).isEmpty());
    }

    @Test
    void ranksAreDenseAndOrdered() {
        String shop = newShop();
        Period period = configuredPeriod(shop);
        allocationService.recompute(period.getId());
        // juniors hold 200.00 each for the month, the senior 400.00; equal pct falls back to score
        sale(shop, "junior-a", MARCH, "100.00");
        sale(shop, "junior-b", MARCH.plusDays(1), "150.00");
        sale(shop, "senior-a", MARCH.plusDays(2), "200.00");
        sale(shop, "junior-c", MARCH.minusDays(1), "999.00");

        SnapshotView snapshot = leaderboardService.computeSnapshot(period.getId(), null);
        List<LeaderboardRowView> rows = leaderboardService.getRows(snapshot.id());

        assertEquals("v1", snapshot.rulesVersion());
        assertEquals(1, snapshot.sequenceNo());
        assertEquals(List.of("junior-b", "senior-a", "junior-a", "junior-c"), rows.stream().map(LeaderboardRowView::userId).toList());
        assertEquals(List.of(1, 2, 3, 4), rows.stream().map(LeaderboardRowView::rank).toList());
        assertEquals(0, rows.get(0).achievementPct().compareTo(d("75.00")));
        // outside the period's date range
        assertEquals(0, rows.get(3).score().signum());
        rows.forEach(r -> assertEquals(Trend.FLAT, r.trend()));
    }

    @Test
    @DisplayName("A second snapshot compares against the first and keeps it untouched")
    void trendAndHistory() {
        String shop = newShop();
        Period period = configuredPeriod(shop);
        allocationService.recompute(period.getId());
        sale(shop, "junior-a", MARCH, "100.00");
        sale(shop, "junior-b", MARCH, "100.00");

        SnapshotView first = leaderboardService.computeSnapshot(period.getId(), "v1");
        List<LeaderboardRowView> firstRows = leaderboardService.getRows(first.id());
        sale(shop, "junior-a", MARCH.plusDays(1), "20.00");
        SnapshotView second = leaderboardService.computeSnapshot(period.getId(), "v2");

        Map<String, LeaderboardRowView> rows = leaderboardService.getRows(second.id()).stream()
                .collect(Collectors.toMap(LeaderboardRowView::userId, r -> r));
        assertEquals(Trend.UP, rows.get("junior-a").trend());
        assertEquals(Trend.FLAT, rows.get("junior-b").trend());
        assertEquals(2, rows.get("junior-a").streakDays());

        assertEquals(List.of(second.id(), first.id()),
                leaderboardService.listSnapshots(period.getId()).stream().map(SnapshotView::id).toList());
        assertEquals(2, second.sequenceNo());
        assertEquals(firstRows, leaderboardService.getRows(first.id()));
        assertEquals(leaderboardService.getRows(second.id()), leaderboardService.currentRows(period.getId()));
    }

    @Test
    void ranksStayUniqueForManyTiedUsers() {
        String shop = newShop();
        Period period = configuredPeriod(shop);
        IntStream.rangeClosed(1, 12).forEach(i -> membershipService.upsertMembership(shop, "u" + i, MemberRole.SALES_JUNIOR, true));
        allocationService.recompute(period.getId());

        List<LeaderboardRowView> rows = leaderboardService.getRows(leaderboardService.computeSnapshot(period.getId(), null).id());

        assertEquals(16, rows.size());
        assertEquals(IntStream.rangeClosed(1, 16).boxed().toList(), rows.stream().map(LeaderboardRowView::rank).toList());
    }

    @Test
    void unknownSnapshot() {
        assertThrows(NotFoundException.class, () -> leaderboardService.getRows(-1L));
    }

    @Test
    void currentIsEmptyBeforeFirstSnapshot() {
        Period period = configuredPeriod(newShop());

        assertTrue(leaderboardService.currentRows(period.getId()).isEmpty());
    }

    @Test
    @DisplayName("A total far above a small target is stored, not reported as a conflict")
    void hugeAchievementPct() {
        String shop = newShop();
        Period period = configuredPeriod(shop);
        allocationService.recompute(period.getId());
        sale(shop, "junior-a", MARCH.plusDays(1), "100000000.00");

        SnapshotView snapshot = leaderboardService.computeSnapshot(period.getId(), null);
        LeaderboardRowView top = leaderboardService.getRows(snapshot.id()).get(0);

        assertEquals("junior-a", top.userId());
        assertEquals(0, top.achievementPct().compareTo(d("50000000.00")));
        assertEquals(0, top.score().compareTo(d("100000000.00")));
    }

    @Test
    void duplicateSequenceIsRecognisedAsTheSequenceConstraint() {
        Period period = configuredPeriod(newShop());
        snapshotRepository.saveAndFlush(snapshot(period.getId(), 1));

        DataIntegrityViolationException ex = assertThrows(DataIntegrityViolationException.class,
                () -> snapshotRepository.saveAndFlush(snapshot(period.getId(), 1)));

        assertTrue(LeaderboardService.violates(ex, LeaderboardSnapshot.SEQUENCE_CONSTRAINT));
        assertFalse(LeaderboardService.violates(ex, "uk_some_other_constraint"));
        assertEquals(1, snapshotRepository.findByPeriodIdOrderByComputedAtDescSequenceNoDesc(period.getId()).size());
    }
}
