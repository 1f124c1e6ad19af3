package quest.gekko.salesboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.salesboard.domain.RecalcFlag;
import quest.gekko.salesboard.dto.RecalcStateView;
import quest.gekko.salesboard.repository.RecalcFlagRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Dirty flag per period. Set and cleared only inside the transaction that changes
 * configuration or replaces the derived targets, never on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecalcStateService {
    private final RecalcFlagRepository flagRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void markDirty(Long periodId, String reason) {
        RecalcFlag flag = flagRepository.findById(periodId).orElseGet(() -> newFlag(periodId));
        flag.setDirty(true);
        flag.setReason(reason);
        flag.setUpdatedAt(Instant.now(clock));
        flagRepository.save(flag);
        log.debug("Period {} marked dirty: {}", periodId, reason);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void markClean(Long periodId) {
        Instant now = Instant.now(clock);
        RecalcFlag flag = flagRepository.findById(periodId).orElseGet(() -> newFlag(periodId));
        flag.setDirty(false);
        flag.setReason(null);
        flag.setUpdatedAt(now);
        flag.setLastRecomputedAt(now);
        flagRepository.save(flag);
    }

    @Transactional(readOnly = true)
    public Optional<RecalcStateView> find(Long periodId) {
        return flagRepository.findById(periodId).map(RecalcStateView::from);
    }

    @Transactional(readOnly = true)
    public boolean isDirty(Long periodId) {
        return flagRepository.findById(periodId).map(RecalcFlag::isDirty).orElse(true);
    }

    @Transactional(readOnly = true)
    public List<Long> dirtyPeriodIds() {
        return flagRepository.findByDirtyTrueOrderByUpdatedAtAsc().stream()
                .map(RecalcFlag::getPeriodId)
                .toList();
    }

    private RecalcFlag newFlag(Long periodId) {
        RecalcFlag flag = new RecalcFlag();
        flag.setPeriodId(periodId);
        return flag;
    }
}
