package quest.gekko.salesboard.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.salesboard.domain.Period;
import quest.gekko.salesboard.dto.RecomputeSummary;
import quest.gekko.salesboard.repository.PeriodRepository;
import quest.gekko.salesboard.service.core.RecalcStateService;
import quest.gekko.salesboard.service.core.TargetAllocationService;
import quest.gekko.salesboard.service.exception.SalesboardException;
import quest.gekko.salesboard.util.PeriodLocks;

import java.util.Optional;

/**
 * Recomputes periods left dirty by configuration or membership changes. Off unless
 * {@code salesboard.recalc.sweep.cron} is set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecalcSweepScheduler {
    private final RecalcStateService recalcState;
    private final PeriodRepository periodRepository;
    private final TargetAllocationService allocationService;
    private final RetryTemplate recomputeRetryTemplate;
    private final PeriodLocks periodLocks;

    @Scheduled(cron = "${salesboard.recalc.sweep.cron:-}", zone = "UTC")
    public void sweep() {
        int recomputed = 0;
        int failed = 0;
        for (Long periodId : recalcState.dirtyPeriodIds()) {
            Optional<Period> period = periodRepository.findById(periodId);
            if (period.isEmpty() || period.get().isFrozen()) continue;
            if (periodLocks.isLocked(periodId)) {
                log.debug("Sweep skips period {}, a write is in progress", periodId);
                continue;
            }
            try {
                RecomputeSummary summary = recomputeRetryTemplate.execute(ctx -> allocationService.recompute(periodId));
                log.debug("Sweep recomputed period {}: {} rows", periodId, summary.targetRows());
                recomputed++;
            } catch (SalesboardException e) {
                // stays dirty, picked up again next run
                log.warn("Sweep could not recompute period {} [{}]: {}", periodId, e.getCode(), e.getMessage());
                failed++;
            }
        }
        if (recomputed + failed > 0) {
            log.info("Recalc sweep finished: {} recomputed, {} failed", recomputed, failed);
        }
    }
}
