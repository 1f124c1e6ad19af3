package quest.gekko.salesboard.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import quest.gekko.salesboard.service.exception.ConcurrencyException;
import quest.gekko.salesboard.util.PeriodLocks;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction while holding the period lock, so the
 * lock is released only after commit or rollback.
 */
@Component
@RequiredArgsConstructor
public class PeriodTransactions {
    private final PeriodLocks periodLocks;
    private final TransactionTemplate transactionTemplate;

    public <T> T execute(Long periodId, Supplier<T> work) {
        return execute(List.of(periodId), work);
    }

    public <T> T execute(Collection<Long> periodIds, Supplier<T> work) {
        if (periodIds.isEmpty()) {
            return transactionTemplate.execute(status -> work.get());
        }
        return periodLocks.call(periodIds, () -> {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (PessimisticLockingFailureException e) {
                throw new ConcurrencyException(periodIds.iterator().next(), e);
            }
        });
    }
}
