package quest.gekko.salesboard.util;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.salesboard.config.SalesboardProperties;
import quest.gekko.salesboard.service.exception.ConcurrencyException;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per period. Waits up to the configured timeout, then gives up with a
 * {@link ConcurrencyException} instead of queueing indefinitely.
 * <p>
 * A period's entry lives only while some caller holds or waits for its lock.
 */
@Component
@RequiredArgsConstructor
public class PeriodLocks {
    private final SalesboardProperties.Allocation allocation;
    private final ConcurrentMap<Long, Slot> locks = new ConcurrentHashMap<>();

    // users is only touched inside compute, which the map runs atomically per key
    private static final class Slot {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    public <T> T call(Long periodId, Supplier<T> work) {
        return call(List.of(periodId), work);
    }

    /** Locks are taken in ascending period id order so two multi-period callers cannot deadlock. */
    public <T> T call(Collection<Long> periodIds, Supplier<T> work) {
        Deque<Long> held = new ArrayDeque<>();
        try {
            for (Long periodId : new TreeSet<>(periodIds)) {
                ReentrantLock lock = retain(periodId);
                boolean acquired = false;
                try {
                    acquired = lock.tryLock(allocation.lockTimeout().toMillis(), TimeUnit.MILLISECONDS);
                } finally {
                    if (!acquired) release(periodId);
                }
                if (!acquired) {
                    throw new ConcurrencyException(periodId);
                }
                held.push(periodId);
            }
            return work.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyException(periodIds.iterator().next(), e);
        } finally {
            while (!held.isEmpty()) {
                Long periodId = held.pop();
                locks.get(periodId).lock.unlock();
                release(periodId);
            }
        }
    }

    /** Whether some thread is working on the period right now. */
    public boolean isLocked(Long periodId) {
        Slot slot = locks.get(periodId);
        return slot != null && slot.lock.isLocked();
    }

    int trackedPeriods() {
        return locks.size();
    }

    private ReentrantLock retain(Long periodId) {
        return locks.compute(periodId, (id, slot) -> {
            Slot s = slot == null ? new Slot() : slot;
            s.users++;
            return s;
        }).lock;
    }

    private void release(Long periodId) {
        locks.computeIfPresent(periodId, (id, slot) -> --slot.users == 0 ? null : slot);
    }
}
