package quest.gekko.salesboard.service.exception;

import lombok.Getter;

/** Another recompute or configuration write holds the period. Safe to retry. */
@Getter
public class ConcurrencyException extends SalesboardException {
    private final Long periodId;

    public ConcurrencyException(Long periodId) {
        super("CONCURRENT_MODIFICATION", "Period " + periodId + " is being modified, retry shortly");
        this.periodId = periodId;
    }

    public ConcurrencyException(Long periodId, Throwable cause) {
        super("CONCURRENT_MODIFICATION", "Period " + periodId + " is being modified, retry shortly", cause);
        this.periodId = periodId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
