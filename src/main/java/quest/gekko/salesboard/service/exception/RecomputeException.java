package quest.gekko.salesboard.service.exception;

import lombok.Getter;

@Getter
public class RecomputeException extends SalesboardException {
    private final Long periodId;

    public RecomputeException(Long periodId, String message) {
        super("RECOMPUTE_FAILED", "Recompute of period " + periodId + " failed: " + message);
        this.periodId = periodId;
    }

    public RecomputeException(Long periodId, String message, Throwable cause) {
        super("RECOMPUTE_FAILED", "Recompute of period " + periodId + " failed: " + message, cause);
        this.periodId = periodId;
    }
}
