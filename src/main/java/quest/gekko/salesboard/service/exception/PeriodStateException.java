package quest.gekko.salesboard.service.exception;

import quest.gekko.salesboard.domain.PeriodStatus;

public class PeriodStateException extends SalesboardException {

    private PeriodStateException(String code, String message) {
        super(code, message);
    }

    public static PeriodStateException frozen(Long periodId, PeriodStatus status) {
        return new PeriodStateException("PERIOD_FROZEN",
                "Period " + periodId + " is " + status + " and can no longer be changed");
    }

    public static PeriodStateException invalidTransition(Long periodId, PeriodStatus from, PeriodStatus to) {
        return new PeriodStateException("INVALID_TRANSITION",
                "Invalid status transition for period " + periodId + ": " + from + " -> " + to);
    }

    public static PeriodStateException stale(Long periodId, String reason) {
        return new PeriodStateException("RECALC_PENDING",
                "Period " + periodId + " has stale targets (" + reason + "), recompute before changing status");
    }
}
