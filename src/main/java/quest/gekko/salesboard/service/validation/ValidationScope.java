package quest.gekko.salesboard.service.validation;

public enum ValidationScope {
    /** Weekly distribution sum must not exceed 100.00. */
    DISTRIBUTION,
    /** Role weights of one week (or every week when none is given) must not exceed 100.00. */
    ROLE_WEIGHTS,
    /** Every split must be exactly 100.00 within tolerance, as required to publish or lock. */
    PUBLICATION
}
