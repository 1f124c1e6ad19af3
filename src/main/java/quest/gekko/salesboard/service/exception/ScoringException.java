package quest.gekko.salesboard.service.exception;

import lombok.Getter;

@Getter
public class ScoringException extends SalesboardException {

    public enum Reason {
        /** No user week targets exist for the period yet. */
        NOT_COMPUTED,
        /** A concurrent snapshot claimed the same sequence number. */
        SNAPSHOT_CONFLICT,
        /** The snapshot could not be stored for any other reason; retrying will not help. */
        STORAGE_FAILED
    }

    private final Reason reason;
    private final Long periodId;

    private ScoringException(Reason reason, Long periodId, String message, Throwable cause) {
        super(reason.name(), message, cause);
        this.reason = reason;
        this.periodId = periodId;
    }

    public static ScoringException notComputed(Long periodId) {
        return new ScoringException(Reason.NOT_COMPUTED, periodId,
                "Targets for period " + periodId + " have not been computed, run a recompute first", null);
    }

    public static ScoringException conflict(Long periodId, Throwable cause) {
        return new ScoringException(Reason.SNAPSHOT_CONFLICT, periodId,
                "Another leaderboard snapshot for period " + periodId + " was written concurrently", cause);
    }

    public static ScoringException storageFailed(Long periodId, Throwable cause) {
        return new ScoringException(Reason.STORAGE_FAILED, periodId,
                "Leaderboard snapshot for period " + periodId + " could not be stored", cause);
    }

    @Override
    public boolean isRetryable() {
        return reason == Reason.SNAPSHOT_CONFLICT;
    }
}
