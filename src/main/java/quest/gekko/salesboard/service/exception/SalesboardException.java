package quest.gekko.salesboard.service.exception;

import lombok.Getter;

/**
 * Base of every failure the allocation and scoring services report to callers.
 * The code is stable and safe to expose over the API.
 */
@Getter
public abstract class SalesboardException extends RuntimeException {
    private final String code;

    protected SalesboardException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected SalesboardException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public boolean isRetryable() {
        return false;
    }
}
