package io.scrawn.core.error;

/**
 * Abstract base for all SDK exceptions. Never thrown directly; use {@link
 * ScrawnValidationException} or {@link ScrawnConfigException}.
 */
public abstract class ScrawnException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final boolean retryable;
    private final Integer statusCode;

    protected ScrawnException(String message, ErrorCode code, boolean retryable, Integer statusCode) {
        super(message);
        this.code = code;
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    protected ScrawnException(
            String message, Throwable cause, ErrorCode code, boolean retryable, Integer statusCode) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    /** Error code for programmatic handling. */
    public ErrorCode code() {
        return code;
    }

    /** Whether repeating the same call can succeed. */
    public boolean retryable() {
        return retryable;
    }

    /** HTTP-equivalent status code, or {@code null} if not applicable. */
    public Integer statusCode() {
        return statusCode;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
