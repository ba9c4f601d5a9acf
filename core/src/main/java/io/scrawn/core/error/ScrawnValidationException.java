package io.scrawn.core.error;

/**
 * Thrown when an event payload fails validation before it is handed to the transport. Carries the
 * offending field name when one can be identified.
 */
public final class ScrawnValidationException extends ScrawnException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public ScrawnValidationException(String message, String field) {
        super(message, ErrorCode.VALIDATION_ERROR, false, 400);
        this.field = field;
    }

    public ScrawnValidationException(String message, Throwable cause, String field) {
        super(message, cause, ErrorCode.VALIDATION_ERROR, false, 400);
        this.field = field;
    }

    /** The payload field that failed validation, or {@code null} for whole-payload rules. */
    public String field() {
        return field;
    }
}
