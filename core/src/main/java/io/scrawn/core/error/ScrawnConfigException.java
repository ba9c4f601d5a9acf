package io.scrawn.core.error;

/**
 * Thrown when SDK configuration cannot be loaded: missing file, invalid YAML, or an invalid or
 * missing required value.
 */
public final class ScrawnConfigException extends ScrawnException {

    private static final long serialVersionUID = 1L;

    public ScrawnConfigException(String message) {
        super(message, ErrorCode.CONFIG_ERROR, false, null);
    }

    public ScrawnConfigException(String message, Throwable cause) {
        super(message, cause, ErrorCode.CONFIG_ERROR, false, null);
    }
}
