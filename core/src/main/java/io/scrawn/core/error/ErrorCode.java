package io.scrawn.core.error;

/** Programmatic error codes carried by every {@link ScrawnException}. */
public enum ErrorCode {
    VALIDATION_ERROR,
    CONFIG_ERROR
}
