package io.scrawn.core.error;

/** Static helpers for classifying thrown errors. */
public final class ScrawnErrors {

    private ScrawnErrors() {}

    /** Returns {@code true} if {@code error} is an SDK exception. */
    public static boolean isScrawnError(Throwable error) {
        return error instanceof ScrawnException;
    }

    /** Returns {@code true} if {@code error} is an SDK exception flagged as retryable. */
    public static boolean isRetryable(Throwable error) {
        return error instanceof ScrawnException se && se.retryable();
    }
}
