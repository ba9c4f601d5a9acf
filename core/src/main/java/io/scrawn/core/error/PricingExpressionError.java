package io.scrawn.core.error;

/**
 * Thrown when a pricing expression violates one of the DSL invariants (literal amounts must be
 * finite integer cents, tag names must be well-formed, operators need at least two arguments,
 * no division by a literal zero).
 *
 * <p>
 * Carries a human-readable message only. It is deliberately outside the {@link
 * ScrawnException} taxonomy; the payload layer wraps it in a {@link ScrawnValidationException}
 * when it surfaces to SDK users.
 */
public final class PricingExpressionError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PricingExpressionError(String message) {
        super(message);
    }

    public PricingExpressionError(String message, Throwable cause) {
        super(message, cause);
    }
}
