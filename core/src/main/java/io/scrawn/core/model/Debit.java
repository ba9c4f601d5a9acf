package io.scrawn.core.model;

import io.scrawn.core.pricing.PriceExpr;
import java.util.Objects;

/**
 * What an event debits from the user: a direct amount, a named price tag, or a pricing
 * expression. Exactly one of the three is carried per event; the sealed hierarchy makes any other
 * combination unrepresentable.
 *
 * <p>
 * Range rules (positive vs. non-negative amounts, non-empty tags) depend on the payload and
 * are enforced by {@link EventPayload} and {@link AiTokenUsagePayload}.
 */
public sealed interface Debit {

    static Debit amount(long cents) {
        return new Amount(cents);
    }

    static Debit tag(String name) {
        return new Tag(name);
    }

    static Debit expression(PriceExpr expr) {
        return new Expression(expr);
    }

    /** A direct amount in cents. */
    record Amount(long cents) implements Debit {}

    /** A price tag whose amount the backend looks up. */
    record Tag(String name) implements Debit {
        public Tag {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /** A pricing expression, sent in its canonical serialized form. */
    record Expression(PriceExpr expr) implements Debit {
        public Expression {
            Objects.requireNonNull(expr, "expr must not be null");
        }
    }
}
