package io.scrawn.core.pricing;

/**
 * A pricing expression: a literal amount in cents, a reference to a backend-resolved price tag,
 * or an arithmetic operation over two or more sub-expressions.
 *
 * <p>
 * The hierarchy is sealed and every variant has a package-private constructor. Instances are
 * obtained from the {@link PriceExprs} builders or from {@link PriceExprJson#fromJson}, both of
 * which validate before returning, so any {@code PriceExpr} seen outside this package satisfies
 * every DSL invariant.
 *
 * <p>
 * Immutable and thread-safe. Equality is structural; {@link #toString()} returns the
 * canonical serialization.
 */
public sealed interface PriceExpr permits AmountExpr, TagExpr, OpExpr {

    /** Discriminator for the three node shapes. */
    enum Kind {
        AMOUNT,
        TAG,
        OP
    }

    Kind kind();

    /** Dispatches to the visitor method matching this node's variant. */
    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over the node variants. Adding a variant adds a method here, which
     * breaks every implementation until it handles the new shape.
     *
     * @param <R> result type
     */
    interface Visitor<R> {

        R visitAmount(AmountExpr amount);

        R visitTag(TagExpr tag);

        R visitOp(OpExpr op);
    }
}
