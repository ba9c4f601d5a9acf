package io.scrawn.core.pricing;

import io.scrawn.core.error.PricingExpressionError;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders for pricing expressions, the only public construction path for {@link PriceExpr}.
 *
 * <p>
 * Every builder assembles its node and validates it before returning; on failure the call
 * itself throws {@link PricingExpressionError} and no node escapes. Operation builders accept
 * any mix of {@link PriceExpr} values and {@link Number} literals; numbers are wrapped as
 * {@link AmountExpr} (cents).
 *
 * <pre>{@code
 * import static io.scrawn.core.pricing.PriceExprs.*;
 *
 * // (PREMIUM_CALL * 3) + EXTRA_FEE + 250 cents
 * PriceExpr expr = add(mul(tag("PREMIUM_CALL"), 3), tag("EXTRA_FEE"), 250);
 * }</pre>
 *
 * <p>
 * The builders describe syntax only. No arithmetic is performed client-side.
 */
public final class PriceExprs {

    private PriceExprs() {}

    /**
     * Creates a reference to a named price tag.
     *
     * @param name tag name matching {@code ^[A-Za-z_][A-Za-z0-9_-]*$}
     * @throws PricingExpressionError if the name is null, empty, whitespace-padded or malformed
     */
    public static TagExpr tag(String name) {
        TagExpr expr = new TagExpr(name);
        PriceExprValidator.validate(expr);
        return expr;
    }

    /** Creates a literal amount in cents. Every {@code long} is a valid amount. */
    public static AmountExpr amount(long cents) {
        AmountExpr expr = new AmountExpr(cents);
        PriceExprValidator.validate(expr);
        return expr;
    }

    /**
     * Creates a literal amount from a floating-point value, e.g. one read from loosely typed
     * input.
     *
     * @throws PricingExpressionError if the value is NaN, infinite or has a fractional part
     */
    public static AmountExpr amount(double cents) {
        return amount(PriceExprValidator.toCents(cents));
    }

    /**
     * Creates a literal amount from any numeric type.
     *
     * @throws PricingExpressionError if the value is null, not finite, not an integer, or
     *     outside the {@code long} range
     */
    public static AmountExpr amount(Number cents) {
        return amount(PriceExprValidator.toCents(cents));
    }

    /** {@code args[0] + args[1] + ...} */
    public static OpExpr add(Object... args) {
        return op(OpType.ADD, args);
    }

    /** {@code args[0] - args[1] - ...}, left to right. */
    public static OpExpr sub(Object... args) {
        return op(OpType.SUB, args);
    }

    /** {@code args[0] * args[1] * ...} */
    public static OpExpr mul(Object... args) {
        return op(OpType.MUL, args);
    }

    /**
     * {@code args[0] / args[1] / ...}, left to right. The backend performs integer division and
     * truncates.
     *
     * @throws PricingExpressionError if any divisor is a literal zero; a tag divisor is accepted
     */
    public static OpExpr div(Object... args) {
        return op(OpType.DIV, args);
    }

    private static OpExpr op(OpType type, Object[] args) {
        int count = args == null ? 0 : args.length;
        PriceExprValidator.checkArity(type, count);

        List<PriceExpr> exprs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            exprs.add(toExpr(args[i], i + 1));
        }
        OpExpr expr = new OpExpr(type, exprs);
        PriceExprValidator.validate(expr);
        return expr;
    }

    /**
     * Coerces a builder argument: a {@link PriceExpr} passes through, a {@link Number} becomes an
     * {@link AmountExpr}.
     *
     * @param position 1-based argument position, for the error message
     */
    static PriceExpr toExpr(Object input, int position) {
        if (input instanceof PriceExpr expr) {
            return expr;
        }
        if (input instanceof Number number) {
            return new AmountExpr(PriceExprValidator.toCents(number));
        }
        throw new PricingExpressionError("Argument at position " + position
                + " must be a price expression or a number, got: "
                + (input == null ? "null" : input.getClass().getSimpleName()));
    }
}
