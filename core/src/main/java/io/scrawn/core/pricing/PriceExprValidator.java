package io.scrawn.core.pricing;

import io.scrawn.core.error.PricingExpressionError;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SDK-side validation for pricing expressions.
 *
 * <p>
 * Only mistakes that are detectable with no external knowledge are rejected here:
 * <ul>
 * <li>non-finite or fractional literal amounts
 * <li>empty, whitespace-padded or malformed tag names
 * <li>operations with fewer than two arguments
 * <li>division by a literal zero
 * </ul>
 *
 * <p>
 * Tag existence, a tag or nested expression used as a divisor, overflow and negative results
 * are left to the backend evaluator, which knows live tag values. Rejecting those here would
 * reject expressions the backend accepts.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class PriceExprValidator {

    private static final Logger LOG = LoggerFactory.getLogger(PriceExprValidator.class);

    /** Starts with a letter or underscore; then letters, digits, underscores or hyphens. */
    private static final Pattern TAG_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_-]*$");

    private static final BigInteger MIN_CENTS = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger MAX_CENTS = BigInteger.valueOf(Long.MAX_VALUE);

    private static final Checker CHECKER = new Checker();

    private PriceExprValidator() {}

    /**
     * Validates the expression, depth-first and left to right across operation arguments.
     *
     * @param expr the expression to check
     * @throws PricingExpressionError on the first violation found
     */
    public static void validate(PriceExpr expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        expr.accept(CHECKER);
    }

    /**
     * Same check as {@link #validate(PriceExpr)}, reporting the outcome as a boolean. The
     * rejection reason is logged at DEBUG.
     */
    public static boolean isValid(PriceExpr expr) {
        if (expr == null) {
            return false;
        }
        try {
            validate(expr);
            return true;
        } catch (PricingExpressionError e) {
            LOG.debug("Price expression rejected: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Converts a numeric literal to cents. Integral boxed types are taken as-is; floating-point
     * and decimal values must be finite and have no fractional part.
     *
     * @throws PricingExpressionError if the value is null, not finite, not an integer, or does
     *     not fit in a signed 64-bit integer
     */
    static long toCents(Number value) {
        if (value == null) {
            throw new PricingExpressionError("Amount must be a finite number, got: null");
        }
        if (value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof AtomicLong
                || value instanceof AtomicInteger) {
            return value.longValue();
        }
        if (value instanceof BigInteger big) {
            return checkRange(big, value);
        }
        if (value instanceof BigDecimal decimal) {
            if (decimal.signum() != 0 && decimal.stripTrailingZeros().scale() > 0) {
                throw notAnInteger(value);
            }
            return checkRange(decimal.toBigInteger(), value);
        }

        double d = value.doubleValue();
        if (!Double.isFinite(d)) {
            throw new PricingExpressionError("Amount must be a finite number, got: " + value);
        }
        if (d != Math.rint(d)) {
            throw notAnInteger(value);
        }
        // 2^63 is exactly representable; anything at or beyond it overflows a long
        if (d < -0x1p63 || d >= 0x1p63) {
            throw outOfRange(value);
        }
        return (long) d;
    }

    /**
     * Rejects an operation with fewer than two arguments. Checked before any argument is looked
     * at, so an arity error always wins over an error inside the arguments.
     */
    static void checkArity(OpType op, int argCount) {
        if (argCount < 2) {
            throw new PricingExpressionError(
                    "Operation " + op.wireName() + " requires at least 2 arguments, got: " + argCount);
        }
    }

    static void checkTagName(String name) {
        if (name == null) {
            throw new PricingExpressionError("Tag name must be a string, got: null");
        }
        if (name.isEmpty()) {
            throw new PricingExpressionError("Tag name cannot be empty");
        }
        if (name.chars().allMatch(PriceExprValidator::isTrimmable)) {
            throw new PricingExpressionError("Tag name cannot be only whitespace");
        }
        if (isTrimmable(name.charAt(0)) || isTrimmable(name.charAt(name.length() - 1))) {
            throw new PricingExpressionError("Tag name cannot have leading or trailing whitespace: \"" + name + "\"");
        }
        if (!TAG_NAME.matcher(name).matches()) {
            throw new PricingExpressionError("Tag name must start with a letter or underscore and contain only "
                    + "alphanumeric characters, underscores, or hyphens: \"" + name + "\"");
        }
    }

    /**
     * Unicode whitespace for tag names: Java whitespace plus space separators such as
     * U+00A0, and the byte order mark.
     */
    private static boolean isTrimmable(int c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }

    private static long checkRange(BigInteger big, Number original) {
        if (big.compareTo(MIN_CENTS) < 0 || big.compareTo(MAX_CENTS) > 0) {
            throw outOfRange(original);
        }
        return big.longValue();
    }

    private static PricingExpressionError notAnInteger(Number value) {
        return new PricingExpressionError("Amount must be an integer (cents), got: " + value
                + ". Hint: Use cents instead of dollars (e.g., 250 instead of 2.50)");
    }

    private static PricingExpressionError outOfRange(Number value) {
        return new PricingExpressionError("Amount must fit in a 64-bit signed integer (cents), got: " + value);
    }

    /** Recursive walk; returns nothing, throws on the first violation. */
    private static final class Checker implements PriceExpr.Visitor<Void> {

        @Override
        public Void visitAmount(AmountExpr amount) {
            // long cents are finite integers by construction
            return null;
        }

        @Override
        public Void visitTag(TagExpr tag) {
            checkTagName(tag.name());
            return null;
        }

        @Override
        public Void visitOp(OpExpr op) {
            List<PriceExpr> args = op.args();
            checkArity(op.op(), args.size());

            for (PriceExpr arg : args) {
                arg.accept(this);
            }

            if (op.op() == OpType.DIV) {
                // Only literal zeros; tag and nested divisors are the backend's call
                for (int i = 1; i < args.size(); i++) {
                    if (args.get(i) instanceof AmountExpr divisor && divisor.value() == 0) {
                        throw new PricingExpressionError(
                                "Division by zero: divisor at position " + (i + 1) + " is 0");
                    }
                }
            }
            return null;
        }
    }
}
