package io.scrawn.core.pricing;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts pricing expressions to their string forms.
 *
 * <p>
 * The canonical form is a wire contract with the backend parser:
 *
 * <pre>
 * expr      := amount | tag_ref | op_call
 * amount    := integer literal, e.g. 250, -50, 0
 * tag_ref   := "tag('" escaped-name "')"
 * op_call   := op-name "(" expr ("," expr)* ")"
 * op-name   := "add" | "sub" | "mul" | "div"
 * </pre>
 *
 * <p>
 * Within a tag reference a single quote is written as {@code \'}. There is no whitespace
 * anywhere and no reordering, so structurally-equal expressions serialize to byte-identical
 * strings and structurally different ones never collide.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class PriceExprSerializer {

    /** Default indentation width for {@link #prettyPrint(PriceExpr)}. */
    public static final int DEFAULT_INDENT = 2;

    private static final PriceExpr.Visitor<String> CANONICAL = new PriceExpr.Visitor<>() {
        @Override
        public String visitAmount(AmountExpr amount) {
            return Long.toString(amount.value());
        }

        @Override
        public String visitTag(TagExpr tag) {
            return tagRef(tag.name());
        }

        @Override
        public String visitOp(OpExpr op) {
            return op.args().stream()
                    .map(arg -> arg.accept(this))
                    .collect(Collectors.joining(",", op.op().wireName() + "(", ")"));
        }
    };

    private PriceExprSerializer() {}

    /**
     * Returns the canonical single-line form, e.g. {@code add(mul(tag('PREMIUM_CALL'),3),250)}.
     * This is the only representation meant to leave the process.
     */
    public static String serialize(PriceExpr expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        return expr.accept(CANONICAL);
    }

    /** Multi-line form with two-space indentation. */
    public static String prettyPrint(PriceExpr expr) {
        return prettyPrint(expr, DEFAULT_INDENT);
    }

    /**
     * Returns an indented multi-line form for logs and debugging. Same tokens as the canonical
     * form; each operation argument goes on its own line. Never use this on the wire.
     *
     * <pre>
     * add(
     *   mul(
     *     tag('PREMIUM'),
     *     3
     *   ),
     *   100
     * )
     * </pre>
     *
     * @param indent spaces per nesting level
     * @throws IllegalArgumentException if {@code indent} is negative
     */
    public static String prettyPrint(PriceExpr expr, int indent) {
        Objects.requireNonNull(expr, "expr must not be null");
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative, got: " + indent);
        }
        return expr.accept(new PrettyPrinter(indent, 0));
    }

    private static String tagRef(String name) {
        return "tag('" + name.replace("'", "\\'") + "')";
    }

    /** Renders one nesting level; operation arguments are rendered one level deeper. */
    private static final class PrettyPrinter implements PriceExpr.Visitor<String> {

        private final int indent;
        private final int level;

        PrettyPrinter(int indent, int level) {
            this.indent = indent;
            this.level = level;
        }

        @Override
        public String visitAmount(AmountExpr amount) {
            return Long.toString(amount.value());
        }

        @Override
        public String visitTag(TagExpr tag) {
            return tagRef(tag.name());
        }

        @Override
        public String visitOp(OpExpr op) {
            PrettyPrinter nested = new PrettyPrinter(indent, level + 1);
            String argPad = " ".repeat((level + 1) * indent);
            String args = op.args().stream()
                    .map(arg -> argPad + arg.accept(nested))
                    .collect(Collectors.joining(",\n"));
            return op.op().wireName() + "(\n" + args + "\n" + " ".repeat(level * indent) + ")";
        }
    }
}
