package io.scrawn.core.pricing;

import java.util.List;
import java.util.Objects;

/**
 * An arithmetic operation over its arguments, applied left to right. Argument order is part of
 * the expression's identity: {@code sub(a, b)} and {@code sub(b, a)} are different expressions.
 */
public final class OpExpr implements PriceExpr {

    private final OpType op;
    private final List<PriceExpr> args;

    OpExpr(OpType op, List<PriceExpr> args) {
        this.op = Objects.requireNonNull(op, "op must not be null");
        this.args = List.copyOf(args);
    }

    public OpType op() {
        return op;
    }

    /** Unmodifiable argument list, in evaluation order. */
    public List<PriceExpr> args() {
        return args;
    }

    @Override
    public Kind kind() {
        return Kind.OP;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitOp(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OpExpr that)) return false;
        return op == that.op && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, args);
    }

    @Override
    public String toString() {
        return PriceExprSerializer.serialize(this);
    }
}
