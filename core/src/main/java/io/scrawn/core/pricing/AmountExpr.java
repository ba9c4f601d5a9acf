package io.scrawn.core.pricing;

/** A literal quantity in the smallest currency unit (cents). Negative values are allowed. */
public final class AmountExpr implements PriceExpr {

    private final long value;

    AmountExpr(long value) {
        this.value = value;
    }

    /** The amount in cents. */
    public long value() {
        return value;
    }

    @Override
    public Kind kind() {
        return Kind.AMOUNT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAmount(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AmountExpr that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return PriceExprSerializer.serialize(this);
    }
}
