package io.scrawn.core.pricing;

import java.util.Objects;

/** A symbolic price tag. The SDK never knows its value; the backend resolves it at evaluation. */
public final class TagExpr implements PriceExpr {

    private final String name;

    TagExpr(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public Kind kind() {
        return Kind.TAG;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTag(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagExpr that)) return false;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return PriceExprSerializer.serialize(this);
    }
}
