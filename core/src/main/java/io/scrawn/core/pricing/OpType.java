package io.scrawn.core.pricing;

import java.util.Locale;

/** Arithmetic operators of the pricing DSL. Operands are applied left to right. */
public enum OpType {
    ADD,
    SUB,
    MUL,
    DIV;

    /** Lower-case operator name as it appears in the canonical form, e.g. {@code "add"}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
