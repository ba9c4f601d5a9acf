package io.scrawn.core.model;

import io.scrawn.core.error.ScrawnValidationException;

/** Field rules shared by the payload records. */
final class PayloadChecks {

    private PayloadChecks() {}

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ScrawnValidationException(field + " must be a non-empty string", field);
        }
    }

    static void requireNonNegative(long value, String field) {
        if (value < 0) {
            throw new ScrawnValidationException(field + " must be non-negative, got: " + value, field);
        }
    }

    static void requireDebit(Debit debit, String field) {
        if (debit == null) {
            throw new ScrawnValidationException(field + " must be provided", field);
        }
    }

    /**
     * Applies the per-variant rules to a debit.
     *
     * @param amountField  field name reported for an amount violation
     * @param tagField     field name reported for a tag violation
     * @param allowZero    whether a zero amount is accepted
     */
    static void checkDebit(Debit debit, String amountField, String tagField, boolean allowZero) {
        if (debit instanceof Debit.Amount amount) {
            if (allowZero ? amount.cents() < 0 : amount.cents() <= 0) {
                throw new ScrawnValidationException(
                        amountField + " must be a " + (allowZero ? "non-negative" : "positive") + " number, got: "
                                + amount.cents(),
                        amountField);
            }
        } else if (debit instanceof Debit.Tag tag) {
            if (tag.name().isEmpty()) {
                throw new ScrawnValidationException(tagField + " must be a non-empty string", tagField);
            }
        }
    }
}
