package io.scrawn.core.model;

/**
 * Payload of a single billable event (an SDK call or a tracked HTTP request).
 *
 * <p>
 * A direct {@code debitAmount} must be positive; a {@code debitTag} must be non-empty. An
 * expression debit is already valid by construction.
 *
 * @param userId user the event is billed to
 * @param debit  what to debit
 * @throws io.scrawn.core.error.ScrawnValidationException if a field is missing or out of range
 */
public record EventPayload(String userId, Debit debit) {

    public EventPayload {
        PayloadChecks.requireText(userId, "userId");
        PayloadChecks.requireDebit(debit, "debit");
        PayloadChecks.checkDebit(debit, "debitAmount", "debitTag", false);
    }
}
