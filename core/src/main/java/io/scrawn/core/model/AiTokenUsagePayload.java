package io.scrawn.core.model;

/**
 * Token consumption for one AI model call or one streamed chunk. Input and output tokens are
 * billed separately, each through its own debit.
 *
 * @param userId       user the usage is billed to
 * @param model        model identifier, e.g. {@code gpt-4}
 * @param inputTokens  prompt tokens consumed, non-negative
 * @param outputTokens completion tokens produced, non-negative
 * @param inputDebit   debit for the input tokens; an amount must be non-negative
 * @param outputDebit  debit for the output tokens; an amount must be non-negative
 * @throws io.scrawn.core.error.ScrawnValidationException if a field is missing or out of range
 */
public record AiTokenUsagePayload(
        String userId, String model, long inputTokens, long outputTokens, Debit inputDebit, Debit outputDebit) {

    public AiTokenUsagePayload {
        PayloadChecks.requireText(userId, "userId");
        PayloadChecks.requireText(model, "model");
        PayloadChecks.requireNonNegative(inputTokens, "inputTokens");
        PayloadChecks.requireNonNegative(outputTokens, "outputTokens");
        PayloadChecks.requireDebit(inputDebit, "inputDebit");
        PayloadChecks.requireDebit(outputDebit, "outputDebit");
        PayloadChecks.checkDebit(inputDebit, "inputDebit.amount", "inputDebit.tag", true);
        PayloadChecks.checkDebit(outputDebit, "outputDebit.amount", "outputDebit.tag", true);
    }
}
