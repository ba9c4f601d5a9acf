package io.scrawn.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.scrawn.core.error.PricingExpressionError;
import io.scrawn.core.error.ScrawnValidationException;
import io.scrawn.core.pricing.PriceExprJson;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads event payloads from loosely typed JSON, e.g. a body extracted from an incoming request.
 *
 * <p>
 * Event payload shape:
 *
 * <pre>{@code
 * {"userId": "u123", "debitAmount": 5}
 * {"userId": "u123", "debitTag": "PREMIUM_FEATURE"}
 * {"userId": "u123", "debitExpr": {"kind": "op", "op": "MUL", "args": [...]}}
 * }</pre>
 *
 * <p>
 * Exactly one of {@code debitAmount}, {@code debitTag}, {@code debitExpr} must be present
 * (an explicit {@code null} counts as absent). An invalid {@code debitExpr} surfaces as a {@link
 * ScrawnValidationException} whose cause is the underlying {@link PricingExpressionError}.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class EventPayloads {

    private EventPayloads() {}

    /**
     * Reads an {@link EventPayload}.
     *
     * @throws ScrawnValidationException if the JSON does not describe a valid payload
     */
    public static EventPayload fromJson(JsonNode node) {
        requireObject(node, "Event payload");
        String userId = text(node, "userId");
        Debit debit = debit(node, "debitAmount", "debitTag", "debitExpr");
        return new EventPayload(userId, debit);
    }

    /**
     * Reads an {@link AiTokenUsagePayload}. Each of {@code inputDebit} and {@code outputDebit} is
     * an object with exactly one of {@code amount}, {@code tag}, {@code expr}.
     *
     * @throws ScrawnValidationException if the JSON does not describe a valid payload
     */
    public static AiTokenUsagePayload aiTokenUsageFromJson(JsonNode node) {
        requireObject(node, "AI token usage payload");
        String userId = text(node, "userId");
        String model = text(node, "model");
        long inputTokens = tokenCount(node, "inputTokens");
        long outputTokens = tokenCount(node, "outputTokens");
        Debit inputDebit = nestedDebit(node, "inputDebit");
        Debit outputDebit = nestedDebit(node, "outputDebit");
        return new AiTokenUsagePayload(userId, model, inputTokens, outputTokens, inputDebit, outputDebit);
    }

    private static Debit nestedDebit(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new ScrawnValidationException(field + " must be provided", field);
        }
        requireObject(node, field);
        return debit(node, field + ".amount", field + ".tag", field + ".expr");
    }

    /**
     * Picks the single debit field present in {@code node}. Field arguments are full paths used in
     * messages; the last path segment is the JSON property name.
     */
    private static Debit debit(JsonNode node, String amountField, String tagField, String exprField) {
        List<String> present = new ArrayList<>(3);
        for (String field : List.of(amountField, tagField, exprField)) {
            if (isPresent(node, property(field))) {
                present.add(field);
            }
        }
        if (present.size() != 1) {
            throw new ScrawnValidationException(
                    "Exactly one of " + property(amountField) + ", " + property(tagField) + " or " + property(exprField)
                            + " must be provided, got: " + (present.isEmpty() ? "none" : String.join(", ", present)),
                    null);
        }

        String field = present.get(0);
        JsonNode value = node.get(property(field));
        if (field.equals(amountField)) {
            if (!value.isIntegralNumber() || !value.canConvertToLong()) {
                throw new ScrawnValidationException(field + " must be an integer number of cents, got: " + value, field);
            }
            return Debit.amount(value.longValue());
        }
        if (field.equals(tagField)) {
            if (!value.isTextual()) {
                throw new ScrawnValidationException(field + " must be a non-empty string", field);
            }
            return Debit.tag(value.asText());
        }
        try {
            return Debit.expression(PriceExprJson.fromJson(value));
        } catch (PricingExpressionError e) {
            throw new ScrawnValidationException("Invalid " + field + ": " + e.getMessage(), e, field);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new ScrawnValidationException(field + " must be a non-empty string", field);
        }
        return value.asText();
    }

    private static long tokenCount(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new ScrawnValidationException(field + " must be an integer", field);
        }
        return value.longValue();
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new ScrawnValidationException(what + " must be a JSON object", null);
        }
    }

    private static boolean isPresent(JsonNode node, String property) {
        JsonNode value = node.get(property);
        return value != null && !value.isNull();
    }

    private static String property(String path) {
        return path.substring(path.lastIndexOf('.') + 1);
    }
}
