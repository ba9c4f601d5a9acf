package io.scrawn.core.request;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.scrawn.core.config.ScrawnConfig;
import io.scrawn.core.model.AiTokenUsagePayload;
import io.scrawn.core.model.Debit;
import io.scrawn.core.model.EventPayload;
import io.scrawn.core.pricing.PriceExpr;
import io.scrawn.core.pricing.PriceExprSerializer;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes event payloads into the request fields handed to the transport layer.
 *
 * <p>
 * A debit is written as exactly one sibling field: {@code debitAmount} (number of cents),
 * {@code debitTag} (tag name), or {@code debitExpr} (the canonical serialization of the pricing
 * expression, embedded verbatim). AI token usage debits use the nested {@code amount}/{@code
 * tag}/{@code expr} form.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class EventRequestEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(EventRequestEncoder.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ScrawnConfig config;

    public EventRequestEncoder(ScrawnConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /** Encodes a billable event as {@code {userId, debitAmount | debitTag | debitExpr}}. */
    public ObjectNode encode(EventPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        ObjectNode request = NODES.objectNode();
        request.put("userId", payload.userId());
        writeDebit(request, payload.debit(), "debitAmount", "debitTag", "debitExpr", payload.userId());
        return request;
    }

    /** Encodes AI token usage with nested {@code inputDebit} and {@code outputDebit} objects. */
    public ObjectNode encode(AiTokenUsagePayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        ObjectNode request = NODES.objectNode();
        request.put("userId", payload.userId());
        request.put("model", payload.model());
        request.put("inputTokens", payload.inputTokens());
        request.put("outputTokens", payload.outputTokens());
        writeDebit(request.putObject("inputDebit"), payload.inputDebit(), "amount", "tag", "expr", payload.userId());
        writeDebit(request.putObject("outputDebit"), payload.outputDebit(), "amount", "tag", "expr", payload.userId());
        return request;
    }

    private void writeDebit(
            ObjectNode target, Debit debit, String amountField, String tagField, String exprField, String userId) {
        if (debit instanceof Debit.Amount amount) {
            target.put(amountField, amount.cents());
        } else if (debit instanceof Debit.Tag tag) {
            target.put(tagField, tag.name());
        } else if (debit instanceof Debit.Expression expression) {
            PriceExpr expr = expression.expr();
            target.put(exprField, PriceExprSerializer.serialize(expr));
            if (config.logExpressions() && LOG.isDebugEnabled()) {
                LOG.debug(
                        "Debit expression for user_id={}:\n{}",
                        userId,
                        PriceExprSerializer.prettyPrint(expr, config.prettyIndent()));
            }
        } else {
            throw new IllegalStateException("Unknown debit variant: " + debit);
        }
    }
}
