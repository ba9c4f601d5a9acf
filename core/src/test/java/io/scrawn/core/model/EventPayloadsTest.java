package io.scrawn.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scrawn.core.error.PricingExpressionError;
import io.scrawn.core.error.ScrawnValidationException;
import io.scrawn.core.pricing.PriceExprSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for reading event payloads from loosely typed JSON. */
@DisplayName("EventPayloads")
class EventPayloadsTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return JSON.readTree(text);
    }

    @Nested
    @DisplayName("fromJson()")
    class Event {

        @Test
        @DisplayName("reads a direct amount")
        void amount() throws Exception {
            EventPayload payload = EventPayloads.fromJson(json("""
                    {"userId": "u123", "debitAmount": 5}
                    """));

            assertThat(payload.userId()).isEqualTo("u123");
            assertThat(payload.debit()).isEqualTo(Debit.amount(5));
        }

        @Test
        @DisplayName("reads a price tag")
        void tag() throws Exception {
            EventPayload payload = EventPayloads.fromJson(json("""
                    {"userId": "u123", "debitTag": "PREMIUM_FEATURE"}
                    """));

            assertThat(payload.debit()).isEqualTo(Debit.tag("PREMIUM_FEATURE"));
        }

        @Test
        @DisplayName("reads a pricing expression")
        void expression() throws Exception {
            EventPayload payload = EventPayloads.fromJson(json("""
                    {
                      "userId": "u123",
                      "debitExpr": {
                        "kind": "op",
                        "op": "MUL",
                        "args": [{"kind": "tag", "name": "PREMIUM_CALL"}, {"kind": "amount", "value": 3}]
                      }
                    }
                    """));

            assertThat(payload.debit()).isInstanceOf(Debit.Expression.class);
            Debit.Expression debit = (Debit.Expression) payload.debit();
            assertThat(PriceExprSerializer.serialize(debit.expr())).isEqualTo("mul(tag('PREMIUM_CALL'),3)");
        }

        @Test
        @DisplayName("explicit null counts as absent")
        void explicitNull() throws Exception {
            EventPayload payload = EventPayloads.fromJson(json("""
                    {"userId": "u123", "debitAmount": null, "debitTag": "FEE"}
                    """));

            assertThat(payload.debit()).isEqualTo(Debit.tag("FEE"));
        }

        @Test
        @DisplayName("rejects more than one debit field")
        void moreThanOne() throws Exception {
            JsonNode node = json("""
                    {"userId": "u123", "debitAmount": 5, "debitTag": "FEE"}
                    """);

            assertThatThrownBy(() -> EventPayloads.fromJson(node))
                    .isInstanceOf(ScrawnValidationException.class)
                    .hasMessage("Exactly one of debitAmount, debitTag or debitExpr must be provided, "
                            + "got: debitAmount, debitTag")
                    .extracting(e -> ((ScrawnValidationException) e).field())
                    .isNull();
        }

        @Test
        @DisplayName("rejects a payload with no debit field")
        void none() throws Exception {
            JsonNode node = json("""
                    {"userId": "u123"}
                    """);

            assertThatThrownBy(() -> EventPayloads.fromJson(node))
                    .isInstanceOf(ScrawnValidationException.class)
                    .hasMessageEndingWith("got: none");
        }

        @Test
        @DisplayName("wraps an invalid expression, keeping the expression error as cause")
        void invalidExpression() throws Exception {
            JsonNode node = json("""
                    {
                      "userId": "u123",
                      "debitExpr": {
                        "kind": "op",
                        "op": "DIV",
                        "args": [{"kind": "amount", "value": 100}, {"kind": "amount", "value": 0}]
                      }
                    }
                    """);

            assertThatThrownBy(() -> EventPayloads.fromJson(node))
                    .isInstanceOf(ScrawnValidationException.class)
                    .hasMessage("Invalid debitExpr: Division by zero: divisor at position 2 is 0")
                    .hasCauseInstanceOf(PricingExpressionError.class)
                    .extracting(e -> ((ScrawnValidationException) e).field())
                    .isEqualTo("debitExpr");
        }

        @Test
        @DisplayName("rejects a fractional amount")
        void fractionalAmount() throws Exception {
            JsonNode node = json("""
                    {"userId": "u123", "debitAmount": 2.5}
                    """);

            assertThatThrownBy(() -> EventPayloads.fromJson(node))
                    .isInstanceOf(ScrawnValidationException.class)
                    .hasMessage("debitAmount must be an integer number of cents, got: 2.5");
        }

        @Test
        @DisplayName("applies the payload range rules")
        void rangeRules() throws Exception {
            assertThatThrownBy(() -> EventPayloads.fromJson(json("""
                            {"userId": "u123", "debitAmount": 0}
                            """)))
                    .hasMessage("debitAmount must be a positive number, got: 0");
            assertThatThrownBy(() -> EventPayloads.fromJson(json("""
                            {"userId": "", "debitAmount": 1}
                            """)))
                    .hasMessage("userId must be a non-empty string");
            assertThatThrownBy(() -> EventPayloads.fromJson(json("""
                            {"userId": "u123", "debitTag": 7}
                            """)))
                    .hasMessage("debitTag must be a non-empty string");
        }

        @Test
        @DisplayName("rejects input that is not an object")
        void notAnObject() throws Exception {
            assertThatThrownBy(() -> EventPayloads.fromJson(json("[]")))
                    .isInstanceOf(ScrawnValidationException.class)
                    .hasMessage("Event payload must be a JSON object");
            assertThatThrownBy(() -> EventPayloads.fromJson(null)).isInstanceOf(ScrawnValidationException.class);
        }
    }

    @Nested
    @DisplayName("aiTokenUsageFromJson()")
    class AiTokenUsage {

        @Test
        @DisplayName("reads nested input and output debits")
        void nestedDebits() throws Exception {
            AiTokenUsagePayload payload = EventPayloads.aiTokenUsageFromJson(json("""
                    {
                      "userId": "u123",
                      "model": "gpt-4",
                      "inputTokens": 1200,
                      "outputTokens": 300,
                      "inputDebit": {"amount": 0},
                      "outputDebit": {
                        "expr": {
                          "kind": "op",
                          "op": "MUL",
                          "args": [{"kind": "tag", "name": "OUTPUT_RATE"}, {"kind": "amount", "value": 300}]
                        }
                      }
                    }
                    """));

            assertThat(payload.model()).isEqualTo("gpt-4");
            assertThat(payload.inputTokens()).isEqualTo(1200);
            assertThat(payload.outputTokens()).isEqualTo(300);
            assertThat(payload.inputDebit()).isEqualTo(Debit.amount(0));
            assertThat(payload.outputDebit()).isInstanceOf(Debit.Expression.class);
        }

        @Test
        @DisplayName("reports nested field paths")
        void nestedFieldPaths() throws Exception {
            JsonNode node = json("""
                    {
                      "userId": "u123",
                      "model": "gpt-4",
                      "inputTokens": 1,
                      "outputTokens": 1,
                      "inputDebit": {"tag": "IN"},
                      "outputDebit": {"expr": {"kind": "tag", "name": "9x"}}
                    }
                    """);

            assertThatThrownBy(() -> EventPayloads.aiTokenUsageFromJson(node))
                    .isInstanceOf(ScrawnValidationException.class)
                    .hasMessageStartingWith("Invalid outputDebit.expr: Tag name must start with a letter")
                    .extracting(e -> ((ScrawnValidationException) e).field())
                    .isEqualTo("outputDebit.expr");
        }

        @Test
        @DisplayName("rejects a nested debit with two variants")
        void nestedMoreThanOne() throws Exception {
            JsonNode node = json("""
                    {
                      "userId": "u123",
                      "model": "gpt-4",
                      "inputTokens": 1,
                      "outputTokens": 1,
                      "inputDebit": {"amount": 1, "tag": "IN"},
                      "outputDebit": {"amount": 1}
                    }
                    """);

            assertThatThrownBy(() -> EventPayloads.aiTokenUsageFromJson(node))
                    .hasMessage("Exactly one of amount, tag or expr must be provided, "
                            + "got: inputDebit.amount, inputDebit.tag");
        }

        @Test
        @DisplayName("rejects missing debits and negative token counts")
        void missingAndNegative() throws Exception {
            assertThatThrownBy(() -> EventPayloads.aiTokenUsageFromJson(json("""
                            {"userId": "u", "model": "m", "inputTokens": 1, "outputTokens": 1, "inputDebit": {"amount": 1}}
                            """)))
                    .hasMessage("outputDebit must be provided");
            assertThatThrownBy(() -> EventPayloads.aiTokenUsageFromJson(json("""
                            {"userId": "u", "model": "m", "inputTokens": -1, "outputTokens": 1,
                             "inputDebit": {"amount": 1}, "outputDebit": {"amount": 1}}
                            """)))
                    .hasMessage("inputTokens must be non-negative, got: -1");
            assertThatThrownBy(() -> EventPayloads.aiTokenUsageFromJson(json("""
                            {"userId": "u", "model": "m", "inputTokens": "many", "outputTokens": 1,
                             "inputDebit": {"amount": 1}, "outputDebit": {"amount": 1}}
                            """)))
                    .hasMessage("inputTokens must be an integer");
        }
    }
}
