package io.scrawn.core.pricing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.scrawn.core.error.PricingExpressionError;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kind-tagged JSON form of pricing expressions, for logs and for accepting expressions from
 * untrusted input:
 *
 * <pre>{@code
 * {"kind":"op","op":"ADD","args":[{"kind":"amount","value":250},{"kind":"tag","name":"FEE"}]}
 * }</pre>
 *
 * <p>
 * Reading is two-phase. The document is first checked against the bundled JSON Schema
 * ({@code schema/price-expr.schema.json}, draft 2020-12) for shape only. The assembled tree is
 * then run once through {@link PriceExprValidator#validate}, so semantic errors carry exactly the
 * messages and ordering the builders produce. Nothing is returned unless both phases pass.
 *
 * <p>
 * This is not the wire format; use {@link PriceExprSerializer#serialize} for that.
 *
 * <p>
 * Thread-safe. All methods are static and the compiled schema is immutable.
 */
public final class PriceExprJson {

    private static final Logger LOG = LoggerFactory.getLogger(PriceExprJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final String SCHEMA_RESOURCE = "/schema/price-expr.schema.json";

    private static final JsonSchema SCHEMA = loadSchema();

    private static final PriceExpr.Visitor<ObjectNode> WRITER = new PriceExpr.Visitor<>() {
        @Override
        public ObjectNode visitAmount(AmountExpr amount) {
            ObjectNode node = NODES.objectNode();
            node.put("kind", "amount");
            node.put("value", amount.value());
            return node;
        }

        @Override
        public ObjectNode visitTag(TagExpr tag) {
            ObjectNode node = NODES.objectNode();
            node.put("kind", "tag");
            node.put("name", tag.name());
            return node;
        }

        @Override
        public ObjectNode visitOp(OpExpr op) {
            ObjectNode node = NODES.objectNode();
            node.put("kind", "op");
            node.put("op", op.op().name());
            ArrayNode args = node.putArray("args");
            for (PriceExpr arg : op.args()) {
                args.add(arg.accept(this));
            }
            return node;
        }
    };

    private PriceExprJson() {}

    /** Renders the expression as a kind-tagged JSON object. */
    public static ObjectNode toJson(PriceExpr expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        return expr.accept(WRITER);
    }

    /**
     * Parses JSON text into a validated expression.
     *
     * @throws PricingExpressionError if the text is not JSON, does not have the expression shape,
     *     or violates a DSL invariant
     */
    public static PriceExpr fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PricingExpressionError("Malformed price expression JSON: " + e.getOriginalMessage(), e);
        }
        return fromJson(root);
    }

    /**
     * Converts a JSON tree into a validated expression.
     *
     * @throws PricingExpressionError if the tree does not have the expression shape or violates a
     *     DSL invariant
     */
    public static PriceExpr fromJson(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            throw new PricingExpressionError("Malformed price expression JSON: document is empty");
        }
        Set<ValidationMessage> errors = SCHEMA.validate(node);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new PricingExpressionError("Malformed price expression JSON: " + detail);
        }
        PriceExpr expr = assemble(node);
        PriceExprValidator.validate(expr);
        return expr;
    }

    /** Returns {@code true} if {@link #fromJson(JsonNode)} would succeed. */
    public static boolean isValid(JsonNode node) {
        try {
            fromJson(node);
            return true;
        } catch (PricingExpressionError e) {
            LOG.debug("Price expression JSON rejected: {}", e.getMessage());
            return false;
        }
    }

    /** Builds unvalidated nodes from a schema-conforming tree; the caller validates the root. */
    private static PriceExpr assemble(JsonNode node) {
        String kind = node.get("kind").asText();
        return switch (kind) {
            case "amount" -> new AmountExpr(cents(node.get("value")));
            case "tag" -> new TagExpr(node.get("name").asText());
            case "op" -> {
                List<PriceExpr> args = new ArrayList<>();
                for (JsonNode arg : node.get("args")) {
                    args.add(assemble(arg));
                }
                yield new OpExpr(OpType.valueOf(node.get("op").asText()), args);
            }
            default -> throw new PricingExpressionError("Malformed price expression JSON: unknown kind '" + kind + "'");
        };
    }

    private static long cents(JsonNode value) {
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        return PriceExprValidator.toCents(value.numberValue());
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = PriceExprJson.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Price expression schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read price expression schema: " + SCHEMA_RESOURCE, e);
        }
    }
}
