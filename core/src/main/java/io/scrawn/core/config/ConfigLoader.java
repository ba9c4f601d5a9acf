package io.scrawn.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.scrawn.core.error.ScrawnConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link ScrawnConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * client:
 *   api-key: sk_test_...
 *   base-url: https://api.scrawn.dev
 * pricing:
 *   pretty-indent: 2
 * logging:
 *   log-expressions: false
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable ({@code SCRAWN_API_KEY}, {@code
 * SCRAWN_BASE_URL}, {@code SCRAWN_PRETTY_INDENT}, {@code SCRAWN_LOG_EXPRESSIONS}). Env vars take
 * precedence over YAML values. An env var counts as set only if it is defined AND its trimmed
 * value is non-empty.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ScrawnConfig} from the given YAML file, applying overrides from {@link
     * System#getenv}.
     *
     * @throws ScrawnConfigException if the file is missing, is not valid YAML, or yields an
     *     invalid configuration
     */
    public static ScrawnConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ScrawnConfig} from the given YAML file, applying overrides from the supplied
     * lookup function. Returning {@code null} from {@code envLookup} means the variable is not
     * defined.
     *
     * @throws ScrawnConfigException if the file is missing, is not valid YAML, or yields an
     *     invalid configuration
     */
    public static ScrawnConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ScrawnConfigException("Configuration file not found: " + configPath);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ScrawnConfigException("Failed to parse YAML configuration: " + configPath, e);
        }
        ScrawnConfig config = mapToConfig(root, envLookup);
        LOG.info(
                "Loaded Scrawn configuration: source={}, baseUrl={}, prettyIndent={}, logExpressions={}",
                configPath,
                config.baseUrl(),
                config.prettyIndent(),
                config.logExpressions());
        return config;
    }

    /** Builds a configuration from environment variables alone. */
    public static ScrawnConfig fromEnv(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup);
    }

    private static ScrawnConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ScrawnConfig.Builder builder = ScrawnConfig.builder();

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ScrawnConfigException("Configuration root must be a mapping, got: " + root.getNodeType());
            }
            JsonNode client = root.path("client");
            yamlString(client, "api-key", "client.api-key", builder::apiKey);
            yamlString(client, "base-url", "client.base-url", builder::baseUrl);

            JsonNode pricing = root.path("pricing");
            if (pricing.has("pretty-indent")) {
                JsonNode indent = pricing.get("pretty-indent");
                if (!indent.canConvertToInt() || !indent.isIntegralNumber()) {
                    throw new ScrawnConfigException("pricing.pretty-indent must be an integer, got: " + indent);
                }
                builder.prettyIndent(indent.intValue());
            }

            JsonNode logging = root.path("logging");
            JsonNode logExpressions = logging.get("log-expressions");
            if (logExpressions != null && !logExpressions.isNull()) {
                if (!logExpressions.isBoolean()) {
                    throw new ScrawnConfigException(
                            "logging.log-expressions must be true or false, got: " + logExpressions);
                }
                builder.logExpressions(logExpressions.booleanValue());
            }
        }

        // --- Environment variable overlay ---
        envString(envLookup, "SCRAWN_API_KEY", builder::apiKey);
        envString(envLookup, "SCRAWN_BASE_URL", builder::baseUrl);
        envInt(envLookup, "SCRAWN_PRETTY_INDENT", builder::prettyIndent);
        envBool(envLookup, "SCRAWN_LOG_EXPRESSIONS", builder::logExpressions);

        return builder.build();
    }

    // --- YAML helpers ---

    /** An empty YAML value ({@code key:}) counts as unset, like a blank env var. */
    private static void yamlString(JsonNode section, String key, String path, Consumer<String> setter) {
        JsonNode value = section.get(key);
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.isTextual()) {
            throw new ScrawnConfigException(path + " must be a string, got: " + value);
        }
        setter.accept(value.textValue());
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, Consumer<Integer> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ScrawnConfigException("Environment variable " + envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                throw new ScrawnConfigException("Environment variable " + envVar + " must be true or false, got: " + value);
            }
            setter.accept(Boolean.parseBoolean(value));
        }
    }
}
