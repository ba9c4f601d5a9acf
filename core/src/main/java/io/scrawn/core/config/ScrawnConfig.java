package io.scrawn.core.config;

import io.scrawn.core.error.ScrawnConfigException;
import io.scrawn.core.pricing.PriceExprSerializer;

/**
 * SDK configuration. Use {@link #builder()} to construct instances; only {@code apiKey} is
 * required.
 *
 * @param apiKey         API key used to authenticate against the billing backend (required)
 * @param baseUrl        backend endpoint (default {@value #DEFAULT_BASE_URL})
 * @param prettyIndent   indentation width for pretty-printed expressions in logs (default 2)
 * @param logExpressions log each outbound pricing expression at DEBUG (default false)
 */
public record ScrawnConfig(String apiKey, String baseUrl, int prettyIndent, boolean logExpressions) {

    public static final String DEFAULT_BASE_URL = "https://api.scrawn.dev";

    public ScrawnConfig {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ScrawnConfigException("apiKey is required (client.api-key or SCRAWN_API_KEY)");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ScrawnConfigException("baseUrl must not be empty");
        }
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            throw new ScrawnConfigException("baseUrl must start with http:// or https://, got: " + baseUrl);
        }
        if (prettyIndent < 0) {
            throw new ScrawnConfigException("prettyIndent must not be negative, got: " + prettyIndent);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ScrawnConfig}. All fields have defaults except {@code apiKey}. */
    public static final class Builder {

        private String apiKey;
        private String baseUrl = DEFAULT_BASE_URL;
        private int prettyIndent = PriceExprSerializer.DEFAULT_INDENT;
        private boolean logExpressions;

        Builder() {}

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder prettyIndent(int prettyIndent) {
            this.prettyIndent = prettyIndent;
            return this;
        }

        public Builder logExpressions(boolean logExpressions) {
            this.logExpressions = logExpressions;
            return this;
        }

        public ScrawnConfig build() {
            return new ScrawnConfig(apiKey, baseUrl, prettyIndent, logExpressions);
        }
    }
}
