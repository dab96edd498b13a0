package de.entwicklertraining.memory.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Connection-level configuration: where requests go, how they authenticate, and which
 * headers every request carries.
 * <p>
 * Example usage:
 * <pre>
 * ApiHttpConfiguration httpConfig = ApiHttpConfiguration.builder()
 *     .baseUrl("https://api.example.com")
 *     .apiKey("your-api-key")
 *     .header("X-Custom-Header", "value")
 *     .build();
 * </pre>
 */
public final class ApiHttpConfiguration {

    private final BaseUrl baseUrl;
    private final ApiKey apiKey;
    private final Map<String, String> globalHeaders;

    private ApiHttpConfiguration(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.apiKey = Objects.requireNonNull(builder.apiKey, "An API key is required");
        this.globalHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.globalHeaders));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.baseUrl = baseUrl;
        builder.apiKey = apiKey;
        builder.globalHeaders.putAll(globalHeaders);
        return builder;
    }

    public BaseUrl getBaseUrl() {
        return baseUrl;
    }

    public ApiKey getApiKey() {
        return apiKey;
    }

    /**
     * Gets the headers added to all requests, without the authorization header.
     *
     * @return an unmodifiable map of global headers
     */
    public Map<String, String> getGlobalHeaders() {
        return globalHeaders;
    }

    /**
     * Gets the default headers of every request: the global headers plus
     * {@code Authorization: Bearer <key>}.
     *
     * @return an unmodifiable, case-insensitive map
     */
    public Map<String, String> getDefaultHeaders() {
        TreeMap<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(globalHeaders);
        headers.put("Authorization", apiKey.authorizationHeader());
        return Collections.unmodifiableMap(headers);
    }

    @Override
    public String toString() {
        return "ApiHttpConfiguration[baseUrl=" + baseUrl + ", headers=" + globalHeaders.keySet() + "]";
    }

    /**
     * Builder for {@link ApiHttpConfiguration}.
     */
    public static final class Builder {
        private BaseUrl baseUrl = BaseUrl.of(BaseUrl.DEFAULT);
        private ApiKey apiKey;
        private final Map<String, String> globalHeaders = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = BaseUrl.of(baseUrl);
            return this;
        }

        public Builder baseUrl(BaseUrl baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = new ApiKey(apiKey);
            return this;
        }

        public Builder apiKey(ApiKey apiKey) {
            this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
            return this;
        }

        /**
         * Adds a header sent with every request. The {@code Authorization} header is derived
         * from the API key and cannot be set here.
         *
         * @param name the header name
         * @param value the header value
         * @return this builder
         */
        public Builder header(String name, String value) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Header name cannot be null or empty");
            }
            if ("Authorization".equalsIgnoreCase(name)) {
                throw new IllegalArgumentException("Use apiKey(...) to configure authorization");
            }
            globalHeaders.put(name, Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            headers.forEach(this::header);
            return this;
        }

        public ApiHttpConfiguration build() {
            return new ApiHttpConfiguration(this);
        }
    }
}
