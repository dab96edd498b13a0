package de.entwicklertraining.memory.client;

import java.time.Duration;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-call options of a request: query parameters, headers, body and timeout.
 * <p>
 * Example usage:
 * <pre>
 * RequestOptions options = RequestOptions.builder()
 *     .queryParam("q", "coffee")
 *     .queryParam("tag", "a")
 *     .queryParam("tag", "b")
 *     .header("Accept", "application/x-ndjson")
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 */
public final class RequestOptions {

    private static final RequestOptions NONE = builder().build();

    private final List<Map.Entry<String, String>> queryParams;
    private final Map<String, String> headers;
    private final Object body;
    private final Duration timeout;

    private RequestOptions(Builder builder) {
        this.queryParams = List.copyOf(builder.queryParams);
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.timeout = builder.timeout;
    }

    public static RequestOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.queryParams.addAll(queryParams);
        builder.headers.putAll(headers);
        builder.body = body;
        builder.timeout = timeout;
        return builder;
    }

    /**
     * Query parameters in insertion order. A key may repeat.
     *
     * @return the parameters
     */
    public List<Map.Entry<String, String>> getQueryParams() {
        return queryParams;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Optional<Object> getBody() {
        return Optional.ofNullable(body);
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * Builder for {@link RequestOptions}.
     */
    public static final class Builder {
        private final List<Map.Entry<String, String>> queryParams = new ArrayList<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;
        private Duration timeout;

        private Builder() {
        }

        /**
         * Appends a query parameter. Repeating a key adds another value, it never replaces.
         * A null value is skipped.
         *
         * @param name the parameter name
         * @param value the parameter value
         * @return this builder
         */
        public Builder queryParam(String name, Object value) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Query parameter name cannot be null or empty");
            }
            if (value != null) {
                queryParams.add(new AbstractMap.SimpleImmutableEntry<>(name, String.valueOf(value)));
            }
            return this;
        }

        public Builder queryParams(String name, Iterable<?> values) {
            for (Object value : values) {
                queryParam(name, value);
            }
            return this;
        }

        public Builder header(String name, String value) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Header name cannot be null or empty");
            }
            if (value == null) {
                throw new IllegalArgumentException("Header value cannot be null: " + name);
            }
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            headers.forEach(this::header);
            return this;
        }

        /**
         * Sets the request body. A {@link String} is sent verbatim; any other value is serialized to JSON.
         *
         * @param body the body, or null for none
         * @return this builder
         */
        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        /**
         * Overrides the client's default timeout for this call.
         *
         * @param timeout a positive duration
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
