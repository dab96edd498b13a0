package de.entwicklertraining.memory.client;

import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Turns a method, a relative path and {@link RequestOptions} into an {@link ApiHttpRequest}.
 * <p>
 * Default headers are applied first and per-call headers override them, matching names
 * case-insensitively. A body that is not a {@link String} is serialized to JSON, and
 * {@code Content-Type: application/json} is added when the caller did not set one.
 * Failures come back as {@link ClientError.RequestError}; nothing is thrown.
 */
public final class RequestBuilder {

    private static final Logger logger = LoggerFactory.getLogger(RequestBuilder.class);

    static final String JSON_CONTENT_TYPE = "application/json";

    private final BaseUrl baseUrl;
    private final Map<String, String> defaultHeaders;
    private final Duration defaultTimeout;

    public RequestBuilder(BaseUrl baseUrl, Map<String, String> defaultHeaders, Duration defaultTimeout) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.defaultHeaders = Map.copyOf(Objects.requireNonNull(defaultHeaders, "defaultHeaders"));
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Builds a request.
     *
     * @param method the HTTP method
     * @param path the path relative to the base URL
     * @param options per-call options
     * @return the request, or a {@link ClientError.RequestError}
     */
    public ApiResult<ApiHttpRequest> build(HttpMethod method, String path, RequestOptions options) {
        Objects.requireNonNull(method, "method");
        RequestOptions opts = options == null ? RequestOptions.none() : options;
        if (path == null) {
            return ApiResult.failure(new ClientError.RequestError("Request path cannot be null", null, null));
        }

        URI uri;
        try {
            uri = withQuery(baseUrl.resolve(path), opts);
        } catch (IllegalArgumentException e) {
            return ApiResult.failure(new ClientError.RequestError(
                    "Invalid request path: " + e.getMessage(), e, "path=" + path));
        }

        TreeMap<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(defaultHeaders);
        // TreeMap keeps the first spelling of a key on put; remove so the caller's spelling wins
        for (Map.Entry<String, String> header : opts.getHeaders().entrySet()) {
            headers.remove(header.getKey());
            headers.put(header.getKey(), header.getValue());
        }

        byte[] body = null;
        Object bodyValue = opts.getBody().orElse(null);
        if (bodyValue instanceof String text) {
            if (!text.isEmpty()) {
                body = text.getBytes(StandardCharsets.UTF_8);
            }
        } else if (bodyValue != null) {
            try {
                body = JsonSupport.serialize(bodyValue).getBytes(StandardCharsets.UTF_8);
            } catch (JSONException e) {
                logger.debug("Request body for {} {} is not serializable: {}", method, uri, e.getMessage());
                return ApiResult.failure(new ClientError.RequestError(
                        "Request body cannot be serialized to JSON: " + e.getMessage(), e,
                        "bodyType=" + bodyValue.getClass().getName()));
            }
        }
        if (body != null && !headers.containsKey("Content-Type")) {
            headers.put("Content-Type", JSON_CONTENT_TYPE);
        }

        Duration timeout = opts.getTimeout().orElse(defaultTimeout);
        return ApiResult.success(new ApiHttpRequest(method, uri, headers, body, timeout));
    }

    private static URI withQuery(URI resolved, RequestOptions options) {
        if (options.getQueryParams().isEmpty()) {
            return resolved;
        }
        StringBuilder url = new StringBuilder(resolved.toString());
        String fragment = null;
        int hash = url.indexOf("#");
        if (hash >= 0) {
            fragment = url.substring(hash);
            url.setLength(hash);
        }
        char separator = resolved.getRawQuery() == null ? '?' : '&';
        for (Map.Entry<String, String> param : options.getQueryParams()) {
            url.append(separator)
                    .append(encode(param.getKey()))
                    .append('=')
                    .append(encode(param.getValue()));
            separator = '&';
        }
        if (fragment != null) {
            url.append(fragment);
        }
        return URI.create(url.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
