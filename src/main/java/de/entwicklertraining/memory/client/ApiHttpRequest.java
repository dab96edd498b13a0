package de.entwicklertraining.memory.client;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A fully built request, ready for a {@link HttpTransport}. Header lookups are case-insensitive.
 *
 * @param method the HTTP method
 * @param uri the absolute request URI including the query
 * @param headers the merged headers
 * @param body the encoded body, or null
 * @param timeout the effective timeout, or null for none
 */
public record ApiHttpRequest(HttpMethod method, URI uri, Map<String, String> headers, byte[] body, Duration timeout) {

    public ApiHttpRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? null : body.clone();
    }

    @Override
    public byte[] body() {
        return body == null ? null : body.clone();
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public String url() {
        return uri.toString();
    }

    @Override
    public String toString() {
        // headers left out, they carry the credential
        return "ApiHttpRequest[" + method + " " + uri + ", body=" + (body == null ? 0 : body.length) + " bytes]";
    }
}
