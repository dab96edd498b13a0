package de.entwicklertraining.memory.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, case-insensitive view of response headers.
 */
public final class ResponseHeaders {

    private static final ResponseHeaders EMPTY = new ResponseHeaders(Map.of());

    private final Map<String, List<String>> headers;

    private ResponseHeaders(Map<String, List<String>> source) {
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            copy.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).addAll(entry.getValue());
        }
        copy.replaceAll((k, v) -> List.copyOf(v));
        this.headers = Collections.unmodifiableMap(copy);
    }

    public static ResponseHeaders of(Map<String, List<String>> headers) {
        return headers == null || headers.isEmpty() ? EMPTY : new ResponseHeaders(headers);
    }

    public static ResponseHeaders empty() {
        return EMPTY;
    }

    public Optional<String> firstValue(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public List<String> allValues(String name) {
        return headers.getOrDefault(name, List.of());
    }

    /**
     * Returns the media type of the {@code Content-Type} header, lower-cased and without parameters.
     *
     * @return the media type, e.g. "application/json"
     */
    public Optional<String> mediaType() {
        return firstValue("Content-Type")
                .map(value -> {
                    int semicolon = value.indexOf(';');
                    return (semicolon >= 0 ? value.substring(0, semicolon) : value).trim().toLowerCase(Locale.ROOT);
                })
                .filter(value -> !value.isEmpty());
    }

    public Map<String, List<String>> asMap() {
        return headers;
    }

    @Override
    public String toString() {
        return headers.toString();
    }
}
