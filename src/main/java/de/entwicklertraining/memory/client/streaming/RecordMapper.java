package de.entwicklertraining.memory.client.streaming;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Maps one parsed NDJSON value to a caller type.
 *
 * <p>A runtime exception thrown by the mapper, or a null result, fails the stream with a
 * decode error carrying the raw line.
 *
 * @param <T> the record type
 */
@FunctionalInterface
public interface RecordMapper<T> {

    /**
     * Maps a parsed line.
     *
     * @param value a {@link JSONObject}, {@link org.json.JSONArray}, String, Number, Boolean or {@link JSONObject#NULL}
     * @return the record, never null
     */
    T map(Object value);

    /**
     * Passes the parsed value through unchanged.
     *
     * @return the mapper
     */
    static RecordMapper<Object> rawJson() {
        return value -> value;
    }

    /**
     * Requires every line to be a JSON object.
     *
     * @return the mapper
     */
    static RecordMapper<JSONObject> jsonObjects() {
        return value -> {
            if (value instanceof JSONObject object) {
                return object;
            }
            throw new JSONException("Expected a JSON object but got " + describe(value));
        };
    }

    /**
     * Extracts a required string member of each JSON object line, e.g. {@code "key"}.
     *
     * @param name the member name
     * @return the mapper
     */
    static RecordMapper<String> stringField(String name) {
        return value -> {
            if (value instanceof JSONObject object) {
                return object.getString(name);
            }
            throw new JSONException("Expected a JSON object with \"" + name + "\" but got " + describe(value));
        };
    }

    private static String describe(Object value) {
        return value == null ? "nothing" : value.getClass().getSimpleName();
    }
}
