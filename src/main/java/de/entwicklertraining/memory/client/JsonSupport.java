package de.entwicklertraining.memory.client;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JSON conversion on top of org.json.
 * <p>
 * Serialization accepts maps, collections, arrays, records, enums, org.json values,
 * and plain beans. Cycles and non-finite numbers are rejected with {@link JSONException}.
 * Parsing follows the RFC 8259 grammar at every nesting level: exactly one value, quoted
 * member names and strings, no trailing commas, no comments and no trailing content.
 * org.json only builds the value once {@link StrictJsonValidator} has accepted the text.
 */
public final class JsonSupport {

    private JsonSupport() {
    }

    /**
     * Serializes a structured value to compact JSON text.
     *
     * @param value the value to serialize
     * @return the JSON text
     * @throws JSONException if the value contains a cycle, a non-finite number or an unsupported bean
     */
    public static String serialize(Object value) {
        Object json = toJson(value, Collections.newSetFromMap(new IdentityHashMap<>()));
        if (json instanceof JSONObject || json instanceof JSONArray) {
            return json.toString();
        }
        return JSONObject.valueToString(json);
    }

    /**
     * Parses exactly one JSON value.
     *
     * @param text the text to parse
     * @return a {@link JSONObject}, {@link JSONArray}, String, Number, Boolean or {@link JSONObject#NULL}
     * @throws JSONException if the text is not a single well-formed JSON value
     */
    public static Object parseStrict(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            throw new JSONException("Empty JSON text");
        }
        StrictJsonValidator.validate(trimmed);
        Object value = new JSONTokener(trimmed).nextValue();
        if (value instanceof Number number && !isFinite(number)) {
            throw new JSONException("Non-finite number: " + trimmed);
        }
        return value;
    }

    /**
     * Returns the string member of a JSON object, if present.
     *
     * @param object the object
     * @param name the member name
     * @return the string value; empty if absent or not a string
     */
    public static Optional<String> optString(JSONObject object, String name) {
        Object value = object.opt(name);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    private static Object toJson(Object value, Set<Object> visiting) {
        if (value == null || value == JSONObject.NULL) {
            return JSONObject.NULL;
        }
        if (value instanceof String || value instanceof Boolean || value instanceof Character) {
            return value instanceof Character ? value.toString() : value;
        }
        if (value instanceof Number number) {
            if (!isFinite(number)) {
                throw new JSONException("Non-finite number cannot be serialized: " + number);
            }
            return number;
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? toJson(optional.get(), visiting) : JSONObject.NULL;
        }
        if (!visiting.add(value)) {
            throw new JSONException("Cyclic structure cannot be serialized: " + value.getClass().getName());
        }
        try {
            if (value instanceof JSONObject object) {
                JSONObject copy = new JSONObject();
                for (String key : object.keySet()) {
                    copy.put(key, toJson(object.opt(key), visiting));
                }
                return copy;
            }
            if (value instanceof JSONArray array) {
                JSONArray copy = new JSONArray();
                for (int i = 0; i < array.length(); i++) {
                    copy.put(toJson(array.opt(i), visiting));
                }
                return copy;
            }
            if (value instanceof Map<?, ?> map) {
                JSONObject object = new JSONObject();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    if (entry.getKey() == null) {
                        throw new JSONException("Map with null key cannot be serialized");
                    }
                    object.put(String.valueOf(entry.getKey()), toJson(entry.getValue(), visiting));
                }
                return object;
            }
            if (value instanceof Collection<?> collection) {
                JSONArray array = new JSONArray();
                for (Object element : collection) {
                    array.put(toJson(element, visiting));
                }
                return array;
            }
            if (value.getClass().isArray()) {
                JSONArray array = new JSONArray();
                int length = Array.getLength(value);
                for (int i = 0; i < length; i++) {
                    array.put(toJson(Array.get(value, i), visiting));
                }
                return array;
            }
            if (value.getClass().isRecord()) {
                return recordToJson(value, visiting);
            }
            return beanToJson(value, visiting);
        } finally {
            visiting.remove(value);
        }
    }

    private static JSONObject recordToJson(Object record, Set<Object> visiting) {
        JSONObject object = new JSONObject();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Method accessor = component.getAccessor();
            // records declared in other packages are often not public
            accessor.trySetAccessible();
            Object componentValue;
            try {
                componentValue = accessor.invoke(record);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new JSONException("Cannot read record component " + component.getName(), e);
            }
            object.put(component.getName(), toJson(componentValue, visiting));
        }
        return object;
    }

    private static JSONObject beanToJson(Object bean, Set<Object> visiting) {
        JSONObject properties = new JSONObject(bean);
        if (properties.isEmpty()) {
            throw new JSONException("Type has no readable properties: " + bean.getClass().getName());
        }
        JSONObject object = new JSONObject();
        for (String key : properties.keySet()) {
            object.put(key, toJson(properties.opt(key), visiting));
        }
        return object;
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double d) {
            return Double.isFinite(d);
        }
        if (number instanceof Float f) {
            return Float.isFinite(f);
        }
        return true;
    }
}
