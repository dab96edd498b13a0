package de.entwicklertraining.memory.client.batch;

import de.entwicklertraining.memory.client.ApiResult;
import de.entwicklertraining.memory.client.ClientError;
import de.entwicklertraining.memory.client.JsonSupport;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads a server-side batch response onto the keys that were requested.
 *
 * <p>The expected shape is
 * <pre>
 * {"correlationId": "...", "results": [{"id": "k1", "status": 200, "value": "..."},
 *                                      {"id": "k2", "status": 404, "error": "not found"}]}
 * </pre>
 * Every requested key gets exactly one outcome: a 2xx item yields its mapped value, any other
 * status an {@link ClientError.HttpError}, and a key the server did not mention an
 * {@link ClientError.HttpError} with status 0. Items for keys that were not requested are
 * ignored.
 */
public final class BatchResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(BatchResponseParser.class);

    private BatchResponseParser() {
    }

    /**
     * Parses a batch response body.
     *
     * @param body the parsed response body
     * @param requestedKeys the keys in request order
     * @param valueMapper maps the item's {@code value} member (may be absent, then null) of a 2xx item
     * @param url the request URL, attached to item errors
     * @param <V> the value type
     * @return the outcome, or an {@link ClientError.HttpError} if the body is not a batch response
     */
    public static <V> ApiResult<BatchOutcome<String, V>> parse(Object body, List<String> requestedKeys,
                                                              Function<Object, V> valueMapper, String url) {
        Objects.requireNonNull(requestedKeys, "requestedKeys");
        Objects.requireNonNull(valueMapper, "valueMapper");
        if (!(body instanceof JSONObject object) || !(object.opt("results") instanceof JSONArray results)) {
            return ApiResult.failure(new ClientError.HttpError(0, "Malformed batch response", url, body));
        }
        String correlationId = JsonSupport.optString(object, "correlationId").orElse(null);

        Map<String, JSONObject> items = new HashMap<>();
        for (int i = 0; i < results.length(); i++) {
            JSONObject item = results.optJSONObject(i);
            if (item == null || !(item.opt("id") instanceof String id)) {
                logger.debug("Skipping batch result entry without id at index {}", i);
                continue;
            }
            items.putIfAbsent(id, item);
        }

        List<BatchItemOutcome<String, V>> outcomes = new ArrayList<>();
        for (String key : new LinkedHashSet<>(requestedKeys)) {
            JSONObject item = items.get(key);
            outcomes.add(new BatchItemOutcome<>(key, toResult(key, item, valueMapper, url)));
        }
        return ApiResult.success(new BatchOutcome<>(outcomes, correlationId));
    }

    private static <V> ApiResult<V> toResult(String key, JSONObject item, Function<Object, V> valueMapper, String url) {
        if (item == null) {
            return ApiResult.failure(new ClientError.HttpError(0, "Missing batch result for key " + key, url, null));
        }
        int status = item.optInt("status", 0);
        if (status >= 200 && status < 300) {
            try {
                Object value = item.has("value") ? item.get("value") : null;
                return ApiResult.success(valueMapper.apply(value == JSONObject.NULL ? null : value));
            } catch (RuntimeException e) {
                return ApiResult.failure(new ClientError.HttpError(status,
                        "Unreadable batch value for key " + key + ": " + e.getMessage(), url, item));
            }
        }
        String message = JsonSupport.optString(item, "error")
                .filter(error -> !error.isEmpty())
                .orElse("Batch item failed with status " + status);
        return ApiResult.failure(new ClientError.HttpError(status, message, url, item));
    }
}
