package de.entwicklertraining.memory.client.memories;

import de.entwicklertraining.memory.client.ApiResponse;
import de.entwicklertraining.memory.client.ApiResult;
import de.entwicklertraining.memory.client.ClientError;
import de.entwicklertraining.memory.client.HttpMethod;
import de.entwicklertraining.memory.client.JsonSupport;
import de.entwicklertraining.memory.client.MemoryApiClient;
import de.entwicklertraining.memory.client.RequestOptions;
import de.entwicklertraining.memory.client.RetryPolicy;
import de.entwicklertraining.memory.client.batch.BatchOperation;
import de.entwicklertraining.memory.client.batch.BatchOutcome;
import de.entwicklertraining.memory.client.streaming.NdjsonStream;
import de.entwicklertraining.memory.client.streaming.RecordMapper;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The memories resource: a namespaced key/value store.
 *
 * <p>Values travel base64-encoded. Every call carries the {@code X-Supermemory-Namespace}
 * header and runs under the client's retry policy. A 404 is not an error here: {@code get}
 * yields empty, {@code exists} yields false and {@code delete} yields
 * {@link DeleteStatus#ALREADY_GONE}, so deletes are idempotent.
 *
 * <p>Batch calls fan out one request per key and report partial failure as a value;
 * items that succeeded stay applied.
 */
public class MemoriesClient {

    static final String MEMORIES_PATH = "/api/v1/memories";
    static final String NAMESPACE_HEADER = "X-Supermemory-Namespace";

    /** Longest accepted memory key. */
    public static final int MAX_KEY_LENGTH = 255;

    private final MemoryApiClient client;
    private final Namespace namespace;
    private final RetryPolicy retryPolicy;

    public MemoriesClient(MemoryApiClient client, Namespace namespace) {
        this.client = Objects.requireNonNull(client, "client");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        RetryPolicy base = client.getSettings().getRetryPolicy();
        // 404 is final for memory lookups
        this.retryPolicy = base.toBuilder()
                .retryOn(error -> !isNotFound(error) && base.shouldRetry(error))
                .build();
    }

    public Namespace getNamespace() {
        return namespace;
    }

    public CompletableFuture<ApiResult<Void>> putAsync(String key, String value) {
        Objects.requireNonNull(value, "value");
        Optional<ClientError> invalid = validateKey(key);
        if (invalid.isPresent()) {
            return CompletableFuture.completedFuture(ApiResult.failure(invalid.get()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", key);
        body.put("value", Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8)));
        body.put("namespace", namespace.value());
        return send(HttpMethod.POST, MEMORIES_PATH, options().body(body).build())
                .thenApply(result -> result.map(response -> null));
    }

    public ApiResult<Void> put(String key, String value) {
        return putAsync(key, value).join();
    }

    public CompletableFuture<ApiResult<Optional<String>>> getAsync(String key) {
        Optional<ClientError> invalid = validateKey(key);
        if (invalid.isPresent()) {
            return CompletableFuture.completedFuture(ApiResult.failure(invalid.get()));
        }
        return send(HttpMethod.GET, memoryPath(key), options().build())
                .thenApply(result -> {
                    if (isNotFound(result)) {
                        return ApiResult.success(Optional.<String>empty());
                    }
                    return result.flatMap(response -> decodeValue(response).map(Optional::of));
                });
    }

    public ApiResult<Optional<String>> get(String key) {
        return getAsync(key).join();
    }

    public CompletableFuture<ApiResult<Boolean>> existsAsync(String key) {
        Optional<ClientError> invalid = validateKey(key);
        if (invalid.isPresent()) {
            return CompletableFuture.completedFuture(ApiResult.failure(invalid.get()));
        }
        return send(HttpMethod.GET, memoryPath(key), options().build())
                .thenApply(result -> isNotFound(result) ? ApiResult.success(false) : result.map(response -> true));
    }

    public ApiResult<Boolean> exists(String key) {
        return existsAsync(key).join();
    }

    /**
     * Deletes a memory. Deleting a key that does not exist succeeds with
     * {@link DeleteStatus#ALREADY_GONE}.
     *
     * @param key the memory key
     * @return the delete status or an error
     */
    public CompletableFuture<ApiResult<DeleteStatus>> deleteAsync(String key) {
        Optional<ClientError> invalid = validateKey(key);
        if (invalid.isPresent()) {
            return CompletableFuture.completedFuture(ApiResult.failure(invalid.get()));
        }
        return send(HttpMethod.DELETE, memoryPath(key), options().build())
                .thenApply(result -> isNotFound(result)
                        ? ApiResult.success(DeleteStatus.ALREADY_GONE)
                        : result.map(response -> DeleteStatus.DELETED));
    }

    public ApiResult<DeleteStatus> delete(String key) {
        return deleteAsync(key).join();
    }

    /**
     * Removes every memory of this namespace.
     *
     * @return success or an error
     */
    public CompletableFuture<ApiResult<Void>> clearAsync() {
        return send(HttpMethod.DELETE, MEMORIES_PATH, options().queryParam("namespace", namespace.value()).build())
                .thenApply(result -> result.map(response -> null));
    }

    public ApiResult<Void> clear() {
        return clearAsync().join();
    }

    /**
     * Stores several memories. Items are independent: a failed item does not undo the others.
     *
     * @param values the memories in the order they should be reported
     * @return one outcome per key
     */
    public CompletableFuture<BatchOutcome<String, Void>> putManyAsync(Map<String, String> values) {
        List<BatchOperation<String, Void>> operations = new ArrayList<>();
        values.forEach((key, value) -> operations.add(BatchOperation.of(key, () -> putAsync(key, value))));
        return client.runBatch(operations);
    }

    public BatchOutcome<String, Void> putMany(Map<String, String> values) {
        return putManyAsync(values).join();
    }

    public CompletableFuture<BatchOutcome<String, Optional<String>>> getManyAsync(List<String> keys) {
        List<BatchOperation<String, Optional<String>>> operations = new ArrayList<>();
        for (String key : keys) {
            operations.add(BatchOperation.of(key, () -> getAsync(key)));
        }
        return client.runBatch(operations);
    }

    public BatchOutcome<String, Optional<String>> getMany(List<String> keys) {
        return getManyAsync(keys).join();
    }

    public CompletableFuture<BatchOutcome<String, DeleteStatus>> deleteManyAsync(List<String> keys) {
        List<BatchOperation<String, DeleteStatus>> operations = new ArrayList<>();
        for (String key : keys) {
            operations.add(BatchOperation.of(key, () -> deleteAsync(key)));
        }
        return client.runBatch(operations);
    }

    public BatchOutcome<String, DeleteStatus> deleteMany(List<String> keys) {
        return deleteManyAsync(keys).join();
    }

    /**
     * Streams every key of this namespace. The caller must close the returned stream.
     *
     * @return the keys, or an error if the stream could not be opened
     */
    public ApiResult<NdjsonStream<String>> listAllKeys() {
        return client.streamNdjson(HttpMethod.GET, "/v1/keys/" + encodePathSegment(namespace.value()),
                options().build(), RecordMapper.stringField("key"));
    }

    /**
     * Streams search hits for a query. The caller must close the returned stream.
     *
     * @param query the search text
     * @param searchOptions limit, offset, score and filter constraints
     * @return the hits, or an error if the stream could not be opened
     */
    public ApiResult<NdjsonStream<SearchResult>> streamSearch(String query, SearchOptions searchOptions) {
        if (query == null || query.isBlank()) {
            return ApiResult.failure(new ClientError.RequestError("Search query cannot be empty", null, null));
        }
        RequestOptions.Builder options = options().queryParam("q", query);
        (searchOptions == null ? SearchOptions.none() : searchOptions).applyTo(options);
        return client.streamNdjson(HttpMethod.GET,
                "/v1/search/" + encodePathSegment(namespace.value()) + "/stream",
                options.build(), MemoriesClient::toSearchResult);
    }

    static SearchResult toSearchResult(Object line) {
        JSONObject hit = (JSONObject) line;
        JSONObject memory = hit.getJSONObject("memory");
        return new SearchResult(new Memory(memory.getString("key"), memory.getString("value")),
                hit.getDouble("relevanceScore"));
    }

    private CompletableFuture<ApiResult<ApiResponse<Object>>> send(HttpMethod method, String path, RequestOptions options) {
        return client.requestWithRetryAsync(method, path, options, retryPolicy);
    }

    private RequestOptions.Builder options() {
        return RequestOptions.builder().header(NAMESPACE_HEADER, namespace.value());
    }

    private static String memoryPath(String key) {
        return MEMORIES_PATH + "/" + encodePathSegment(key);
    }

    private static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static boolean isNotFound(ApiResult<?> result) {
        return result.isFailure() && isNotFound(result.getError());
    }

    private static boolean isNotFound(ClientError error) {
        return error instanceof ClientError.HttpError http && http.getStatus() == 404;
    }

    private static ApiResult<String> decodeValue(ApiResponse<Object> response) {
        Optional<String> encoded = response.jsonObject().flatMap(body -> JsonSupport.optString(body, "value"));
        if (encoded.isEmpty()) {
            return ApiResult.failure(new ClientError.HttpError(response.getStatus(),
                    "Memory response has no value", null, response.getBody()));
        }
        try {
            return ApiResult.success(new String(Base64.getDecoder().decode(encoded.get()), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            return ApiResult.failure(new ClientError.HttpError(response.getStatus(),
                    "Memory value is not valid base64", null, response.getBody()));
        }
    }

    private static Optional<ClientError> validateKey(String key) {
        if (key == null || key.isEmpty()) {
            return Optional.of(new ClientError.RequestError("Memory key cannot be empty", null, null));
        }
        if (key.length() > MAX_KEY_LENGTH) {
            return Optional.of(new ClientError.RequestError(
                    "Memory key cannot exceed " + MAX_KEY_LENGTH + " characters", null, "length=" + key.length()));
        }
        return Optional.empty();
    }
}
