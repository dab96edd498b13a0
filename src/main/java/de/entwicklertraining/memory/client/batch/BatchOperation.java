package de.entwicklertraining.memory.client.batch;

import de.entwicklertraining.memory.client.ApiResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * One keyed unit of work inside a batch.
 *
 * @param key the item key, unique within the batch
 * @param call starts the operation; invoked at most once
 * @param <K> the key type
 * @param <V> the value type
 */
public record BatchOperation<K, V>(K key, Supplier<CompletableFuture<ApiResult<V>>> call) {

    public BatchOperation {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(call, "call");
    }

    public static <K, V> BatchOperation<K, V> of(K key, Supplier<CompletableFuture<ApiResult<V>>> call) {
        return new BatchOperation<>(key, call);
    }
}
