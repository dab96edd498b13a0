package de.entwicklertraining.memory.client.batch;

import de.entwicklertraining.memory.client.ApiResult;

import java.util.Objects;

/**
 * Outcome of one batch item.
 *
 * @param key the item key
 * @param result the value or the error of this item
 * @param <K> the key type
 * @param <V> the value type
 */
public record BatchItemOutcome<K, V>(K key, ApiResult<V> result) {

    public BatchItemOutcome {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(result, "result");
    }

    public boolean isSuccess() {
        return result.isSuccess();
    }
}
