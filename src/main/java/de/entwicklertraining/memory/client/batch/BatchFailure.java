package de.entwicklertraining.memory.client.batch;

import de.entwicklertraining.memory.client.ClientError;

/**
 * A failed batch item.
 *
 * @param key the item key
 * @param error why the item failed
 * @param <K> the key type
 */
public record BatchFailure<K>(K key, ClientError error) {
}
