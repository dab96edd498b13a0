package de.entwicklertraining.memory.client.memories;

import java.util.Objects;

/**
 * A stored key/value pair.
 *
 * @param key the memory key
 * @param value the decoded value
 */
public record Memory(String key, String value) {

    public Memory {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
