package de.entwicklertraining.memory.client.memories;

import java.util.Objects;

/**
 * One hit of a streamed search.
 *
 * @param memory the matching memory
 * @param relevanceScore relevance between 0.0 and 1.0
 */
public record SearchResult(Memory memory, double relevanceScore) {

    public SearchResult {
        Objects.requireNonNull(memory, "memory");
    }
}
