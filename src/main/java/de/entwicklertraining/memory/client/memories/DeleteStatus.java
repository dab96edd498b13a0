package de.entwicklertraining.memory.client.memories;

/**
 * Result of deleting a memory. Both values are successes.
 */
public enum DeleteStatus {
    /** The memory existed and was removed. */
    DELETED,
    /** The memory did not exist (the server answered 404). */
    ALREADY_GONE
}
