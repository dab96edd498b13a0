package de.entwicklertraining.memory.client;

/**
 * Bearer credential for the memory API. The value is never rendered by {@link #toString()}.
 *
 * @param value the raw key
 */
public record ApiKey(String value) {

    public ApiKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("API key cannot be null or empty");
        }
    }

    String authorizationHeader() {
        return "Bearer " + value;
    }

    @Override
    public String toString() {
        return "ApiKey[***]";
    }
}
