package de.entwicklertraining.memory.client.memories;

import java.util.regex.Pattern;

/**
 * Isolation scope of memories: 1 to 64 characters of letters, digits, '_' and '-'.
 *
 * @param value the namespace name
 */
public record Namespace(String value) {

    public static final int MAX_LENGTH = 64;

    private static final Pattern VALID = Pattern.compile("^[a-zA-Z0-9_-]+$");

    public Namespace {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Namespace cannot be null or empty");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Namespace cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!VALID.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "Namespace may only contain letters, digits, underscores and hyphens: " + value);
        }
    }

    public static Namespace of(String value) {
        return new Namespace(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
