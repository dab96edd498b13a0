package de.entwicklertraining.memory.client.streaming;

/**
 * Configuration class for streaming-specific settings.
 *
 * <p>Controls how many bytes are pulled from the response per read, how long a single
 * NDJSON line may grow, and what happens to an unparseable fragment left over when the
 * stream ends.
 */
public final class StreamingConfig {

    /**
     * Treatment of a malformed fragment still buffered when the input ends.
     *
     * <p>A malformed <em>complete</em> line in the middle of a stream always fails the stream;
     * this policy only governs the final, newline-less remainder.
     */
    public enum TrailingLinePolicy {
        /** Log the fragment at warn level, keep it retrievable, and end the stream normally. */
        DISCARD_AND_LOG,
        /** Fail the stream with a decode error carrying the fragment. */
        FAIL
    }

    private static final StreamingConfig DEFAULTS = builder().build();

    private final int bufferSize;
    private final int maxLineLength;
    private final TrailingLinePolicy trailingLinePolicy;

    private StreamingConfig(Builder builder) {
        this.bufferSize = builder.bufferSize;
        this.maxLineLength = builder.maxLineLength;
        this.trailingLinePolicy = builder.trailingLinePolicy;
    }

    /**
     * Returns the buffer size for reading streaming data.
     *
     * @return Buffer size in bytes
     */
    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * Returns the maximum number of characters a single line may buffer before the
     * stream fails.
     *
     * @return Maximum line length in characters
     */
    public int getMaxLineLength() {
        return maxLineLength;
    }

    public TrailingLinePolicy getTrailingLinePolicy() {
        return trailingLinePolicy;
    }

    public static StreamingConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new builder for StreamingConfig.
     *
     * @return A new builder instance with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .bufferSize(bufferSize)
                .maxLineLength(maxLineLength)
                .trailingLinePolicy(trailingLinePolicy);
    }

    /**
     * Builder class for creating StreamingConfig instances.
     */
    public static final class Builder {
        private int bufferSize = 8192;
        private int maxLineLength = 8 * 1024 * 1024; // 8M chars
        private TrailingLinePolicy trailingLinePolicy = TrailingLinePolicy.DISCARD_AND_LOG;

        private Builder() {
        }

        /**
         * Sets the buffer size for streaming operations.
         *
         * @param bufferSize the buffer size in bytes, must be positive
         * @return this builder instance for method chaining
         */
        public Builder bufferSize(int bufferSize) {
            if (bufferSize <= 0) {
                throw new IllegalArgumentException("Buffer size must be positive");
            }
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            if (maxLineLength <= 0) {
                throw new IllegalArgumentException("Max line length must be positive");
            }
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder trailingLinePolicy(TrailingLinePolicy policy) {
            if (policy == null) {
                throw new IllegalArgumentException("Trailing line policy cannot be null");
            }
            this.trailingLinePolicy = policy;
            return this;
        }

        /**
         * Builds a new StreamingConfig instance with the configured settings.
         *
         * @return a new StreamingConfig instance
         */
        public StreamingConfig build() {
            return new StreamingConfig(this);
        }
    }
}
