package de.entwicklertraining.memory.client;

import de.entwicklertraining.memory.client.streaming.StreamingConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration settings for client behavior: timeouts, retries, error messages, batch
 * concurrency and streaming.
 * This class provides a fluent builder API for configuration and sensible defaults for all settings.
 * <p>
 * Example usage:
 * <pre>
 * ApiClientSettings settings = ApiClientSettings.builder()
 *     .timeout(Duration.ofSeconds(10))
 *     .retryPolicy(RetryPolicy.builder().attempts(5).delayMs(1000).build())
 *     .errorMessagePolicy(ErrorMessagePolicy.BODY_MESSAGE_OR_STATUS_TEXT)
 *     .batchConcurrency(8)
 *     .build();
 * </pre>
 */
public final class ApiClientSettings {

    /** Default request timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Default number of batch items in flight at once. */
    public static final int DEFAULT_BATCH_CONCURRENCY = 4;

    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final ErrorMessagePolicy errorMessagePolicy;
    private final int batchConcurrency;
    private final StreamingConfig streamingConfig;
    private final Clock clock;

    private ApiClientSettings(Builder builder) {
        this.timeout = builder.timeout;
        this.retryPolicy = builder.retryPolicy;
        this.errorMessagePolicy = builder.errorMessagePolicy;
        this.batchConcurrency = builder.batchConcurrency;
        this.streamingConfig = builder.streamingConfig;
        this.clock = builder.clock;
    }

    public static ApiClientSettings defaults() {
        return builder().build();
    }

    /**
     * Creates a new Builder instance with default values.
     *
     * @return A new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new Builder pre-populated with the current settings.
     * Useful for creating a modified copy of an existing configuration.
     *
     * @return A new Builder instance with current settings
     */
    public Builder toBuilder() {
        return new Builder()
                .timeout(timeout)
                .retryPolicy(retryPolicy)
                .errorMessagePolicy(errorMessagePolicy)
                .batchConcurrency(batchConcurrency)
                .streamingConfig(streamingConfig)
                .clock(clock);
    }

    /**
     * Gets the default timeout applied to requests without a per-call override.
     *
     * @return The timeout, never null
     */
    public Duration getTimeout() {
        return timeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public ErrorMessagePolicy getErrorMessagePolicy() {
        return errorMessagePolicy;
    }

    /**
     * Gets the maximum number of batch operations running at the same time.
     *
     * @return The concurrency limit, at least 1
     */
    public int getBatchConcurrency() {
        return batchConcurrency;
    }

    public StreamingConfig getStreamingConfig() {
        return streamingConfig;
    }

    /**
     * Gets the clock used to interpret {@code Retry-After} dates.
     *
     * @return The clock
     */
    public Clock getClock() {
        return clock;
    }

    /**
     * Builder class for creating ApiClientSettings instances.
     */
    public static final class Builder {
        private Duration timeout = DEFAULT_TIMEOUT;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private ErrorMessagePolicy errorMessagePolicy = ErrorMessagePolicy.STATUS_TEXT;
        private int batchConcurrency = DEFAULT_BATCH_CONCURRENCY;
        private StreamingConfig streamingConfig = StreamingConfig.defaults();
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * Sets the default request timeout.
         *
         * @param timeout a positive duration
         * @return This builder for method chaining
         */
        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        public Builder errorMessagePolicy(ErrorMessagePolicy errorMessagePolicy) {
            this.errorMessagePolicy = Objects.requireNonNull(errorMessagePolicy, "errorMessagePolicy");
            return this;
        }

        /**
         * Sets how many batch operations may be in flight at once.
         *
         * @param batchConcurrency at least 1
         * @return This builder for method chaining
         */
        public Builder batchConcurrency(int batchConcurrency) {
            if (batchConcurrency < 1) {
                throw new IllegalArgumentException("Batch concurrency must be at least 1");
            }
            this.batchConcurrency = batchConcurrency;
            return this;
        }

        public Builder streamingConfig(StreamingConfig streamingConfig) {
            this.streamingConfig = Objects.requireNonNull(streamingConfig, "streamingConfig");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Builds a new ApiClientSettings instance with the configured values.
         *
         * @return A new ApiClientSettings instance
         */
        public ApiClientSettings build() {
            return new ApiClientSettings(this);
        }
    }
}
