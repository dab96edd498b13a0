package de.entwicklertraining.memory.client;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * How often and how fast a failed call is repeated.
 * <p>
 * {@code attempts} counts every try including the first one. The delay between tries is
 * fixed; a {@link ClientError.RateLimitError} carrying a {@code Retry-After} hint replaces it
 * for the following attempt.
 * <p>
 * Example usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .attempts(5)
 *     .delayMs(250)
 *     .retryOn(error -&gt; error.kind() == ClientError.Kind.NETWORK)
 *     .build();
 * </pre>
 */
public final class RetryPolicy {

    /** Default number of tries, including the first one. */
    public static final int DEFAULT_ATTEMPTS = 3;

    /** Default delay between tries in milliseconds. */
    public static final long DEFAULT_DELAY_MS = 500;

    private final int attempts;
    private final long delayMs;
    private final Predicate<ClientError> retryOn;

    private RetryPolicy(Builder builder) {
        this.attempts = builder.attempts;
        this.delayMs = builder.delayMs;
        this.retryOn = builder.retryOn;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * A policy that tries exactly once.
     *
     * @return the policy
     */
    public static RetryPolicy noRetry() {
        return builder().attempts(1).build();
    }

    public Builder toBuilder() {
        return new Builder().attempts(attempts).delayMs(delayMs).retryOn(retryOn);
    }

    public int getAttempts() {
        return attempts;
    }

    public long getDelayMs() {
        return delayMs;
    }

    /**
     * Decides whether another attempt may follow the given error.
     *
     * @param error the error of the last attempt
     * @return true if the error is transient under this policy
     */
    public boolean shouldRetry(ClientError error) {
        return retryOn.test(error);
    }

    @Override
    public String toString() {
        return "RetryPolicy[attempts=" + attempts + ", delayMs=" + delayMs + "]";
    }

    /**
     * Builder for {@link RetryPolicy}.
     */
    public static final class Builder {
        private int attempts = DEFAULT_ATTEMPTS;
        private long delayMs = DEFAULT_DELAY_MS;
        private Predicate<ClientError> retryOn = ClientError::isRetryable;

        private Builder() {
        }

        /**
         * Sets the total number of tries.
         *
         * @param attempts at least 1
         * @return this builder
         */
        public Builder attempts(int attempts) {
            if (attempts < 1) {
                throw new IllegalArgumentException("Attempts must be at least 1, was " + attempts);
            }
            this.attempts = attempts;
            return this;
        }

        public Builder delayMs(long delayMs) {
            if (delayMs < 0) {
                throw new IllegalArgumentException("Delay cannot be negative, was " + delayMs);
            }
            this.delayMs = delayMs;
            return this;
        }

        /**
         * Replaces the classifier of transient errors. Defaults to {@link ClientError#isRetryable()}.
         *
         * @param retryOn the classifier
         * @return this builder
         */
        public Builder retryOn(Predicate<ClientError> retryOn) {
            this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
