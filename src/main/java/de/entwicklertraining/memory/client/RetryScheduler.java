package de.entwicklertraining.memory.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Repeats a failing call according to a {@link RetryPolicy}.
 *
 * <p>Only errors the policy classifies as transient are retried. The pause between attempts
 * is the policy's fixed delay, unless the last error is a rate limit with a {@code Retry-After}
 * hint, which then takes its place. Pauses are scheduled on the timer; no thread sleeps.
 * When attempts run out, the last error is returned unchanged.
 *
 * <p>Cancelling the returned future stops further attempts and cancels the one in flight.
 */
public final class RetryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RetryScheduler.class);

    private final RetryPolicy policy;
    private final ScheduledExecutorService timer;

    public RetryScheduler(RetryPolicy policy, ScheduledExecutorService timer) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    /**
     * Runs the call, retrying transient failures.
     *
     * @param call starts one attempt; invoked once per attempt
     * @param <T> the success type
     * @return the first success, the first terminal error, or the last error after the final attempt
     */
    public <T> CompletableFuture<ApiResult<T>> run(Supplier<CompletableFuture<ApiResult<T>>> call) {
        Objects.requireNonNull(call, "call");
        CompletableFuture<ApiResult<T>> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();
        result.whenComplete((r, e) -> {
            if (result.isCancelled()) {
                CompletableFuture<?> current = inFlight.get();
                if (current != null) {
                    current.cancel(true);
                }
            }
        });
        attempt(call, 1, result, inFlight);
        return result;
    }

    private <T> void attempt(Supplier<CompletableFuture<ApiResult<T>>> call, int attempt,
                             CompletableFuture<ApiResult<T>> result,
                             AtomicReference<CompletableFuture<?>> inFlight) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<ApiResult<T>> future;
        try {
            future = Objects.requireNonNull(call.get(), "call returned no future");
        } catch (RuntimeException e) {
            logger.warn("Attempt {} could not be started, not retrying", attempt, e);
            result.complete(ApiResult.failure(new ClientError.RequestError("Request could not be started: " + e.getMessage(), e, null)));
            return;
        }
        inFlight.set(future);
        if (result.isCancelled()) {
            future.cancel(true);
            return;
        }

        future.whenComplete((outcome, failure) -> {
            if (result.isDone()) {
                return;
            }
            ApiResult<T> current = failure != null
                    ? ApiResult.failure(TransportExecutor.translateTransportFailure(failure, null))
                    : outcome;
            if (current.isSuccess()) {
                result.complete(current);
                return;
            }

            ClientError error = current.getError();
            if (!policy.shouldRetry(error)) {
                logger.debug("Attempt {} failed with non-retryable {}: {}", attempt, error.kind(), error.getMessage());
                result.complete(current);
                return;
            }
            if (attempt >= policy.getAttempts()) {
                if (attempt > 1) {
                    logger.warn("Giving up after {} attempts, last error {}: {}", attempt, error.kind(), error.getMessage());
                }
                result.complete(current);
                return;
            }

            long delay = nextDelayMs(error);
            logger.debug("Attempt {}/{} failed with {}: {}. Retrying in {} ms",
                    attempt, policy.getAttempts(), error.kind(), error.getMessage(), delay);
            try {
                ScheduledFuture<?> pause = timer.schedule(
                        () -> attempt(call, attempt + 1, result, inFlight), delay, TimeUnit.MILLISECONDS);
                result.whenComplete((r, e) -> pause.cancel(false));
            } catch (RejectedExecutionException e) {
                logger.warn("Retry could not be scheduled, returning last error: {}", e.getMessage());
                result.complete(current);
            }
        });
    }

    long nextDelayMs(ClientError error) {
        if (error instanceof ClientError.RateLimitError rateLimit && rateLimit.getRetryAfterMs().isPresent()) {
            return rateLimit.getRetryAfterMs().getAsLong();
        }
        return policy.getDelayMs();
    }
}
