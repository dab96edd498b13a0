package de.entwicklertraining.memory.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetrySchedulerTest {

    private ScheduledThreadPoolExecutor timer;

    @BeforeEach
    void setUp() {
        timer = new ScheduledThreadPoolExecutor(1);
        timer.setRemoveOnCancelPolicy(true);
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    @DisplayName("A persistent 500 is attempted exactly as often as configured and the last error is returned")
    @Timeout(10)
    void testExhaustion() throws Exception {
        // Arrange
        RetryScheduler scheduler = new RetryScheduler(RetryPolicy.builder().attempts(3).delayMs(1).build(), timer);
        List<ClientError> produced = new ArrayList<>();

        // Act
        ApiResult<String> result = scheduler.<String>run(() -> {
            ClientError error = new ClientError.HttpError(500, "Internal Server Error", "https://h/x", null);
            produced.add(error);
            return CompletableFuture.completedFuture(ApiResult.failure(error));
        }).get(5, TimeUnit.SECONDS);

        // Assert
        assertEquals(3, produced.size());
        assertSame(produced.get(2), result.getError());
    }

    @Test
    @DisplayName("Authorization errors are not retried")
    void testNonRetryable() throws Exception {
        RetryScheduler scheduler = new RetryScheduler(RetryPolicy.builder().attempts(5).delayMs(1).build(), timer);
        AtomicInteger calls = new AtomicInteger();

        ApiResult<String> result = scheduler.<String>run(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(
                    ApiResult.failure(new ClientError.AuthorizationError(401, "Unauthorized: Unauthorized", null)));
        }).get(5, TimeUnit.SECONDS);

        assertEquals(1, calls.get());
        assertEquals(ClientError.Kind.AUTHORIZATION, result.getError().kind());
    }

    @Test
    @DisplayName("A transient failure followed by success returns the success")
    void testRecovers() throws Exception {
        RetryScheduler scheduler = new RetryScheduler(RetryPolicy.builder().attempts(3).delayMs(1).build(), timer);
        AtomicInteger calls = new AtomicInteger();

        ApiResult<String> result = scheduler.<String>run(() -> CompletableFuture.completedFuture(
                calls.incrementAndGet() == 1
                        ? ApiResult.<String>failure(new ClientError.NetworkError("reset", null, null))
                        : ApiResult.success("ok"))).get(5, TimeUnit.SECONDS);

        assertEquals("ok", result.getValue());
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("A Retry-After hint replaces the fixed delay")
    void testRateLimitHint() {
        RetryScheduler scheduler = new RetryScheduler(RetryPolicy.builder().delayMs(500).build(), timer);

        assertEquals(2000, scheduler.nextDelayMs(new ClientError.RateLimitError(OptionalLong.of(2000), null)));
        assertEquals(500, scheduler.nextDelayMs(new ClientError.RateLimitError(OptionalLong.empty(), null)));
        assertEquals(500, scheduler.nextDelayMs(new ClientError.HttpError(503, "Service Unavailable", null, null)));
    }

    @Test
    @DisplayName("A zero Retry-After hint retries without waiting for the fixed delay")
    void testZeroHintOverridesLongDelay() throws Exception {
        RetryScheduler scheduler = new RetryScheduler(RetryPolicy.builder().attempts(2).delayMs(60_000).build(), timer);
        AtomicInteger calls = new AtomicInteger();

        ApiResult<String> result = scheduler.<String>run(() -> CompletableFuture.completedFuture(
                calls.incrementAndGet() == 1
                        ? ApiResult.<String>failure(new ClientError.RateLimitError(OptionalLong.of(0), null))
                        : ApiResult.success("ok"))).get(5, TimeUnit.SECONDS);

        assertEquals("ok", result.getValue());
    }

    @Test
    @DisplayName("A custom classifier decides what is retried")
    void testCustomClassifier() throws Exception {
        RetryPolicy policy = RetryPolicy.builder()
                .attempts(3)
                .delayMs(1)
                .retryOn(error -> error instanceof ClientError.HttpError http && http.getStatus() == 503)
                .build();
        RetryScheduler scheduler = new RetryScheduler(policy, timer);
        AtomicInteger calls = new AtomicInteger();

        scheduler.<String>run(() -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(
                    ApiResult.failure(new ClientError.HttpError(500, "Internal Server Error", null, null)));
        }).get(5, TimeUnit.SECONDS);

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Cancelling stops the pending retry and cancels the attempt in flight")
    @Timeout(10)
    void testCancellation() {
        RetryScheduler scheduler = new RetryScheduler(RetryPolicy.builder().attempts(3).delayMs(1).build(), timer);
        CompletableFuture<ApiResult<String>> inFlight = new CompletableFuture<>();

        CompletableFuture<ApiResult<String>> result = scheduler.run(() -> inFlight);
        result.cancel(true);

        assertTrue(inFlight.isCancelled());
        assertTrue(result.isCancelled());
    }

    @Test
    @DisplayName("An exceptional attempt is treated as a network error")
    void testExceptionalAttempt() throws Exception {
        RetryScheduler scheduler = new RetryScheduler(RetryPolicy.noRetry(), timer);
        IllegalStateException boom = new IllegalStateException("boom");

        ApiResult<String> result = scheduler.<String>run(() -> CompletableFuture.failedFuture(boom)).get(5, TimeUnit.SECONDS);

        assertEquals(ClientError.Kind.NETWORK, result.getError().kind());
        assertSame(boom, result.getError().getCause());
    }

    @Test
    @DisplayName("A call that throws instead of returning a future ends the retry loop at once")
    void testCallThatThrows() throws Exception {
        RetryScheduler scheduler = new RetryScheduler(RetryPolicy.builder().attempts(3).delayMs(1).build(), timer);
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException boom = new IllegalStateException("boom");

        ApiResult<String> result = scheduler.<String>run(() -> {
            calls.incrementAndGet();
            throw boom;
        }).get(5, TimeUnit.SECONDS);

        assertEquals(1, calls.get());
        assertEquals(ClientError.Kind.REQUEST, result.getError().kind());
        assertEquals("Request could not be started: boom", result.getError().getMessage());
        assertSame(boom, result.getError().getCause());
    }
}
