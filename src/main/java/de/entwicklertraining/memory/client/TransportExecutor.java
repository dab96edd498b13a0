package de.entwicklertraining.memory.client;

import de.entwicklertraining.memory.client.streaming.ByteReader;
import de.entwicklertraining.memory.client.streaming.InputStreamByteReader;
import de.entwicklertraining.memory.client.streaming.StreamingFormat;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes one built request through a {@link HttpTransport} and turns the outcome into an
 * {@link ApiResult}.
 *
 * <p>If the request has a timeout, a timer is armed when the call starts. When it fires the
 * in-flight exchange is cancelled, an already received body is closed, and the call completes
 * with a {@link ClientError.NetworkError} "Request timed out or aborted". The timer is disarmed
 * whenever the call completes, whichever way. Cancelling the returned future aborts the
 * exchange in the same way.
 *
 * <p>Body reads are blocking and run on the worker executor, never on the timer thread.
 */
public final class TransportExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TransportExecutor.class);

    /** Message of the network error reported for timeouts and aborts. */
    public static final String TIMEOUT_MESSAGE = "Request timed out or aborted";

    /**
     * Consumes a response whose status line and headers have arrived.
     *
     * @param <T> the success type
     */
    @FunctionalInterface
    interface ResponseHandler<T> {
        ApiResult<T> handle(TransportResponse response, String url) throws IOException;
    }

    private final HttpTransport transport;
    private final ErrorTranslator errorTranslator;
    private final ScheduledExecutorService timer;
    private final Executor worker;

    public TransportExecutor(HttpTransport transport, ErrorTranslator errorTranslator,
                             ScheduledExecutorService timer, Executor worker) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.errorTranslator = Objects.requireNonNull(errorTranslator, "errorTranslator");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.worker = Objects.requireNonNull(worker, "worker");
    }

    /**
     * Executes a request and reads the whole body.
     *
     * @param request the request
     * @return the response for 2xx, otherwise the translated error
     */
    public CompletableFuture<ApiResult<ApiResponse<Object>>> execute(ApiHttpRequest request) {
        return execute(request, this::readBuffered);
    }

    /**
     * Executes a request whose 2xx body is consumed incrementally. The timeout covers the
     * exchange up to the response headers; the caller paces the body.
     *
     * @param request the request
     * @param bufferSize the read chunk size
     * @return a reader over the body for 2xx, otherwise the translated error
     */
    public CompletableFuture<ApiResult<ByteReader>> executeStreaming(ApiHttpRequest request, int bufferSize) {
        return execute(request, (response, url) -> {
            if (!response.isSuccessful()) {
                return readBuffered(response, url).map(ignored -> null);
            }
            return ApiResult.success(new InputStreamByteReader(response.body(), bufferSize));
        });
    }

    <T> CompletableFuture<ApiResult<T>> execute(ApiHttpRequest request, ResponseHandler<T> handler) {
        String url = request.url();
        CompletableFuture<ApiResult<T>> result = new CompletableFuture<>();
        logger.debug("Sending {} {}", request.method(), url);

        CompletableFuture<TransportResponse> exchange;
        try {
            exchange = Objects.requireNonNull(transport.send(request), "transport returned no future");
        } catch (RuntimeException e) {
            result.complete(ApiResult.failure(new ClientError.NetworkError(e, url)));
            return result;
        }

        AtomicReference<TransportResponse> received = new AtomicReference<>();
        ScheduledFuture<?> timeoutTask = armTimer(request.timeout(), () -> {
            if (result.complete(ApiResult.failure(new ClientError.NetworkError(TIMEOUT_MESSAGE,
                    new TimeoutException("No response within " + request.timeout()), url)))) {
                logger.debug("{} {} timed out after {}", request.method(), url, request.timeout());
                abort(exchange, received);
            }
        });

        result.whenComplete((r, e) -> {
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
            if (result.isCancelled()) {
                logger.debug("{} {} cancelled by caller", request.method(), url);
                abort(exchange, received);
            }
        });

        exchange.whenComplete((response, failure) -> {
            if (failure != null) {
                result.complete(ApiResult.failure(translateTransportFailure(failure, url)));
                return;
            }
            received.set(response);
            if (result.isDone()) {
                closeQuietly(response);
                return;
            }
            try {
                worker.execute(() -> handle(response, url, handler, result));
            } catch (RejectedExecutionException e) {
                closeQuietly(response);
                result.complete(ApiResult.failure(new ClientError.NetworkError("Client is closed", e, url)));
            }
        });
        return result;
    }

    private <T> void handle(TransportResponse response, String url, ResponseHandler<T> handler,
                            CompletableFuture<ApiResult<T>> result) {
        logger.debug("Received {} from {}", response.status(), url);
        ApiResult<T> outcome;
        try {
            outcome = handler.handle(response, url);
        } catch (IOException | RuntimeException e) {
            closeQuietly(response);
            outcome = ApiResult.failure(result.isDone()
                    ? new ClientError.NetworkError(TIMEOUT_MESSAGE, e, url)
                    : new ClientError.NetworkError(e, url));
        }
        if (!result.complete(outcome) && outcome.isSuccess() && outcome.getValue() instanceof ByteReader reader) {
            // lost the race against timeout or cancellation
            reader.cancel();
        }
    }

    private ApiResult<ApiResponse<Object>> readBuffered(TransportResponse response, String url) throws IOException {
        byte[] bytes;
        try (TransportResponse r = response) {
            bytes = r.body().readAllBytes();
        }
        Object body = decodeBody(response.headers(), bytes, url);
        if (response.isSuccessful()) {
            return ApiResult.success(new ApiResponse<>(response.status(), response.headers(), body));
        }
        return ApiResult.failure(
                errorTranslator.translate(response.status(), response.statusText(), response.headers(), body, url));
    }

    /**
     * Decodes a body by its media type: JSON to an org.json value, text and NDJSON to a string,
     * anything else to null. A JSON body that does not parse also yields null.
     */
    static Object decodeBody(ResponseHeaders headers, byte[] bytes, String url) {
        String mediaType = headers.mediaType().orElse(null);
        if (mediaType == null) {
            return null;
        }
        if (mediaType.equals(RequestBuilder.JSON_CONTENT_TYPE) || mediaType.endsWith("+json")) {
            if (bytes.length == 0) {
                return null;
            }
            try {
                return JsonSupport.parseStrict(new String(bytes, StandardCharsets.UTF_8));
            } catch (JSONException e) {
                logger.debug("Response body from {} is not valid JSON: {}", url, e.getMessage());
                return null;
            }
        }
        if (StreamingFormat.isLineDelimited(mediaType)) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return null;
    }

    /**
     * Classifies a failed exchange. Timeouts and aborts share one message; everything else
     * keeps its original cause.
     *
     * @param failure the failure of the transport future
     * @param url the request URL
     * @return the network error
     */
    public static ClientError translateTransportFailure(Throwable failure, String url) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ClientError clientError) {
            return clientError;
        }
        if (cause instanceof CancellationException
                || cause instanceof HttpTimeoutException
                || cause instanceof TimeoutException) {
            return new ClientError.NetworkError(TIMEOUT_MESSAGE, cause, url);
        }
        return new ClientError.NetworkError(cause, url);
    }

    private ScheduledFuture<?> armTimer(Duration timeout, Runnable onTimeout) {
        if (timeout == null) {
            return null;
        }
        try {
            return timer.schedule(onTimeout, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Timer rejected timeout task, request runs without timeout: {}", e.getMessage());
            return null;
        }
    }

    private static void abort(CompletableFuture<TransportResponse> exchange, AtomicReference<TransportResponse> received) {
        exchange.cancel(true);
        closeQuietly(received.get());
    }

    private static void closeQuietly(TransportResponse response) {
        if (response == null) {
            return;
        }
        try {
            response.close();
        } catch (IOException e) {
            logger.debug("Closing response body failed: {}", e.getMessage());
        }
    }
}
