package de.entwicklertraining.memory.client;

import de.entwicklertraining.memory.client.batch.BatchAggregator;
import de.entwicklertraining.memory.client.batch.BatchOperation;
import de.entwicklertraining.memory.client.batch.BatchOutcome;
import de.entwicklertraining.memory.client.streaming.ByteReader;
import de.entwicklertraining.memory.client.streaming.NdjsonStream;
import de.entwicklertraining.memory.client.streaming.RecordMapper;
import de.entwicklertraining.memory.client.streaming.StreamingFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client for the memory API.
 *
 * <p>Every call goes through the same pipeline: the {@link RequestBuilder} resolves the path and
 * merges headers, the {@link TransportExecutor} performs the exchange under a timeout, and a
 * non-2xx status is turned into exactly one {@link ClientError} by the {@link ErrorTranslator}.
 * Results are values: nothing in this class throws for a failed call.
 *
 * <p>All state is per instance. The transport, the timer and the worker pool can be injected;
 * executors created by the client itself are shut down by {@link #close()}.
 *
 * <p>Example usage:
 * <pre>
 * try (MemoryApiClient client = new MemoryApiClient(ApiHttpConfiguration.builder()
 *         .apiKey("your-api-key")
 *         .build())) {
 *     ApiResult&lt;ApiResponse&lt;Object&gt;&gt; result = client.request(HttpMethod.GET, "/api/v1/memories/k1", RequestOptions.none());
 * }
 * </pre>
 */
public class MemoryApiClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MemoryApiClient.class);

    private final ApiHttpConfiguration httpConfig;
    private final ApiClientSettings settings;
    private final RequestBuilder requestBuilder;
    private final TransportExecutor transportExecutor;
    private final RetryScheduler retryScheduler;
    private final BatchAggregator batchAggregator;
    private final ScheduledExecutorService timer;
    private final ExecutorService worker;
    private final boolean ownsExecutors;

    public MemoryApiClient(ApiHttpConfiguration httpConfig) {
        this(httpConfig, ApiClientSettings.defaults());
    }

    public MemoryApiClient(ApiHttpConfiguration httpConfig, ApiClientSettings settings) {
        this(httpConfig, settings, new JdkHttpTransport());
    }

    /**
     * Creates a client with its own timer and worker threads.
     *
     * @param httpConfig base URL, credentials and global headers
     * @param settings timeouts, retry and streaming behavior
     * @param transport the transport to send requests with
     */
    public MemoryApiClient(ApiHttpConfiguration httpConfig, ApiClientSettings settings, HttpTransport transport) {
        this(httpConfig, settings, transport, newTimer(), Executors.newCachedThreadPool(daemonThreads("memory-api-worker")), true);
    }

    /**
     * Creates a client on caller-owned executors. {@link #close()} leaves them running.
     *
     * @param httpConfig base URL, credentials and global headers
     * @param settings timeouts, retry and streaming behavior
     * @param transport the transport to send requests with
     * @param timer runs timeouts and retry delays
     * @param worker runs blocking body reads
     */
    public MemoryApiClient(ApiHttpConfiguration httpConfig, ApiClientSettings settings, HttpTransport transport,
                           ScheduledExecutorService timer, ExecutorService worker) {
        this(httpConfig, settings, transport, timer, worker, false);
    }

    private MemoryApiClient(ApiHttpConfiguration httpConfig, ApiClientSettings settings, HttpTransport transport,
                            ScheduledExecutorService timer, ExecutorService worker, boolean ownsExecutors) {
        this.httpConfig = Objects.requireNonNull(httpConfig, "httpConfig");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.ownsExecutors = ownsExecutors;
        this.requestBuilder = new RequestBuilder(httpConfig.getBaseUrl(), httpConfig.getDefaultHeaders(), settings.getTimeout());
        this.transportExecutor = new TransportExecutor(
                Objects.requireNonNull(transport, "transport"),
                new ErrorTranslator(settings.getClock(), settings.getErrorMessagePolicy()),
                timer,
                worker);
        this.retryScheduler = new RetryScheduler(settings.getRetryPolicy(), timer);
        this.batchAggregator = new BatchAggregator(settings.getBatchConcurrency());
        logger.debug("Created memory API client for {}", httpConfig.getBaseUrl());
    }

    public ApiHttpConfiguration getHttpConfiguration() {
        return httpConfig;
    }

    public ApiClientSettings getSettings() {
        return settings;
    }

    /**
     * Performs a single round trip.
     *
     * @param method the HTTP method
     * @param path the path relative to the base URL
     * @param options query, headers, body and timeout of this call
     * @return the response or one error
     */
    public CompletableFuture<ApiResult<ApiResponse<Object>>> requestAsync(HttpMethod method, String path, RequestOptions options) {
        ApiResult<ApiHttpRequest> request = requestBuilder.build(method, path, options);
        if (request.isFailure()) {
            return CompletableFuture.completedFuture(ApiResult.failure(request.getError()));
        }
        return transportExecutor.execute(request.getValue());
    }

    public ApiResult<ApiResponse<Object>> request(HttpMethod method, String path, RequestOptions options) {
        return requestAsync(method, path, options).join();
    }

    /**
     * Performs a round trip under the client's {@link RetryPolicy}.
     *
     * @param method the HTTP method
     * @param path the path relative to the base URL
     * @param options query, headers, body and timeout of each attempt
     * @return the first success, a terminal error, or the last error once attempts run out
     */
    public CompletableFuture<ApiResult<ApiResponse<Object>>> requestWithRetryAsync(HttpMethod method, String path, RequestOptions options) {
        return retryScheduler.run(() -> requestAsync(method, path, options));
    }

    public CompletableFuture<ApiResult<ApiResponse<Object>>> requestWithRetryAsync(HttpMethod method, String path,
                                                                                  RequestOptions options, RetryPolicy policy) {
        return new RetryScheduler(policy, timer).run(() -> requestAsync(method, path, options));
    }

    public ApiResult<ApiResponse<Object>> requestWithRetry(HttpMethod method, String path, RequestOptions options) {
        return requestWithRetryAsync(method, path, options).join();
    }

    /**
     * Performs a streaming round trip. {@code Accept: application/x-ndjson} is sent unless the
     * options set another {@code Accept} header. The caller owns the returned reader.
     *
     * @param method the HTTP method
     * @param path the path relative to the base URL
     * @param options query, headers, body and timeout of this call
     * @return a reader over the 2xx body, or one error
     */
    public CompletableFuture<ApiResult<ByteReader>> requestStreamAsync(HttpMethod method, String path, RequestOptions options) {
        ApiResult<ApiHttpRequest> request = buildStreamingRequest(method, path, options);
        if (request.isFailure()) {
            return CompletableFuture.completedFuture(ApiResult.failure(request.getError()));
        }
        return transportExecutor.executeStreaming(request.getValue(), settings.getStreamingConfig().getBufferSize());
    }

    public ApiResult<ByteReader> requestStream(HttpMethod method, String path, RequestOptions options) {
        return requestStreamAsync(method, path, options).join();
    }

    /**
     * Opens a streaming round trip and decodes its body as newline-delimited JSON.
     *
     * @param method the HTTP method
     * @param path the path relative to the base URL
     * @param options query, headers, body and timeout of this call
     * @param mapper maps each parsed line to a record
     * @param <T> the record type
     * @return a lazy record sequence the caller must close, or one error
     */
    public <T> CompletableFuture<ApiResult<NdjsonStream<T>>> streamNdjsonAsync(HttpMethod method, String path,
                                                                            RequestOptions options, RecordMapper<T> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        ApiResult<ApiHttpRequest> request = buildStreamingRequest(method, path, options);
        if (request.isFailure()) {
            return CompletableFuture.completedFuture(ApiResult.failure(request.getError()));
        }
        String url = request.getValue().url();
        return transportExecutor.executeStreaming(request.getValue(), settings.getStreamingConfig().getBufferSize())
                .thenApply(result -> result.map(reader ->
                        new NdjsonStream<T>(reader, mapper, settings.getStreamingConfig(), url)));
    }

    public <T> ApiResult<NdjsonStream<T>> streamNdjson(HttpMethod method, String path, RequestOptions options,
                                                       RecordMapper<T> mapper) {
        return streamNdjsonAsync(method, path, options, mapper).join();
    }

    /**
     * Runs keyed operations with the client's batch concurrency.
     *
     * @param operations the operations; keys must be unique
     * @param <K> the key type
     * @param <V> the value type
     * @return one outcome per key, in input order
     */
    public <K, V> CompletableFuture<BatchOutcome<K, V>> runBatch(List<BatchOperation<K, V>> operations) {
        return batchAggregator.run(operations);
    }

    /**
     * Shuts down the executors this client created. Injected executors are left alone.
     */
    @Override
    public void close() {
        if (ownsExecutors) {
            timer.shutdownNow();
            worker.shutdown();
        }
    }

    private ApiResult<ApiHttpRequest> buildStreamingRequest(HttpMethod method, String path, RequestOptions options) {
        RequestOptions opts = options == null ? RequestOptions.none() : options;
        boolean hasAccept = opts.getHeaders().keySet().stream().anyMatch("Accept"::equalsIgnoreCase);
        if (!hasAccept) {
            opts = opts.toBuilder().header("Accept", StreamingFormat.JSON_LINES.getAcceptHeader()).build();
        }
        return requestBuilder.build(method, path, opts);
    }

    private static ScheduledExecutorService newTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, daemonThreads("memory-api-timer"));
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
