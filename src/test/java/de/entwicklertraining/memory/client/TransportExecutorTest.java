package de.entwicklertraining.memory.client;

import de.entwicklertraining.memory.client.streaming.ByteReader;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TransportExecutorTest {

    private static final String URL = "https://api.example.com/api/v1/memories/k1";

    private StubTransport transport;
    private ScheduledThreadPoolExecutor timer;
    private ExecutorService worker;
    private TransportExecutor executor;

    @BeforeEach
    void setUp() {
        transport = new StubTransport();
        timer = new ScheduledThreadPoolExecutor(1);
        timer.setRemoveOnCancelPolicy(true);
        worker = Executors.newCachedThreadPool();
        executor = new TransportExecutor(transport,
                new ErrorTranslator(Clock.systemUTC(), ErrorMessagePolicy.STATUS_TEXT), timer, worker);
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
        worker.shutdownNow();
    }

    @Test
    @DisplayName("A JSON success body is parsed")
    void testJsonSuccess() throws Exception {
        transport.enqueue(StubTransport.json(200, "{\"key\":\"k1\",\"value\":\"djE=\"}"));

        ApiResult<ApiResponse<Object>> result = executor.execute(request(Duration.ofSeconds(5))).get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        JSONObject body = result.getValue().jsonObject().orElseThrow();
        assertEquals("k1", body.getString("key"));
        assertEquals(200, result.getValue().getStatus());
    }

    @Test
    @DisplayName("Bodies are decoded by content type")
    void testContentTypes() throws Exception {
        transport.enqueue(StubTransport.response(200, "text/plain; charset=utf-8", "hello"));
        transport.enqueue(StubTransport.response(200, "application/octet-stream", "\u0001\u0002"));
        transport.enqueue(StubTransport.json(200, "{broken"));
        transport.enqueue(StubTransport.json(200, "{\"key\":\"a\",}"));
        transport.enqueue(StubTransport.empty(204));

        assertEquals("hello", executor.execute(request(null)).get(5, TimeUnit.SECONDS).getValue().getBody());
        assertNull(executor.execute(request(null)).get(5, TimeUnit.SECONDS).getValue().getBody());
        assertNull(executor.execute(request(null)).get(5, TimeUnit.SECONDS).getValue().getBody());
        assertNull(executor.execute(request(null)).get(5, TimeUnit.SECONDS).getValue().getBody());
        ApiResult<ApiResponse<Object>> noContent = executor.execute(request(null)).get(5, TimeUnit.SECONDS);
        assertTrue(noContent.isSuccess());
        assertNull(noContent.getValue().getBody());
    }

    @Test
    @DisplayName("A non-2xx response becomes a translated error carrying the body")
    void testErrorStatus() throws Exception {
        transport.enqueue(StubTransport.json(404, "{\"message\":\"not found\"}"));

        ApiResult<ApiResponse<Object>> result = executor.execute(request(null)).get(5, TimeUnit.SECONDS);

        ClientError.HttpError error = assertInstanceOf(ClientError.HttpError.class, result.getError());
        assertEquals(404, error.getStatus());
        assertEquals("Not Found", error.getMessage());
        assertEquals(URL, error.getUrl().orElseThrow());
        assertInstanceOf(JSONObject.class, error.getBody().orElseThrow());
    }

    @Test
    @DisplayName("A hanging exchange times out with a network error and is cancelled")
    @Timeout(10)
    void testTimeout() throws Exception {
        CompletableFuture<TransportResponse> hanging = new CompletableFuture<>();
        transport.enqueue(request -> hanging);

        ApiResult<ApiResponse<Object>> result = executor.execute(request(Duration.ofMillis(50))).get(5, TimeUnit.SECONDS);

        ClientError.NetworkError error = assertInstanceOf(ClientError.NetworkError.class, result.getError());
        assertEquals(TransportExecutor.TIMEOUT_MESSAGE, error.getMessage());
        assertThrows(CancellationException.class, () -> hanging.get(5, TimeUnit.SECONDS));
        assertTrue(timer.getQueue().isEmpty());
    }

    @Test
    @DisplayName("A transport failure keeps its original cause")
    void testTransportFailure() throws Exception {
        ConnectException refused = new ConnectException("Connection refused");
        transport.enqueue(request -> CompletableFuture.failedFuture(refused));

        ApiResult<ApiResponse<Object>> result = executor.execute(request(Duration.ofSeconds(5))).get(5, TimeUnit.SECONDS);

        ClientError error = result.getError();
        assertEquals(ClientError.Kind.NETWORK, error.kind());
        assertSame(refused, error.getCause());
        assertEquals("Connection refused", error.getMessage());
        assertTrue(timer.getQueue().isEmpty());
    }

    @Test
    @DisplayName("A transport that throws synchronously yields a network error")
    void testTransportThrows() throws Exception {
        transport.enqueue(request -> {
            throw new IllegalStateException("boom");
        });

        ApiResult<ApiResponse<Object>> result = executor.execute(request(null)).get(5, TimeUnit.SECONDS);

        assertEquals(ClientError.Kind.NETWORK, result.getError().kind());
    }

    @Test
    @DisplayName("Cancelling the call cancels the exchange")
    @Timeout(10)
    void testCancellation() {
        CompletableFuture<TransportResponse> hanging = new CompletableFuture<>();
        transport.enqueue(request -> hanging);

        CompletableFuture<ApiResult<ApiResponse<Object>>> call = executor.execute(request(Duration.ofSeconds(30)));
        call.cancel(true);

        assertTrue(hanging.isCancelled());
        assertTrue(timer.getQueue().isEmpty());
    }

    @Test
    @DisplayName("A streaming success hands out a reader over the body")
    void testStreamingSuccess() throws Exception {
        transport.enqueue(StubTransport.ndjson("{\"key\":\"a\"}\n"));

        ApiResult<ByteReader> result = executor.executeStreaming(request(Duration.ofSeconds(5)), 4).get(5, TimeUnit.SECONDS);

        StringBuilder text = new StringBuilder();
        try (ByteReader reader = result.getValue()) {
            byte[] chunk;
            while ((chunk = reader.read()) != null) {
                assertTrue(chunk.length <= 4);
                text.append(new String(chunk, StandardCharsets.UTF_8));
            }
        }
        assertEquals("{\"key\":\"a\"}\n", text.toString());
    }

    @Test
    @DisplayName("A streaming error status is translated like a buffered one")
    void testStreamingError() throws Exception {
        transport.enqueue(StubTransport.response(429, "application/json", "{}", "Retry-After", "3"));

        ApiResult<ByteReader> result = executor.executeStreaming(request(null), 8192).get(5, TimeUnit.SECONDS);

        ClientError.RateLimitError error = assertInstanceOf(ClientError.RateLimitError.class, result.getError());
        assertEquals(3000, error.getRetryAfterMs().getAsLong());
    }

    @Test
    @DisplayName("Wrapped failures are unwrapped before classification")
    void testTranslateTransportFailure() {
        IOException io = new IOException("reset");

        ClientError wrapped = TransportExecutor.translateTransportFailure(
                new CompletionException(io), URL);
        ClientError timedOut = TransportExecutor.translateTransportFailure(
                new HttpTimeoutException("slow"), URL);

        assertSame(io, wrapped.getCause());
        assertEquals(TransportExecutor.TIMEOUT_MESSAGE, timedOut.getMessage());
    }

    private static ApiHttpRequest request(Duration timeout) {
        return new ApiHttpRequest(HttpMethod.GET, URI.create(URL), Map.of("Authorization", "Bearer k"), null, timeout);
    }
}
