package de.entwicklertraining.memory.client;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * {@link HttpTransport} backed by {@link java.net.http.HttpClient}.
 * <p>
 * Timeouts are enforced by {@link TransportExecutor}, not by the JDK client, so that
 * every timeout surfaces the same way regardless of transport.
 */
public final class JdkHttpTransport implements HttpTransport {

    // restricted by the JDK client, it sets them itself
    private static final Set<String> RESTRICTED_HEADERS = restricted();

    private final HttpClient httpClient;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public CompletableFuture<TransportResponse> send(ApiHttpRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            if (!RESTRICTED_HEADERS.contains(header.getKey())) {
                builder.header(header.getKey(), header.getValue());
            }
        }

        byte[] body = request.body();
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);
        switch (request.method()) {
            case GET -> builder.GET();
            case DELETE -> {
                if (body == null) {
                    builder.DELETE();
                } else {
                    builder.method("DELETE", publisher);
                }
            }
            case POST -> builder.POST(publisher);
            case PUT -> builder.PUT(publisher);
            case PATCH -> builder.method("PATCH", publisher);
        }

        CompletableFuture<HttpResponse<InputStream>> exchange =
                httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        CompletableFuture<TransportResponse> result = exchange.thenApply(response -> new TransportResponse(
                response.statusCode(),
                HttpStatusText.of(response.statusCode()),
                ResponseHeaders.of(response.headers().map()),
                response.body()));
        // cancelling the dependent stage does not reach the exchange on its own
        result.whenComplete((r, e) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private static Set<String> restricted() {
        TreeSet<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.addAll(Set.of("Connection", "Content-Length", "Expect", "Host", "Upgrade"));
        return names;
    }
}
