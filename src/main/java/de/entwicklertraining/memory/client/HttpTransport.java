package de.entwicklertraining.memory.client;

import java.util.concurrent.CompletableFuture;

/**
 * Sends a built request over the wire.
 * <p>
 * Implementations complete the future once the status line and headers are available;
 * the body is read lazily from {@link TransportResponse#body()}. Cancelling the returned
 * future must abort the exchange. Failures complete the future exceptionally with the
 * underlying I/O exception.
 */
@FunctionalInterface
public interface HttpTransport {

    CompletableFuture<TransportResponse> send(ApiHttpRequest request);
}
