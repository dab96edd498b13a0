package de.entwicklertraining.memory.client;

import java.io.IOException;
import java.io.InputStream;

/**
 * Raw response as delivered by a {@link HttpTransport}. The caller owns the body stream.
 *
 * @param status the HTTP status code
 * @param statusText the reason phrase, may be empty
 * @param headers the response headers
 * @param body the unread body
 */
public record TransportResponse(int status, String statusText, ResponseHeaders headers, InputStream body)
        implements AutoCloseable {

    public TransportResponse {
        statusText = statusText == null ? "" : statusText;
        headers = headers == null ? ResponseHeaders.empty() : headers;
        body = body == null ? InputStream.nullInputStream() : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
