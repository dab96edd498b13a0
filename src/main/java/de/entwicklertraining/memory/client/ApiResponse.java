package de.entwicklertraining.memory.client;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Optional;

/**
 * A successful (2xx) response.
 *
 * <p>The body is decoded by content type: {@code application/json} yields an org.json value,
 * {@code text/*} and {@code application/x-ndjson} yield the raw text, and anything else,
 * including an unparseable JSON body, yields {@code null}.
 *
 * @param <T> The body type
 */
public final class ApiResponse<T> {

    private final int status;
    private final ResponseHeaders headers;
    private final T body;

    public ApiResponse(int status, ResponseHeaders headers, T body) {
        this.status = status;
        this.headers = headers == null ? ResponseHeaders.empty() : headers;
        this.body = body;
    }

    public int getStatus() {
        return status;
    }

    public ResponseHeaders getHeaders() {
        return headers;
    }

    /**
     * Gets the decoded body.
     *
     * @return the body, or null if there was none or its content type was not recognized
     */
    public T getBody() {
        return body;
    }

    /**
     * Returns the body as a JSON object, if it is one.
     *
     * @return the object
     */
    public Optional<JSONObject> jsonObject() {
        return body instanceof JSONObject object ? Optional.of(object) : Optional.empty();
    }

    public Optional<JSONArray> jsonArray() {
        return body instanceof JSONArray array ? Optional.of(array) : Optional.empty();
    }

    @Override
    public String toString() {
        return "ApiResponse[status=" + status + ", body=" + body + "]";
    }
}
