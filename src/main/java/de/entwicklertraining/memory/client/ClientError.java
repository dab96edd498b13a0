package de.entwicklertraining.memory.client;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Base type of every failure the client reports.
 * <p>
 * A failed call yields exactly one of the nested variants, delivered as a value inside
 * {@link ApiResult}. Callers switch on {@link #kind()} to handle each variant; the
 * variants are also ordinary exceptions so that {@link ApiResult#orElseThrow()} can
 * rethrow them unchanged.
 * <p>
 * No variant ever carries the API key or the {@code Authorization} header.
 */
public abstract class ClientError extends RuntimeException {

    /**
     * Discriminator of the error variants.
     */
    public enum Kind {
        /** Connection, DNS or I/O failure, timeout or abort. */
        NETWORK,
        /** Any non-2xx status that is neither an authorization nor a rate-limit status. */
        HTTP,
        /** HTTP 401 or 403. */
        AUTHORIZATION,
        /** HTTP 429. */
        RATE_LIMIT,
        /** The request could not be built (invalid path, unserializable body). */
        REQUEST,
        /** A streamed record could not be decoded. */
        STREAM_DECODE
    }

    private final String url;

    ClientError(String message, Throwable cause, String url) {
        super(message, cause);
        this.url = url;
    }

    /**
     * Returns the discriminator of this variant.
     *
     * @return the error kind
     */
    public abstract Kind kind();

    /**
     * Returns whether the default retry classification treats this error as transient.
     *
     * @return true for network, HTTP and rate-limit errors
     */
    public boolean isRetryable() {
        return switch (kind()) {
            case NETWORK, HTTP, RATE_LIMIT -> true;
            case AUTHORIZATION, REQUEST, STREAM_DECODE -> false;
        };
    }

    /**
     * Gets the URL of the request that failed, if one was built.
     *
     * @return the request URL
     */
    public Optional<String> getUrl() {
        return Optional.ofNullable(url);
    }

    /**
     * The request never produced an HTTP response.
     */
    public static final class NetworkError extends ClientError {
        public NetworkError(String message, Throwable cause, String url) {
            super(message, cause, url);
        }

        public NetworkError(Throwable cause, String url) {
            this(cause == null || cause.getMessage() == null ? "Network error" : cause.getMessage(), cause, url);
        }

        @Override
        public Kind kind() {
            return Kind.NETWORK;
        }
    }

    /**
     * The server answered with a non-2xx status not covered by a more specific variant.
     */
    public static final class HttpError extends ClientError {
        private final int status;
        private final Object body;

        public HttpError(int status, String message, String url, Object body) {
            super(message, null, url);
            this.status = status;
            this.body = body;
        }

        @Override
        public Kind kind() {
            return Kind.HTTP;
        }

        public int getStatus() {
            return status;
        }

        /**
         * Gets the parsed response body, if the content type was recognized.
         *
         * @return the body as an org.json value or a string
         */
        public Optional<Object> getBody() {
            return Optional.ofNullable(body);
        }
    }

    /**
     * The server rejected the credentials (401) or the permission (403).
     */
    public static final class AuthorizationError extends ClientError {
        private final int status;

        public AuthorizationError(int status, String reason, String url) {
            super(reason, null, url);
            this.status = status;
        }

        @Override
        public Kind kind() {
            return Kind.AUTHORIZATION;
        }

        public int getStatus() {
            return status;
        }

        public String getReason() {
            return getMessage();
        }
    }

    /**
     * The server answered 429 Too Many Requests.
     */
    public static final class RateLimitError extends ClientError {
        private final OptionalLong retryAfterMs;

        public RateLimitError(OptionalLong retryAfterMs, String url) {
            super(retryAfterMs.isPresent()
                    ? "Too many requests, retry after " + retryAfterMs.getAsLong() + " ms"
                    : "Too many requests", null, url);
            this.retryAfterMs = Objects.requireNonNull(retryAfterMs, "retryAfterMs");
        }

        @Override
        public Kind kind() {
            return Kind.RATE_LIMIT;
        }

        /**
         * Gets the server's back-off hint in milliseconds, if it sent a usable one.
         *
         * @return the delay hint
         */
        public OptionalLong getRetryAfterMs() {
            return retryAfterMs;
        }
    }

    /**
     * The request could not be constructed. Nothing was sent.
     */
    public static final class RequestError extends ClientError {
        private final String details;

        public RequestError(String message, Throwable cause, String details) {
            super(message, cause, null);
            this.details = details;
        }

        @Override
        public Kind kind() {
            return Kind.REQUEST;
        }

        public Optional<String> getDetails() {
            return Optional.ofNullable(details);
        }
    }

    /**
     * A line of a newline-delimited JSON stream could not be parsed or mapped.
     */
    public static final class StreamDecodeError extends ClientError {
        private final String rawLine;

        public StreamDecodeError(String rawLine, Throwable cause, String url) {
            super("Failed to decode stream record: " + rawLine, cause, url);
            this.rawLine = rawLine;
        }

        @Override
        public Kind kind() {
            return Kind.STREAM_DECODE;
        }

        /**
         * Gets the offending line exactly as received.
         *
         * @return the raw line
         */
        public String getRawLine() {
            return rawLine;
        }
    }
}
