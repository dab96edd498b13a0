package de.entwicklertraining.memory.client.streaming;

import java.util.Locale;

/**
 * Enumeration of the streaming response formats the memory API produces.
 */
public enum StreamingFormat {

    /**
     * JSON Lines format (application/x-ndjson).
     *
     * <p>Each line contains a complete JSON value:
     * <pre>
     * {"key": "a"}
     * {"key": "b"}
     * </pre>
     *
     * <p>Also known as newline-delimited JSON (NDJSON).
     */
    JSON_LINES("application/x-ndjson"),

    /**
     * Plain text. Some deployments serve NDJSON as {@code text/plain}; such bodies are decoded
     * line by line as well.
     */
    RAW_TEXT("text/plain");

    private final String contentType;

    StreamingFormat(String contentType) {
        this.contentType = contentType;
    }

    /**
     * Returns the HTTP Content-Type header value for this streaming format.
     *
     * @return The content type string
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * Returns the Accept header value that should be sent to request this format.
     *
     * @return The accept header value
     */
    public String getAcceptHeader() {
        return contentType;
    }

    /**
     * Returns whether a response media type can be decoded line by line.
     *
     * @param mediaType the media type without parameters, may be null
     * @return true for NDJSON and any {@code text/*} type
     */
    public static boolean isLineDelimited(String mediaType) {
        if (mediaType == null) {
            return false;
        }
        String type = mediaType.toLowerCase(Locale.ROOT);
        return type.equals(JSON_LINES.contentType) || type.startsWith("text/");
    }
}
