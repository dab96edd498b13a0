package de.entwicklertraining.memory.client;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Absolute http(s) root that request paths are resolved against.
 * <p>
 * The stored URI always ends with a slash so that relative paths keep any
 * path prefix of the base, e.g. {@code https://host/api/} + {@code v1/keys}.
 *
 * @param uri the normalized base URI
 */
public record BaseUrl(URI uri) {

    /** Default endpoint of the hosted memory API. */
    public static final String DEFAULT = "https://api.supermemory.ai";

    public BaseUrl {
        if (uri == null) {
            throw new IllegalArgumentException("Base URL cannot be null");
        }
        String scheme = uri.getScheme();
        if (!uri.isAbsolute() || uri.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException("Base URL must be an absolute http(s) URL: " + uri);
        }
        if (uri.getRawPath() == null || !uri.getRawPath().endsWith("/")) {
            uri = URI.create(uri.toString() + "/");
        }
    }

    /**
     * Parses a base URL string.
     *
     * @param baseUrl the URL, e.g. "https://api.example.com"
     * @return the base URL
     * @throws IllegalArgumentException if the string is empty or not an absolute http(s) URL
     */
    public static BaseUrl of(String baseUrl) {
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be null or empty");
        }
        try {
            return new BaseUrl(new URI(baseUrl.trim()));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid base URL: " + baseUrl, e);
        }
    }

    /**
     * Resolves a path against this base. A leading slash replaces the base path, as in a browser.
     *
     * @param path the relative or absolute path, may contain a query
     * @return the absolute URI
     * @throws IllegalArgumentException if the path is not a valid URI reference
     */
    public URI resolve(String path) {
        return uri.resolve(path);
    }

    @Override
    public String toString() {
        return uri.toString();
    }
}
