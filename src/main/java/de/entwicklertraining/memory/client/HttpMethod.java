package de.entwicklertraining.memory.client;

/**
 * HTTP methods used by the memory API.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
