package de.entwicklertraining.memory.client;

/**
 * Selects the message of an {@link ClientError.HttpError}.
 */
public enum ErrorMessagePolicy {

    /** The message is always the response's status text. */
    STATUS_TEXT,

    /**
     * A non-empty {@code message} string in a JSON error body wins; an empty or missing one
     * falls back to the status text.
     */
    BODY_MESSAGE_OR_STATUS_TEXT,

    /**
     * A {@code message} string in a JSON error body is used as-is, even when empty.
     * Without one the status text is used.
     */
    BODY_MESSAGE_VERBATIM
}
