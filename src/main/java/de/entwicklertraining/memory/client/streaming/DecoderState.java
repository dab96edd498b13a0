package de.entwicklertraining.memory.client.streaming;

/**
 * Lifecycle of an {@link NdjsonStream}.
 *
 * <p>{@code READING -> EMITTING -> READING} while input flows; {@link #DONE} and
 * {@link #ERROR} are terminal.
 */
public enum DecoderState {
    /** Waiting for the next chunk. */
    READING,
    /** Decoded records are waiting to be consumed. */
    EMITTING,
    /** Input ended, or the consumer closed the stream. */
    DONE,
    /** Decoding or reading failed. */
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
