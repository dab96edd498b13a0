package de.entwicklertraining.memory.client.streaming;

import java.io.Closeable;
import java.io.IOException;

/**
 * Pull-based source of response body chunks.
 *
 * <p>{@link #cancel()} aborts the underlying transfer and may be called from any thread,
 * including while another thread is blocked in {@link #read()}. {@link #close()} releases
 * the source after it was read to the end.
 */
public interface ByteReader extends Closeable {

    /**
     * Reads the next chunk, blocking until data is available.
     *
     * @return the next non-empty chunk, or null at end of input or after cancellation
     * @throws IOException if the transfer fails
     */
    byte[] read() throws IOException;

    /**
     * Aborts the transfer. Subsequent and pending reads return null.
     */
    void cancel();
}
