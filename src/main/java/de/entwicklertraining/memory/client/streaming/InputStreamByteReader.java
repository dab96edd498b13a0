package de.entwicklertraining.memory.client.streaming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * {@link ByteReader} over a response body stream.
 */
public final class InputStreamByteReader implements ByteReader {

    private static final Logger logger = LoggerFactory.getLogger(InputStreamByteReader.class);

    private final InputStream in;
    private final byte[] buffer;
    private volatile boolean cancelled;

    public InputStreamByteReader(InputStream in, int bufferSize) {
        this.in = Objects.requireNonNull(in, "in");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive");
        }
        this.buffer = new byte[bufferSize];
    }

    @Override
    public byte[] read() throws IOException {
        if (cancelled) {
            return null;
        }
        int n;
        try {
            n = in.read(buffer);
        } catch (IOException e) {
            if (cancelled) {
                // the stream was closed under a blocked read
                return null;
            }
            throw e;
        }
        if (n < 0 || cancelled) {
            return null;
        }
        return Arrays.copyOf(buffer, n);
    }

    @Override
    public void cancel() {
        cancelled = true;
        try {
            in.close();
        } catch (IOException e) {
            logger.debug("Closing cancelled response body failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
