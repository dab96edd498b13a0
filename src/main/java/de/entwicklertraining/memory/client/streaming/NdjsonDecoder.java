package de.entwicklertraining.memory.client.streaming;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a chunked UTF-8 byte stream into lines.
 *
 * <p>Multi-byte characters split across chunk boundaries are carried over to the next chunk.
 * Complete lines are returned as soon as their newline arrives; the fragment after the last
 * newline stays buffered until more input or {@link #finish()}. Blank lines are dropped and a
 * trailing carriage return is removed. Invalid UTF-8 is replaced with U+FFFD.
 *
 * <p>Not thread-safe. One instance serves one stream.
 */
public final class NdjsonDecoder {

    private static final byte[] NO_BYTES = new byte[0];

    private final CharsetDecoder charsetDecoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private final StringBuilder buffer = new StringBuilder();
    private byte[] pendingBytes = NO_BYTES;
    private boolean finished;

    /**
     * Feeds one chunk.
     *
     * @param chunk the bytes, may be empty
     * @return the non-blank lines completed by this chunk, in order
     * @throws IllegalStateException if {@link #finish()} was already called
     */
    public List<String> accept(byte[] chunk) {
        if (finished) {
            throw new IllegalStateException("Decoder already finished");
        }
        ByteBuffer in;
        if (pendingBytes.length == 0) {
            in = ByteBuffer.wrap(chunk);
        } else {
            in = ByteBuffer.allocate(pendingBytes.length + chunk.length);
            in.put(pendingBytes).put(chunk).flip();
        }
        decode(in, false);
        pendingBytes = new byte[in.remaining()];
        in.get(pendingBytes);
        return drainLines();
    }

    /**
     * Flushes the decoder at end of input. May be called once.
     *
     * @return the non-blank remainder without a terminating newline, if any
     * @throws IllegalStateException if called twice
     */
    public Optional<String> finish() {
        if (finished) {
            throw new IllegalStateException("Decoder already finished");
        }
        finished = true;
        ByteBuffer in = ByteBuffer.wrap(pendingBytes);
        pendingBytes = NO_BYTES;
        decode(in, true);
        CharBuffer out = CharBuffer.allocate(4);
        charsetDecoder.flush(out);
        out.flip();
        buffer.append(out);

        // complete lines were already drained by accept
        String rest = stripCarriageReturn(buffer.toString());
        buffer.setLength(0);
        return rest.isBlank() ? Optional.empty() : Optional.of(rest);
    }

    /**
     * Returns how many characters of an incomplete line are buffered.
     *
     * @return the buffered length
     */
    public int bufferedLength() {
        return buffer.length();
    }

    public boolean isFinished() {
        return finished;
    }

    private void decode(ByteBuffer in, boolean endOfInput) {
        CharBuffer out = CharBuffer.allocate(in.remaining() + 4);
        while (true) {
            CoderResult result = charsetDecoder.decode(in, out, endOfInput);
            if (result.isOverflow()) {
                out.flip();
                buffer.append(out);
                out.clear();
                continue;
            }
            break;
        }
        out.flip();
        buffer.append(out);
    }

    private List<String> drainLines() {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = buffer.indexOf("\n", start)) >= 0) {
            String line = stripCarriageReturn(buffer.substring(start, newline));
            if (!line.isBlank()) {
                lines.add(line);
            }
            start = newline + 1;
        }
        if (start > 0) {
            buffer.delete(0, start);
        }
        return lines;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
