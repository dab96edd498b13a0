package de.entwicklertraining.memory.client.streaming;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ByteReader} fed by the test. Counts releases so tests can check that a stream
 * releases its reader exactly once.
 */
class ScriptedByteReader implements ByteReader {

    private static final byte[] END = new byte[0];

    private final BlockingQueue<Object> chunks = new LinkedBlockingQueue<>();
    private final AtomicInteger reads = new AtomicInteger();
    private final AtomicInteger closeCalls = new AtomicInteger();
    private final AtomicInteger cancelCalls = new AtomicInteger();
    private volatile boolean cancelled;

    static ScriptedByteReader of(String... textChunks) {
        ScriptedByteReader reader = new ScriptedByteReader();
        for (String chunk : textChunks) {
            reader.push(chunk.getBytes(StandardCharsets.UTF_8));
        }
        reader.end();
        return reader;
    }

    ScriptedByteReader push(byte[] chunk) {
        chunks.add(chunk);
        return this;
    }

    ScriptedByteReader fail(IOException failure) {
        chunks.add(failure);
        return this;
    }

    ScriptedByteReader end() {
        chunks.add(END);
        return this;
    }

    @Override
    public byte[] read() throws IOException {
        if (cancelled) {
            return null;
        }
        reads.incrementAndGet();
        Object next;
        try {
            next = chunks.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted", e);
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        byte[] chunk = (byte[]) next;
        if (chunk == END || cancelled) {
            return null;
        }
        return chunk;
    }

    @Override
    public void cancel() {
        cancelCalls.incrementAndGet();
        cancelled = true;
        chunks.add(END);
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
    }

    int reads() {
        return reads.get();
    }

    int closeCalls() {
        return closeCalls.get();
    }

    int cancelCalls() {
        return cancelCalls.get();
    }
}
