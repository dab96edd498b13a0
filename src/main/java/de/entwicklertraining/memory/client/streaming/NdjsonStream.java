package de.entwicklertraining.memory.client.streaming;

import de.entwicklertraining.memory.client.ApiResult;
import de.entwicklertraining.memory.client.ClientError;
import de.entwicklertraining.memory.client.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite sequence of records decoded from a newline-delimited JSON body.
 *
 * <p>Chunks are pulled from the {@link ByteReader} only as the consumer asks for records.
 * A malformed complete line ends the sequence with a {@link ClientError.StreamDecodeError}
 * thrown from {@link #hasNext()}; records decoded before it are still delivered. The fragment
 * left after the last newline is decoded once when input ends; if it is malformed the
 * configured {@link StreamingConfig.TrailingLinePolicy} decides between failing and
 * discarding it with a warning.
 *
 * <p>The underlying reader is released exactly once: {@link ByteReader#close()} after a
 * normal end, {@link ByteReader#cancel()} after an error or when the consumer closes early.
 * {@link #close()} may be called from another thread while a read is blocked.
 *
 * <p>The sequence cannot be restarted.
 *
 * @param <T> the record type
 */
public final class NdjsonStream<T> implements Iterator<T>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NdjsonStream.class);

    private final ByteReader reader;
    private final RecordMapper<T> mapper;
    private final StreamingConfig config;
    private final String url;
    private final NdjsonDecoder decoder = new NdjsonDecoder();
    private final ArrayDeque<T> ready = new ArrayDeque<>();
    private final AtomicBoolean released = new AtomicBoolean();

    private volatile DecoderState state = DecoderState.READING;
    private volatile boolean closed;
    private volatile ClientError error;
    private volatile String discardedTrailingLine;

    public NdjsonStream(ByteReader reader, RecordMapper<T> mapper, StreamingConfig config, String url) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.config = config == null ? StreamingConfig.defaults() : config;
        this.url = url;
    }

    public NdjsonStream(ByteReader reader, RecordMapper<T> mapper) {
        this(reader, mapper, StreamingConfig.defaults(), null);
    }

    /**
     * Returns whether another record is available, reading more input if needed.
     *
     * @return true if {@link #next()} will return a record
     * @throws ClientError.StreamDecodeError if a line could not be decoded
     * @throws ClientError.NetworkError if reading the body failed
     */
    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !closed && !state.isTerminal()) {
            pull();
        }
        if (closed) {
            return false;
        }
        if (!ready.isEmpty()) {
            return true;
        }
        if (error != null) {
            throw error;
        }
        return false;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more records");
        }
        T record = ready.poll();
        if (ready.isEmpty() && state == DecoderState.EMITTING) {
            state = DecoderState.READING;
        }
        return record;
    }

    /**
     * Returns the current lifecycle state. A stream closed by the consumer reports
     * {@link DecoderState#DONE} unless it had already failed.
     *
     * @return the state
     */
    public DecoderState state() {
        if (closed && state != DecoderState.ERROR) {
            return DecoderState.DONE;
        }
        return state;
    }

    public Optional<ClientError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the malformed fragment that was dropped at end of input, if any.
     *
     * @return the raw fragment
     */
    public Optional<String> getDiscardedTrailingLine() {
        return Optional.ofNullable(discardedTrailingLine);
    }

    /**
     * Exposes the remaining records as a sequential stream. Closing the stream closes this sequence.
     *
     * @return the stream
     */
    public Stream<T> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    /**
     * Drains the remaining records and closes the sequence.
     *
     * @return all records, or the error that ended the stream
     */
    public ApiResult<List<T>> collect() {
        List<T> records = new ArrayList<>();
        try {
            while (hasNext()) {
                records.add(next());
            }
            return ApiResult.success(records);
        } catch (ClientError e) {
            return ApiResult.failure(e);
        } finally {
            close();
        }
    }

    /**
     * Stops consumption. Before the end of input this cancels the underlying transfer.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!state.isTerminal()) {
            logger.debug("Stream closed by consumer before end of input, cancelling {}", url);
            cancelReader();
        }
    }

    private void pull() {
        byte[] chunk;
        try {
            chunk = reader.read();
        } catch (IOException e) {
            if (!closed) {
                fail(new ClientError.NetworkError(e, url));
            }
            return;
        }
        if (closed) {
            return;
        }
        if (chunk == null) {
            endOfInput();
            return;
        }

        for (String line : decoder.accept(chunk)) {
            if (!emit(line)) {
                return;
            }
        }
        if (decoder.bufferedLength() > config.getMaxLineLength()) {
            fail(new ClientError.StreamDecodeError("<line longer than " + config.getMaxLineLength() + " characters>",
                    new IllegalStateException("NDJSON line exceeds the configured maximum length"), url));
            return;
        }
        state = ready.isEmpty() ? DecoderState.READING : DecoderState.EMITTING;
    }

    private boolean emit(String line) {
        try {
            ready.add(decode(line));
            return true;
        } catch (RuntimeException e) {
            fail(new ClientError.StreamDecodeError(line, e, url));
            return false;
        }
    }

    private void endOfInput() {
        Optional<String> rest = decoder.finish();
        if (rest.isPresent()) {
            String fragment = rest.get();
            try {
                ready.add(decode(fragment));
            } catch (RuntimeException e) {
                if (config.getTrailingLinePolicy() == StreamingConfig.TrailingLinePolicy.FAIL) {
                    fail(new ClientError.StreamDecodeError(fragment, e, url));
                    return;
                }
                discardedTrailingLine = fragment;
                logger.warn("Discarding malformed trailing NDJSON fragment from {}: {}", url, fragment);
            }
        }
        state = DecoderState.DONE;
        if (released.compareAndSet(false, true)) {
            try {
                reader.close();
            } catch (IOException e) {
                logger.debug("Closing stream reader failed: {}", e.getMessage());
            }
        }
    }

    private T decode(String line) {
        Object json = JsonSupport.parseStrict(line);
        return Objects.requireNonNull(mapper.map(json), "Record mapper returned null");
    }

    private void fail(ClientError cause) {
        error = cause;
        state = DecoderState.ERROR;
        logger.debug("NDJSON stream from {} failed: {}", url, cause.getMessage());
        cancelReader();
    }

    private void cancelReader() {
        if (released.compareAndSet(false, true)) {
            reader.cancel();
        }
    }
}
