package de.entwicklertraining.memory.client.batch;

import de.entwicklertraining.memory.client.ApiResult;
import de.entwicklertraining.memory.client.ClientError;
import de.entwicklertraining.memory.client.TransportExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs keyed operations with bounded concurrency and collects one outcome per key.
 *
 * <p>A failing operation never stops its siblings, and nothing already done is undone. The
 * outcome lists items in input order regardless of completion order. An operation that
 * throws instead of returning a future is recorded as a {@link ClientError.RequestError}
 * for its key.
 */
public final class BatchAggregator {

    private static final Logger logger = LoggerFactory.getLogger(BatchAggregator.class);

    private final int maxConcurrency;

    public BatchAggregator(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("Max concurrency must be at least 1");
        }
        this.maxConcurrency = maxConcurrency;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Runs all operations.
     *
     * @param operations the operations; keys must be unique
     * @param <K> the key type
     * @param <V> the value type
     * @return the outcomes, never completed exceptionally
     * @throws IllegalArgumentException if two operations share a key
     */
    public <K, V> CompletableFuture<BatchOutcome<K, V>> run(List<BatchOperation<K, V>> operations) {
        List<BatchOperation<K, V>> ops = List.copyOf(operations);
        Set<K> seen = new HashSet<>();
        for (BatchOperation<K, V> op : ops) {
            if (!seen.add(op.key())) {
                throw new IllegalArgumentException("Duplicate batch key: " + op.key());
            }
        }
        if (ops.isEmpty()) {
            return CompletableFuture.completedFuture(new BatchOutcome<>(List.of(), null));
        }

        Run<K, V> run = new Run<>(ops);
        int lanes = Math.min(maxConcurrency, ops.size());
        logger.debug("Running batch of {} operations on {} lanes", ops.size(), lanes);
        for (int i = 0; i < lanes; i++) {
            run.startNext();
        }
        return run.done;
    }

    private static final class Run<K, V> {
        private final List<BatchOperation<K, V>> ops;
        private final AtomicReferenceArray<ApiResult<V>> results;
        private final AtomicInteger nextIndex = new AtomicInteger();
        private final AtomicInteger remaining;
        private final CompletableFuture<BatchOutcome<K, V>> done = new CompletableFuture<>();

        Run(List<BatchOperation<K, V>> ops) {
            this.ops = ops;
            this.results = new AtomicReferenceArray<>(ops.size());
            this.remaining = new AtomicInteger(ops.size());
        }

        void startNext() {
            // completed futures are drained in this loop instead of recursing
            while (!done.isDone()) {
                int index = nextIndex.getAndIncrement();
                if (index >= ops.size()) {
                    return;
                }
                CompletableFuture<ApiResult<V>> future = start(ops.get(index));
                if (future.isDone()) {
                    record(index, future);
                    continue;
                }
                future.whenComplete((r, e) -> {
                    record(index, future);
                    startNext();
                });
                return;
            }
        }

        private CompletableFuture<ApiResult<V>> start(BatchOperation<K, V> op) {
            try {
                CompletableFuture<ApiResult<V>> future = op.call().get();
                if (future == null) {
                    return CompletableFuture.completedFuture(ApiResult.failure(new ClientError.RequestError(
                            "Batch operation returned no future", null, "key=" + op.key())));
                }
                return future;
            } catch (RuntimeException e) {
                return CompletableFuture.completedFuture(ApiResult.failure(new ClientError.RequestError(
                        "Batch operation failed to start: " + e.getMessage(), e, "key=" + op.key())));
            }
        }

        private void record(int index, CompletableFuture<ApiResult<V>> future) {
            ApiResult<V> result = future.handle((r, e) -> {
                if (e != null) {
                    return ApiResult.<V>failure(TransportExecutor.translateTransportFailure(e, null));
                }
                return Objects.requireNonNullElseGet(r, () -> ApiResult.<V>failure(new ClientError.RequestError(
                        "Batch operation completed without a result", null, "key=" + ops.get(index).key())));
            }).join();
            results.set(index, result);
            if (remaining.decrementAndGet() == 0) {
                List<BatchItemOutcome<K, V>> outcomes = new ArrayList<>(ops.size());
                for (int i = 0; i < ops.size(); i++) {
                    outcomes.add(new BatchItemOutcome<>(ops.get(i).key(), results.get(i)));
                }
                BatchOutcome<K, V> outcome = new BatchOutcome<>(outcomes, null);
                outcome.getFailure().ifPresent(failure ->
                        logger.debug("Batch finished with {} successes and {} failures",
                                failure.getSuccesses(), failure.getFailures().size()));
                done.complete(outcome);
            }
        }
    }
}
