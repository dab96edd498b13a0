package de.entwicklertraining.memory.client.batch;

import java.util.List;
import java.util.Optional;

/**
 * Summary of a batch in which at least one item failed.
 *
 * <p>Items that succeeded stay applied; nothing is rolled back. Failures are listed in
 * input order.
 *
 * @param <K> the key type
 */
public final class BatchResult<K> {

    private final int successes;
    private final List<BatchFailure<K>> failures;
    private final String correlationId;

    public BatchResult(int successes, List<BatchFailure<K>> failures, String correlationId) {
        if (successes < 0) {
            throw new IllegalArgumentException("Successes cannot be negative");
        }
        this.successes = successes;
        this.failures = List.copyOf(failures);
        this.correlationId = correlationId;
    }

    public int getSuccesses() {
        return successes;
    }

    public List<BatchFailure<K>> getFailures() {
        return failures;
    }

    /**
     * Gets the server-assigned id of the batch, for support requests.
     *
     * @return the correlation id, if the server sent one
     */
    public Optional<String> getCorrelationId() {
        return Optional.ofNullable(correlationId);
    }

    @Override
    public String toString() {
        return "BatchResult[successes=" + successes + ", failures=" + failures.size()
                + (correlationId == null ? "" : ", correlationId=" + correlationId) + "]";
    }
}
