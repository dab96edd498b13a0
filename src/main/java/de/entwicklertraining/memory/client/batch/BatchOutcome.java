package de.entwicklertraining.memory.client.batch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-key outcomes of a batch, in input order.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class BatchOutcome<K, V> {

    private final List<BatchItemOutcome<K, V>> outcomes;
    private final String correlationId;

    public BatchOutcome(List<BatchItemOutcome<K, V>> outcomes, String correlationId) {
        this.outcomes = List.copyOf(outcomes);
        this.correlationId = correlationId;
    }

    public List<BatchItemOutcome<K, V>> getOutcomes() {
        return outcomes;
    }

    public boolean isSuccess() {
        return outcomes.stream().allMatch(BatchItemOutcome::isSuccess);
    }

    /**
     * Returns the values of all successful items keyed in input order. A value may be null
     * for operations without a result body.
     *
     * @return the values
     */
    public Map<K, V> values() {
        Map<K, V> values = new LinkedHashMap<>();
        for (BatchItemOutcome<K, V> outcome : outcomes) {
            if (outcome.isSuccess()) {
                values.put(outcome.key(), outcome.result().getValue());
            }
        }
        return values;
    }

    /**
     * Describes the partial failure, if any item failed.
     *
     * @return the failure summary; empty when every item succeeded
     */
    public Optional<BatchResult<K>> getFailure() {
        int successes = 0;
        List<BatchFailure<K>> failures = new ArrayList<>();
        for (BatchItemOutcome<K, V> outcome : outcomes) {
            if (outcome.isSuccess()) {
                successes++;
            } else {
                failures.add(new BatchFailure<>(outcome.key(), outcome.result().getError()));
            }
        }
        if (failures.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new BatchResult<>(successes, failures, correlationId));
    }

    public Optional<String> getCorrelationId() {
        return Optional.ofNullable(correlationId);
    }

    @Override
    public String toString() {
        return "BatchOutcome[items=" + outcomes.size() + ", success=" + isSuccess() + "]";
    }
}
