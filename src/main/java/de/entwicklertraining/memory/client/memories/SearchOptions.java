package de.entwicklertraining.memory.client.memories;

import de.entwicklertraining.memory.client.RequestOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optional parameters of a streamed search.
 * <p>
 * Example usage:
 * <pre>
 * SearchOptions options = SearchOptions.builder()
 *     .limit(20)
 *     .minRelevanceScore(0.5)
 *     .filter("tag", "work")
 *     .filter("tag", "urgent")
 *     .build();
 * </pre>
 */
public final class SearchOptions {

    private static final SearchOptions NONE = builder().build();

    private final Integer limit;
    private final Integer offset;
    private final Double minRelevanceScore;
    private final Integer maxAgeHours;
    private final Map<String, List<String>> filters;

    private SearchOptions(Builder builder) {
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.minRelevanceScore = builder.minRelevanceScore;
        this.maxAgeHours = builder.maxAgeHours;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        builder.filters.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.filters = Collections.unmodifiableMap(copy);
    }

    public static SearchOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, List<String>> getFilters() {
        return filters;
    }

    /**
     * Adds these options as query parameters. Each filter value becomes its own parameter.
     *
     * @param query the request options to extend
     * @return the same builder
     */
    RequestOptions.Builder applyTo(RequestOptions.Builder query) {
        query.queryParam("limit", limit)
                .queryParam("offset", offset)
                .queryParam("minRelevanceScore", minRelevanceScore)
                .queryParam("maxAgeHours", maxAgeHours);
        filters.forEach(query::queryParams);
        return query;
    }

    /**
     * Builder for {@link SearchOptions}.
     */
    public static final class Builder {
        private Integer limit;
        private Integer offset;
        private Double minRelevanceScore;
        private Integer maxAgeHours;
        private final Map<String, List<String>> filters = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder limit(int limit) {
            if (limit < 1) {
                throw new IllegalArgumentException("Limit must be positive");
            }
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("Offset cannot be negative");
            }
            this.offset = offset;
            return this;
        }

        public Builder minRelevanceScore(double minRelevanceScore) {
            if (!(minRelevanceScore >= 0.0 && minRelevanceScore <= 1.0)) {
                throw new IllegalArgumentException("Relevance score must be between 0.0 and 1.0");
            }
            this.minRelevanceScore = minRelevanceScore;
            return this;
        }

        public Builder maxAgeHours(int maxAgeHours) {
            if (maxAgeHours < 1) {
                throw new IllegalArgumentException("Max age must be positive");
            }
            this.maxAgeHours = maxAgeHours;
            return this;
        }

        /**
         * Adds a filter value. Calling this again with the same name adds another value.
         *
         * @param name the filter name
         * @param value the value
         * @return this builder
         */
        public Builder filter(String name, String value) {
            if (name == null || name.isEmpty() || value == null) {
                throw new IllegalArgumentException("Filter name and value are required");
            }
            filters.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public SearchOptions build() {
            return new SearchOptions(this);
        }
    }
}
