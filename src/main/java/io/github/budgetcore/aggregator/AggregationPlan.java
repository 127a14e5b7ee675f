package io.github.budgetcore.aggregator;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed, ordered set of named sub-fetches. Each field is owned by exactly one fetch.
 */
public final class AggregationPlan<K> {
    private final Map<String, SubFetch<K>> fetches;

    private AggregationPlan(Builder<K> b) {
        this.fetches = Collections.unmodifiableMap(new LinkedHashMap<>(b.fetches));
    }

    public static <K> Builder<K> builder() {
        return new Builder<>();
    }

    public @NotNull List<String> fields() {
        return new ArrayList<>(fetches.keySet());
    }

    public int size() {
        return fetches.size();
    }

    Map<String, SubFetch<K>> fetches() {
        return fetches;
    }

    public static final class Builder<K> {
        private final Map<String, SubFetch<K>> fetches = new LinkedHashMap<>();

        public Builder<K> field(String name, SubFetch<K> fetch) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(fetch, "fetch");
            if (fetches.containsKey(name)) {
                throw new IllegalArgumentException("field '" + name + "' is already owned by another fetch");
            }
            fetches.put(name, fetch);
            return this;
        }

        public AggregationPlan<K> build() {
            if (fetches.isEmpty()) throw new IllegalStateException("aggregation plan needs at least one field");
            return new AggregationPlan<>(this);
        }
    }
}
