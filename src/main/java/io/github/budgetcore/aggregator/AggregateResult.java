package io.github.budgetcore.aggregator;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joined outcome of an aggregation. Failed fields have no value and contribute one entry to {@link #errors()}.
 */
public final class AggregateResult {
    private final Map<String, Object> values;
    private final Map<String, Throwable> failures;

    AggregateResult(Map<String, Object> values, Map<String, Throwable> failures) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean has(@NotNull String field) {
        return values.containsKey(field);
    }

    /**
     * @return the field value, or {@code null} if the field failed or never finished
     * @throws ClassCastException if the value is not a {@code type}
     */
    public <T> @Nullable T get(@NotNull String field, @NotNull Class<T> type) {
        return type.cast(values.get(field));
    }

    public @NotNull Map<String, Object> values() {
        return values;
    }

    public @NotNull List<Throwable> errors() {
        return new ArrayList<>(failures.values());
    }

    public @NotNull Map<String, Throwable> errorsByField() {
        return failures;
    }

    /**
     * True when at least one sub-fetch failed.
     */
    public boolean isDegraded() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "AggregateResult{fields=" + values.keySet() + ", failed=" + failures.keySet() + '}';
    }
}
