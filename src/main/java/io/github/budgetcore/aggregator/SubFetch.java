package io.github.budgetcore.aggregator;

import io.github.budgetcore.CancellationToken;

/**
 * One independent read of an aggregation. Implementations should give up once {@code token} is done.
 *
 * @param <K> aggregation key, e.g. a user and month
 */
@FunctionalInterface
public interface SubFetch<K> {
    Object fetch(K key, CancellationToken token) throws Exception;
}
