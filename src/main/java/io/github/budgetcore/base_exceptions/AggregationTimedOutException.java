package io.github.budgetcore.base_exceptions;

import io.github.budgetcore.aggregator.AggregateResult;

/**
 * The aggregation deadline passed before every sub-fetch finished. The slots that did finish are kept
 * on {@link #getPartial()} for diagnostics; the call as a whole failed.
 */
public class AggregationTimedOutException extends OperationTimedOutException {
    private final transient AggregateResult partial;

    public AggregationTimedOutException(String message, AggregateResult partial) {
        super(message);
        this.partial = partial;
    }

    public AggregateResult getPartial() {
        return partial;
    }
}
