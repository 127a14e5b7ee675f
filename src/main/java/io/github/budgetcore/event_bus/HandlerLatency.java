package io.github.budgetcore.event_bus;

import java.time.Duration;

/**
 * Time spent in the handler of one subscription.
 */
public final class HandlerLatency {
    public final String subscriptionId;
    public final long invocations;
    public final Duration total;
    public final Duration average;

    HandlerLatency(String subscriptionId, long invocations, Duration total) {
        this.subscriptionId = subscriptionId;
        this.invocations = invocations;
        this.total = total;
        this.average = invocations == 0 ? Duration.ZERO : total.dividedBy(invocations);
    }

    @Override
    public String toString() {
        return "HandlerLatency{subscription=" + subscriptionId + ", invocations=" + invocations + ", average=" + average + '}';
    }
}
