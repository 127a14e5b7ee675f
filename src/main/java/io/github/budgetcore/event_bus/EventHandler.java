package io.github.budgetcore.event_bus;

import io.github.budgetcore.CancellationToken;

/**
 * Reacts to one delivered event. A thrown exception is recorded in the bus metrics and does not
 * stop delivery to other handlers.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(Event event, CancellationToken token) throws Exception;
}
