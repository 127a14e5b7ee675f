package io.github.budgetcore.event_bus.middleware;

import io.github.budgetcore.event_bus.Event;

/**
 * Told about every handler failure seen by {@link ErrorHandlingMiddleware}.
 */
@FunctionalInterface
public interface EventErrorListener {
    void onError(Event event, Throwable error);
}
