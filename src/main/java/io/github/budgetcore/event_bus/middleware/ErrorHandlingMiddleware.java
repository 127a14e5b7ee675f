package io.github.budgetcore.event_bus.middleware;

import io.github.budgetcore.event_bus.Event;
import io.github.budgetcore.event_bus.EventHandler;
import io.github.budgetcore.event_bus.EventMiddleware;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Reports handler failures, errors included, to one central {@link EventErrorListener} and then rethrows them,
 * so the bus still records the invocation as failed.
 */
public final class ErrorHandlingMiddleware implements EventMiddleware {
    private final static Logger logger = LoggerFactory.getLogger(ErrorHandlingMiddleware.class);

    private final EventErrorListener listener;

    public ErrorHandlingMiddleware(@NotNull EventErrorListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public @NotNull EventHandler apply(@NotNull EventHandler next) {
        return (event, token) -> {
            try {
                next.handle(event, token);
            } catch (Exception e) {
                report(event, e);
                throw e;
            } catch (Error e) {
                report(event, e);
                throw e;
            }
        };
    }

    private void report(Event event, Throwable error) {
        try {
            listener.onError(event, error);
        } catch (Throwable t) {
            logger.warn("Error listener failed on {}: {}", event, t.toString());
        }
    }
}
