package io.github.budgetcore.event_bus.middleware;

import io.github.budgetcore.event_bus.EventHandler;
import io.github.budgetcore.event_bus.EventMiddleware;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Logs the start and outcome of every handler invocation together with how long it took. Failures are logged
 * and passed on unchanged.
 */
public final class LoggingMiddleware implements EventMiddleware {
    private final Logger logger;

    public LoggingMiddleware() {
        this(LoggerFactory.getLogger(LoggingMiddleware.class));
    }

    public LoggingMiddleware(@NotNull Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public @NotNull EventHandler apply(@NotNull EventHandler next) {
        return (event, token) -> {
            long start = System.nanoTime();
            logger.debug("Processing event {} ({})", event.getType(), event.getId());
            try {
                next.handle(event, token);
            } catch (Exception e) {
                logger.warn("Event {} ({}) failed after {} ms: {}", event.getType(), event.getId(),
                        elapsedMillis(start), e.toString());
                throw e;
            }
            logger.debug("Event {} ({}) processed in {} ms", event.getType(), event.getId(), elapsedMillis(start));
        };
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
