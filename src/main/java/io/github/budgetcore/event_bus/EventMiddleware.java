package io.github.budgetcore.event_bus;

import org.jetbrains.annotations.NotNull;

/**
 * Decorates the handler of every subscription at delivery time. The returned handler decides whether, and how,
 * {@code next} is invoked.
 */
@FunctionalInterface
public interface EventMiddleware {
    @NotNull EventHandler apply(@NotNull EventHandler next);
}
