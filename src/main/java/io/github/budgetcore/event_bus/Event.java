package io.github.budgetcore.event_bus;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable notification of something that happened. One event may be delivered to many handlers.
 */
public interface Event {
    @NotNull String getId();

    /**
     * Dot-namespaced type tag, e.g. {@code expense.created}.
     */
    @NotNull String getType();

    @Nullable Object getData();

    @NotNull Instant getTimestamp();

    /**
     * Which component emitted the event.
     */
    @NotNull String getSource();

    @NotNull String getVersion();

    @NotNull Map<String, Object> getMetadata();
}
