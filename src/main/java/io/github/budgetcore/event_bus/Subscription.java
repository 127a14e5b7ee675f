package io.github.budgetcore.event_bus;

import io.github.budgetcore.UuidProvider;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;

/**
 * Handle returned by {@link EventBusInterface#subscribe}.
 * <p>
 * Pattern forms: an exact type, {@code "*"} for everything, or a prefix ending in {@code '*'}
 * such as {@code "expense.*"}.
 */
public final class Subscription {
    private final String id;
    private final String pattern;
    private final EventHandler handler;
    private final Instant created;

    Subscription(String pattern, EventHandler handler) {
        this.id = UuidProvider.generatePrefixedId("sub");
        this.pattern = pattern;
        this.handler = handler;
        this.created = Instant.now();
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull String getPattern() {
        return pattern;
    }

    public @NotNull EventHandler getHandler() {
        return handler;
    }

    public @NotNull Instant getCreated() {
        return created;
    }

    public boolean matches(@NotNull String eventType) {
        return matches(pattern, eventType);
    }

    static boolean matches(String pattern, String eventType) {
        if (pattern.equals(eventType) || pattern.equals(EventTypes.ALL)) return true;
        if (pattern.length() > 1 && pattern.endsWith("*")) {
            return eventType.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return false;
    }

    @Override
    public String toString() {
        return "Subscription{id=" + id + ", pattern=" + pattern + '}';
    }
}
