package io.github.budgetcore.event_bus;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only snapshot of event bus counters.
 */
public final class EventMetrics {
    public final long totalPublished;
    public final long totalHandlerInvocations;
    public final long totalHandlerFailures;
    public final int activeSubscriptions;
    public final @Nullable Instant lastEventTime;
    public final Map<String, EventTypeMetrics> byType;
    public final Map<String, HandlerLatency> bySubscription;

    EventMetrics(long totalPublished, long totalHandlerInvocations, long totalHandlerFailures, int activeSubscriptions,
                 @Nullable Instant lastEventTime, Map<String, EventTypeMetrics> byType,
                 Map<String, HandlerLatency> bySubscription) {
        this.totalPublished = totalPublished;
        this.totalHandlerInvocations = totalHandlerInvocations;
        this.totalHandlerFailures = totalHandlerFailures;
        this.activeSubscriptions = activeSubscriptions;
        this.lastEventTime = lastEventTime;
        this.byType = Collections.unmodifiableMap(new LinkedHashMap<>(byType));
        this.bySubscription = Collections.unmodifiableMap(new LinkedHashMap<>(bySubscription));
    }

    /**
     * Counters of {@code eventType}, all zero if it was never published.
     */
    public EventTypeMetrics forType(String eventType) {
        EventTypeMetrics m = byType.get(eventType);
        return m != null ? m : new EventTypeMetrics(eventType, 0, 0, 0);
    }

    @Override
    public String toString() {
        return "EventMetrics{published=" + totalPublished + ", invocations=" + totalHandlerInvocations +
                ", failures=" + totalHandlerFailures + ", subscriptions=" + activeSubscriptions + '}';
    }
}
