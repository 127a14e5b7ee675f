package io.github.budgetcore.event_bus;

/**
 * Counters for one event type.
 */
public final class EventTypeMetrics {
    public final String eventType;
    public final long published;
    public final long handlerInvocations;
    public final long handlerFailures;

    EventTypeMetrics(String eventType, long published, long handlerInvocations, long handlerFailures) {
        this.eventType = eventType;
        this.published = published;
        this.handlerInvocations = handlerInvocations;
        this.handlerFailures = handlerFailures;
    }

    @Override
    public String toString() {
        return "EventTypeMetrics{type=" + eventType + ", published=" + published + ", invocations=" +
                handlerInvocations + ", failures=" + handlerFailures + '}';
    }
}
