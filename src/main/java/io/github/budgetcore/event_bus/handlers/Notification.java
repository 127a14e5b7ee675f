package io.github.budgetcore.event_bus.handlers;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message for one recipient, derived from a domain event.
 */
public final class Notification {
    public enum Channel {
        EMAIL, SMS, PUSH, IN_APP, WEBHOOK
    }

    public enum Priority {
        LOW, NORMAL, HIGH, URGENT
    }

    public final String id;
    public final String eventId;
    public final Channel channel;
    public final Priority priority;
    public final String recipient;
    public final String subject;
    public final String message;
    public final Map<String, Object> data;
    public final Instant createdAt;

    Notification(String id, String eventId, Channel channel, Priority priority, String recipient, String subject,
                 String message, Map<String, Object> data, Instant createdAt) {
        this.id = id;
        this.eventId = eventId;
        this.channel = channel;
        this.priority = priority;
        this.recipient = recipient;
        this.subject = subject;
        this.message = message;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "Notification{id=" + id + ", channel=" + channel + ", priority=" + priority + ", recipient=" +
                recipient + ", subject='" + subject + "'}";
    }
}
