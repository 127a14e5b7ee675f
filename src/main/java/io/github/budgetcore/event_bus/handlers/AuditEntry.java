package io.github.budgetcore.event_bus.handlers;

import java.time.Instant;

/**
 * One line of the audit trail.
 */
public final class AuditEntry {
    public final String eventId;
    public final String eventType;
    public final String source;
    public final long userId;
    public final Instant occurredAt;
    public final Instant recordedAt;
    public final String summary;

    AuditEntry(String eventId, String eventType, String source, long userId, Instant occurredAt, Instant recordedAt,
               String summary) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.source = source;
        this.userId = userId;
        this.occurredAt = occurredAt;
        this.recordedAt = recordedAt;
        this.summary = summary;
    }

    @Override
    public String toString() {
        return "AuditEntry{event=" + eventId + ", type=" + eventType + ", source=" + source + ", user=" + userId +
                ", summary='" + summary + "'}";
    }
}
