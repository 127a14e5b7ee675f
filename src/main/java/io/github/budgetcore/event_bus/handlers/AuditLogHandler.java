package io.github.budgetcore.event_bus.handlers;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.event_bus.DomainEvents;
import io.github.budgetcore.event_bus.Event;
import io.github.budgetcore.event_bus.EventHandler;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes every event it receives to the {@code audit} logger and keeps the most recent entries in memory.
 * Usually subscribed under {@code "*"}.
 */
@ThreadSafe
public final class AuditLogHandler implements EventHandler {
    private final static Logger audit = LoggerFactory.getLogger("audit");

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    @GuardedBy("this")
    private final ArrayDeque<AuditEntry> recent;
    @GuardedBy("this")
    private long recorded = 0;

    public AuditLogHandler() {
        this(DEFAULT_CAPACITY);
    }

    public AuditLogHandler(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.recent = new ArrayDeque<>(Math.min(capacity, 64));
    }

    @Override
    public void handle(Event event, CancellationToken token) {
        AuditEntry entry = new AuditEntry(event.getId(), event.getType(), event.getSource(),
                DomainEvents.userIdOf(event), event.getTimestamp(), Instant.now(), summarize(event));
        audit.info("event={} type={} source={} user={} summary=\"{}\"",
                entry.eventId, entry.eventType, entry.source, entry.userId, entry.summary);
        synchronized (this) {
            recent.addLast(entry);
            while (recent.size() > capacity) recent.pollFirst();
            recorded++;
        }
    }

    /**
     * Newest last.
     */
    public synchronized @NotNull List<AuditEntry> recentEntries() {
        return new ArrayList<>(recent);
    }

    public synchronized long recordedCount() {
        return recorded;
    }

    private static String summarize(Event event) {
        Object data = event.getData();
        if (data == null) return event.getType();
        String s = data.toString();
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
