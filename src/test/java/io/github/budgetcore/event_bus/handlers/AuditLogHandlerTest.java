package io.github.budgetcore.event_bus.handlers;

import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.event_bus.BaseEvent;
import io.github.budgetcore.event_bus.DomainEvents;
import io.github.budgetcore.event_bus.EventBus;
import io.github.budgetcore.event_bus.EventTypes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditLogHandlerTest {

    @Test
    void recordsEveryEvent_andKeepsOnlyRecentOnes() {
        AuditLogHandler audit = new AuditLogHandler(3);
        try (EventBus bus = new EventBus()) {
            bus.subscribe(EventTypes.ALL, audit);
            for (int i = 0; i < 5; i++) {
                bus.publish(DomainEvents.userLoggedIn(i, "user" + i, "test"));
            }
        }

        assertEquals(5, audit.recordedCount());
        List<AuditEntry> recent = audit.recentEntries();
        assertEquals(3, recent.size());
        assertEquals(2, recent.get(0).userId);
        assertEquals(4, recent.get(2).userId);
        assertEquals("user4", recent.get(2).summary);
        assertEquals(EventTypes.USER_LOGGED_IN, recent.get(2).eventType);
    }

    @Test
    void eventWithoutData_isSummarizedByType() throws Exception {
        AuditLogHandler audit = new AuditLogHandler();
        audit.handle(new BaseEvent(EventTypes.SYSTEM_HEALTH, "test", null), CancellationToken.none());
        AuditEntry e = audit.recentEntries().get(0);
        assertEquals(EventTypes.SYSTEM_HEALTH, e.summary);
        assertEquals(-1, e.userId);
    }

    @Test
    void capacityBelowOne_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AuditLogHandler(0));
    }
}
