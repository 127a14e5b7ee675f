package io.github.budgetcore.event_bus.handlers;

import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.IncomeSource;
import io.github.budgetcore.domain.YearMonth;
import io.github.budgetcore.event_bus.BaseEvent;
import io.github.budgetcore.event_bus.DomainEvents;
import io.github.budgetcore.event_bus.EventBus;
import io.github.budgetcore.event_bus.EventTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class NotificationHandlerTest {

    List<Notification> outbox;
    NotificationHandler handler;
    YearMonth march;

    @BeforeEach
    void setUp() throws Exception {
        outbox = new CopyOnWriteArrayList<>();
        handler = new NotificationHandler(outbox::add, "ops@example.org", 2);
        march = YearMonth.of(2024, 3);
    }

    @Test
    void expenseCreated_notifiesActingUserInApp() throws Exception {
        Expense lunch = new Expense(11, march, "food", "lunch", 1_250, Instant.now());
        try (EventBus bus = new EventBus()) {
            bus.subscribe("expense.*", handler);
            bus.publish(DomainEvents.expenseCreated(lunch, 7, "test"));
        }

        assertEquals(1, outbox.size());
        Notification n = outbox.get(0);
        assertEquals(Notification.Channel.IN_APP, n.channel);
        assertEquals(Notification.Priority.NORMAL, n.priority);
        assertEquals("user_7", n.recipient);
        assertEquals("Your expense 'lunch' for $12.50 has been added.", n.message);
        assertEquals(11L, n.data.get("expense_id"));
        assertTrue(n.id.startsWith("notif"));
    }

    @Test
    void budgetExceeded_isHighPriorityEmail() throws Exception {
        handler.handle(DomainEvents.budgetExceeded(march, 7, "food", 10_000, 12_500, "test"), CancellationToken.none());

        Notification n = outbox.get(0);
        assertEquals(Notification.Channel.EMAIL, n.channel);
        assertEquals(Notification.Priority.HIGH, n.priority);
        assertEquals(2_500L, n.data.get("exceeded_by_cents"));
        assertEquals(25.0, (Double) n.data.get("exceeded_percent"), 1e-9);
        assertTrue(n.message.contains("$25.00"), n.message);
    }

    @Test
    void systemHealth_onlyCriticalOrErrorReachesOperator() throws Exception {
        handler.handle(DomainEvents.systemHealth("ok", "all good", Map.of(), "test"), CancellationToken.none());
        assertTrue(outbox.isEmpty());

        handler.handle(DomainEvents.systemHealth("critical", "db down", Map.of("db", "down"), "test"),
                CancellationToken.none());

        Notification n = outbox.get(0);
        assertEquals("ops@example.org", n.recipient);
        assertEquals(Notification.Priority.URGENT, n.priority);
        assertEquals("db down", n.message);
    }

    @Test
    void loginAndUnknownTypes_sendNothing() throws Exception {
        handler.handle(DomainEvents.userLoggedIn(7, "alice", "test"), CancellationToken.none());
        handler.handle(DomainEvents.userLoggedOut(7, "alice", "test"), CancellationToken.none());
        handler.handle(new BaseEvent(EventTypes.VALIDATION_FAILED, "test", "bad"), CancellationToken.none());
        assertTrue(outbox.isEmpty());
        assertTrue(handler.sentNotifications().isEmpty());
    }

    @Test
    void wrongPayload_failsTheInvocation() {
        assertThrows(IllegalArgumentException.class, () ->
                handler.handle(new BaseEvent(EventTypes.EXPENSE_CREATED, "test", "not an expense"),
                        CancellationToken.none()));
    }

    @Test
    void keepsOnlyMostRecentSent() throws Exception {
        for (int i = 1; i <= 3; i++) {
            IncomeSource salary = new IncomeSource(i, 7, "salary" + i, march, 100_000, Instant.now(), Instant.now());
            handler.handle(DomainEvents.incomeSourceCreated(salary, "test"), CancellationToken.none());
        }

        List<Notification> sent = handler.sentNotifications();
        assertEquals(2, sent.size());
        assertEquals("salary2", sent.get(0).data.get("name"));
        assertEquals("salary3", sent.get(1).data.get("name"));
        assertEquals(3, outbox.size());
    }
}
