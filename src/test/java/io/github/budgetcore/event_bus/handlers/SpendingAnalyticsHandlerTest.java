package io.github.budgetcore.event_bus.handlers;

import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.YearMonth;
import io.github.budgetcore.event_bus.DomainEvents;
import io.github.budgetcore.event_bus.Event;
import io.github.budgetcore.event_bus.EventBus;
import io.github.budgetcore.event_bus.EventTypes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SpendingAnalyticsHandlerTest {

    EventBus bus;
    SpendingAnalyticsHandler analytics;
    List<Event> exceeded;
    YearMonth march;

    @BeforeEach
    void setUp() throws Exception {
        bus = new EventBus();
        analytics = new SpendingAnalyticsHandler(bus).setLimit("Food", 10_000);
        exceeded = new CopyOnWriteArrayList<>();
        bus.subscribe("expense.*", analytics);
        bus.subscribe(EventTypes.BUDGET_EXCEEDED, (e, t) -> exceeded.add(e));
        march = YearMonth.of(2024, 3);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private Expense expense(long id, String category, long cents) {
        return new Expense(id, march, category, "x", cents, Instant.now());
    }

    @Test
    void crossingTheLimit_publishesBudgetExceededOnce() {
        bus.publish(DomainEvents.expenseCreated(expense(1, "food", 6_000), 7, "test"));
        assertTrue(exceeded.isEmpty());

        bus.publish(DomainEvents.expenseCreated(expense(2, "FOOD ", 5_000), 7, "test"));
        bus.publish(DomainEvents.expenseCreated(expense(3, "food", 1_000), 7, "test"));

        assertEquals(1, exceeded.size());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) exceeded.get(0).getData();
        assertEquals("food", data.get("category"));
        assertEquals(10_000L, data.get("budget_cents"));
        assertEquals(11_000L, data.get("spent_cents"));
        assertEquals(1_000L, data.get("exceeded_by_cents"));
        assertEquals(7, DomainEvents.userIdOf(exceeded.get(0)));
        assertEquals(12_000, analytics.totalCents(7, march, "food"));
    }

    @Test
    void deleteAndUpdate_adjustTotals() {
        Expense a = expense(1, "food", 4_000);
        bus.publish(DomainEvents.expenseCreated(a, 7, "test"));
        bus.publish(DomainEvents.expenseCreated(expense(2, "", 500), 7, "test"));

        Expense bigger = expense(1, "food", 9_000);
        bus.publish(DomainEvents.expenseUpdated(bigger, a, 7, "test"));
        assertEquals(9_000, analytics.totalCents(7, march, "food"));

        bus.publish(DomainEvents.expenseDeleted(bigger, 7, "test"));
        assertEquals(0, analytics.totalCents(7, march, "food"));

        Map<String, Long> totals = analytics.categoryTotals(7, march);
        assertEquals(500L, totals.get(SpendingAnalyticsHandler.UNCATEGORIZED));
        assertTrue(exceeded.isEmpty());
    }

    @Test
    void totalsAreKeptPerUser() {
        bus.publish(DomainEvents.expenseCreated(expense(1, "food", 8_000), 7, "test"));
        bus.publish(DomainEvents.expenseCreated(expense(2, "food", 8_000), 8, "test"));

        assertEquals(8_000, analytics.totalCents(7, march, "food"));
        assertEquals(8_000, analytics.totalCents(8, march, "food"));
        assertTrue(exceeded.isEmpty());
    }

    @Test
    void negativeLimit_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> analytics.setLimit("rent", -1));
    }
}
