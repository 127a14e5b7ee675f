package io.github.budgetcore.services;

import io.github.budgetcore.aggregator.MonthlyDataAggregator;
import io.github.budgetcore.base_exceptions.RepositoryException;
import io.github.budgetcore.domain.BudgetSource;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.InMemoryBudgetRepository;
import io.github.budgetcore.domain.IncomeSource;
import io.github.budgetcore.domain.MonthlyData;
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

import static org.junit.jupiter.api.Assertions.*;

class EventBudgetServiceTest {

    InMemoryBudgetRepository repo;
    EventBus bus;
    MonthlyDataAggregator aggregator;
    EventBudgetService service;
    RecordingHandler recorder;
    YearMonth march;

    @BeforeEach
    void setUp() throws Exception {
        repo = new InMemoryBudgetRepository();
        bus = new EventBus();
        aggregator = new MonthlyDataAggregator(repo);
        service = new EventBudgetService(repo, bus, aggregator);
        recorder = new RecordingHandler();
        bus.subscribe(EventTypes.ALL, recorder);
        march = YearMonth.of(2024, 3);
    }

    @AfterEach
    void tearDown() {
        aggregator.close();
        bus.close();
    }

    @Test
    void addExpense_savesThenPublishesCreated() throws Exception {
        Expense saved = service.addExpense(Expense.draft(march, "food", "lunch", 1_500), 7);

        assertTrue(saved.getId() > 0);
        List<Event> created = recorder.awaitType(EventTypes.EXPENSE_CREATED, 1, 2_000);
        assertEquals(1, created.size());
        assertSame(saved, created.get(0).getData());
        assertEquals(7, DomainEvents.userIdOf(created.get(0)));
        assertEquals(EventBudgetService.SOURCE, created.get(0).getSource());
    }

    @Test
    void spendingOverMatchingBudget_publishesBudgetExceeded() throws Exception {
        service.createBudgetSource(7, "Food", march, 5_000);
        service.addExpense(Expense.draft(march, "food", "groceries", 3_000), 7);
        assertTrue(recorder.awaitType(EventTypes.EXPENSE_CREATED, 1, 2_000).size() >= 1);
        assertTrue(recorder.ofType(EventTypes.BUDGET_EXCEEDED).isEmpty());

        service.addExpense(Expense.draft(march, "food", "restaurant", 3_000), 7);

        List<Event> exceeded = recorder.awaitType(EventTypes.BUDGET_EXCEEDED, 1, 2_000);
        assertEquals(1, exceeded.size());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) exceeded.get(0).getData();
        assertEquals(5_000L, data.get("budget_cents"));
        assertEquals(6_000L, data.get("spent_cents"));
        assertEquals(1_000L, data.get("exceeded_by_cents"));
    }

    @Test
    void updateExpense_carriesPreviousVersion() throws Exception {
        Expense saved = service.addExpense(Expense.draft(march, "food", "lunch", 1_500), 7);
        Expense changed = new Expense(saved.getId(), march, "food", "lunch", 2_500, saved.getCreatedAt());

        service.updateExpense(changed, 7);

        List<Event> updated = recorder.awaitType(EventTypes.EXPENSE_UPDATED, 1, 2_000);
        assertEquals(1, updated.size());
        Expense previous = (Expense) updated.get(0).getMetadata().get(DomainEvents.PREVIOUS);
        assertEquals(1_500, previous.getAmountCents());
        assertEquals(2_500, ((Expense) updated.get(0).getData()).getAmountCents());
    }

    @Test
    void deleteExpense_publishesDeleted_andUnknownIdFailsWithoutEvent() throws Exception {
        Expense saved = service.addExpense(Expense.draft(march, "", "coffee", 300), 7);

        service.deleteExpense(saved.getId(), march, 7);
        assertEquals(1, recorder.awaitType(EventTypes.EXPENSE_DELETED, 1, 2_000).size());

        assertThrows(RepositoryException.class, () -> service.deleteExpense(999, march, 7));
        Thread.sleep(100);
        assertEquals(1, recorder.ofType(EventTypes.EXPENSE_DELETED).size());
    }

    @Test
    void repositoryFailure_propagates_andPublishesNothing() throws Exception {
        repo.failOn("addExpense", "database down");

        assertThrows(RepositoryException.class,
                () -> service.addExpense(Expense.draft(march, "food", "lunch", 100), 7));
        Thread.sleep(100);
        assertTrue(recorder.events.isEmpty());
    }

    @Test
    void incomeAndBudgetSourceChanges_areAnnounced() throws Exception {
        IncomeSource salary = service.createIncomeSource(7, "salary", march, 300_000);
        service.updateIncomeSource(salary, "salary", 320_000);
        BudgetSource rent = service.createBudgetSource(7, "rent", march, 100_000);
        service.updateBudgetSource(rent, "rent", 110_000);

        assertEquals(1, recorder.awaitType(EventTypes.INCOME_SOURCE_CREATED, 1, 2_000).size());
        assertEquals(1, recorder.awaitType(EventTypes.INCOME_SOURCE_UPDATED, 1, 2_000).size());
        assertEquals(1, recorder.awaitType(EventTypes.BUDGET_SOURCE_CREATED, 1, 2_000).size());
        List<Event> budgetUpdated = recorder.awaitType(EventTypes.BUDGET_SOURCE_UPDATED, 1, 2_000);
        assertEquals(1, budgetUpdated.size());
        assertSame(rent, budgetUpdated.get(0).getMetadata().get(DomainEvents.PREVIOUS));
    }

    @Test
    void getMonthlyData_aggregates_andAnnouncesView() throws Exception {
        repo.createIncomeSource(7, "salary", march, 300_000);
        repo.addExpense(Expense.draft(march, "food", "groceries", 40_000));

        MonthlyData data = service.getMonthlyData(7, march);

        assertEquals(260_000, data.remainingCents);
        List<Event> updated = recorder.awaitType(EventTypes.MONTHLY_DATA_UPDATED, 1, 2_000);
        assertEquals(1, updated.size());
        assertSame(data, updated.get(0).getData());
    }

    @Test
    void getMonthlyData_failsWhenAnyReadFails() {
        repo.failOn(InMemoryBudgetRepository.LIST_INCOME, "income table locked");

        RepositoryException e = assertThrows(RepositoryException.class, () -> service.getMonthlyData(7, march));
        assertEquals("income table locked", e.getCause().getMessage());
    }

    @Test
    void publishSystemHealth_andMetrics() throws Exception {
        service.publishSystemHealth("ok", "all good", Map.of("uptime_s", 12));

        assertEquals(1, recorder.awaitType(EventTypes.SYSTEM_HEALTH, 1, 2_000).size());
        assertEquals(1, service.getEventMetrics().forType(EventTypes.SYSTEM_HEALTH).published);
    }

    @Test
    void closedBus_doesNotBreakMutations() throws Exception {
        bus.close();
        Expense saved = service.addExpense(Expense.draft(march, "food", "lunch", 1_500), 7);
        assertTrue(saved.getId() > 0);
    }
}
