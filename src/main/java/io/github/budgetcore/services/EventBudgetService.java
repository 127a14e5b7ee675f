package io.github.budgetcore.services;

import io.github.budgetcore.aggregator.MonthlyDataAggregator;
import io.github.budgetcore.aggregator.MonthlyDataResult;
import io.github.budgetcore.base_exceptions.AggregationTimedOutException;
import io.github.budgetcore.base_exceptions.RepositoryException;
import io.github.budgetcore.base_exceptions.ValidationException;
import io.github.budgetcore.domain.BudgetRepository;
import io.github.budgetcore.domain.BudgetSource;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.IncomeSource;
import io.github.budgetcore.domain.MonthlyData;
import io.github.budgetcore.domain.YearMonth;
import io.github.budgetcore.event_bus.DomainEvents;
import io.github.budgetcore.event_bus.Event;
import io.github.budgetcore.event_bus.EventBusInterface;
import io.github.budgetcore.event_bus.EventMetrics;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Budget mutations that announce themselves on the event bus. The repository write happens first;
 * the event is published afterwards, asynchronously.
 */
public final class EventBudgetService {
    private final static Logger logger = LoggerFactory.getLogger(EventBudgetService.class);

    static final String SOURCE = "event_service";

    private final BudgetRepository repository;
    private final EventBusInterface bus;
    private final MonthlyDataAggregator aggregator;

    public EventBudgetService(@NotNull BudgetRepository repository, @NotNull EventBusInterface bus,
                              @NotNull MonthlyDataAggregator aggregator) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    }

    public @NotNull Expense addExpense(@NotNull Expense draft, long userId) throws RepositoryException {
        Expense saved = repository.addExpense(draft);
        Event event = DomainEvents.expenseCreated(saved, userId, SOURCE);
        publish(event);
        logger.info("Expense {} added for user {}, event {}", saved.getId(), userId, event.getId());
        checkBudgetExceeded(saved, userId);
        return saved;
    }

    public @NotNull Expense updateExpense(@NotNull Expense expense, long userId) throws RepositoryException {
        Expense previous = findExpense(expense.getId(), expense.getPeriod());
        Expense saved = repository.updateExpense(expense);
        publish(DomainEvents.expenseUpdated(saved, previous, userId, SOURCE));
        checkBudgetExceeded(saved, userId);
        return saved;
    }

    public void deleteExpense(long expenseId, @NotNull YearMonth period, long userId) throws RepositoryException {
        Expense existing = findExpense(expenseId, period);
        repository.deleteExpense(expenseId);
        publish(DomainEvents.expenseDeleted(existing, userId, SOURCE));
    }

    public @NotNull IncomeSource createIncomeSource(long userId, @NotNull String name, @NotNull YearMonth period,
                                                    long amountCents) throws RepositoryException {
        IncomeSource created = repository.createIncomeSource(userId, name, period, amountCents);
        publish(DomainEvents.incomeSourceCreated(created, SOURCE));
        return created;
    }

    public @NotNull IncomeSource updateIncomeSource(@NotNull IncomeSource previous, @NotNull String name,
                                                    long amountCents) throws RepositoryException {
        IncomeSource updated = repository.updateIncomeSource(previous.getId(), name, amountCents);
        publish(DomainEvents.incomeSourceUpdated(updated, previous, SOURCE));
        return updated;
    }

    public @NotNull BudgetSource createBudgetSource(long userId, @NotNull String name, @NotNull YearMonth period,
                                                    long amountCents) throws RepositoryException {
        BudgetSource created = repository.createBudgetSource(userId, name, period, amountCents);
        publish(DomainEvents.budgetSourceCreated(created, SOURCE));
        return created;
    }

    public @NotNull BudgetSource updateBudgetSource(@NotNull BudgetSource previous, @NotNull String name,
                                                    long amountCents) throws RepositoryException {
        BudgetSource updated = repository.updateBudgetSource(previous.getId(), name, amountCents);
        publish(DomainEvents.budgetSourceUpdated(updated, previous, SOURCE));
        return updated;
    }

    /**
     * Reads the month through the concurrent aggregator and announces the fresh view.
     *
     * @throws RepositoryException if any of the three reads failed
     */
    public @NotNull MonthlyData getMonthlyData(long userId, @NotNull YearMonth period)
            throws RepositoryException, ValidationException, AggregationTimedOutException, InterruptedException {
        MonthlyDataResult result = aggregator.fetch(userId, period.getYear(), period.getMonth());
        if (result.isDegraded()) {
            Throwable first = result.errors.get(0);
            throw new RepositoryException("monthly data for " + period + " incomplete (" + result.errors.size() +
                    " failed reads)", first);
        }
        MonthlyData data = result.toMonthlyData();
        publish(DomainEvents.monthlyDataUpdated(data, userId, SOURCE));
        return data;
    }

    public void publishSystemHealth(@NotNull String status, @NotNull String message, @NotNull Map<String, Object> metrics) {
        publish(DomainEvents.systemHealth(status, message, metrics, SOURCE));
    }

    public @NotNull EventMetrics getEventMetrics() {
        return bus.getMetrics();
    }

    /**
     * Compares the category's spending with the budget source of the same name. Never throws: a failed
     * check is logged and skipped.
     */
    private void checkBudgetExceeded(Expense expense, long userId) {
        String category = expense.getCategory();
        if (category.isEmpty()) return;
        try {
            long budget = 0;
            for (BudgetSource b : repository.listBudgetSources(userId, expense.getPeriod())) {
                if (b.getName().equalsIgnoreCase(category)) {
                    budget = b.getAmountCents();
                    break;
                }
            }
            if (budget == 0) return;
            long spent = 0;
            for (Expense e : repository.listExpenses(expense.getPeriod())) {
                if (e.getCategory().equalsIgnoreCase(category)) spent += e.getAmountCents();
            }
            if (spent > budget) {
                Event event = DomainEvents.budgetExceeded(expense.getPeriod(), userId, category, budget, spent, SOURCE);
                publish(event);
                logger.warn("Budget '{}' exceeded for {}: spent {} of {} cents, event {}", category,
                        expense.getPeriod(), spent, budget, event.getId());
            }
        } catch (RepositoryException e) {
            logger.error("Budget check for expense {} failed", expense.getId(), e);
        }
    }

    private Expense findExpense(long expenseId, YearMonth period) throws RepositoryException {
        List<Expense> expenses = repository.listExpenses(period);
        for (Expense e : expenses) {
            if (e.getId() == expenseId) return e;
        }
        throw new RepositoryException("expense " + expenseId + " not found in " + period);
    }

    private void publish(Event event) {
        try {
            bus.publishAsync(event);
        } catch (IllegalStateException e) {
            logger.warn("Event {} not published: {}", event, e.getMessage());
        }
    }
}
