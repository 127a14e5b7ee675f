package io.github.budgetcore.services;

import io.github.budgetcore.base_exceptions.RepositoryException;
import io.github.budgetcore.base_exceptions.ValidationException;
import io.github.budgetcore.domain.BudgetRepository;
import io.github.budgetcore.domain.BudgetSource;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.IncomeSource;
import io.github.budgetcore.domain.MonthlyData;
import io.github.budgetcore.domain.Summary;
import io.github.budgetcore.domain.YearMonth;
import io.github.budgetcore.event_bus.BaseEvent;
import io.github.budgetcore.event_bus.DomainEvents;
import io.github.budgetcore.event_bus.Event;
import io.github.budgetcore.event_bus.EventBusInterface;
import io.github.budgetcore.event_bus.EventTypes;
import io.github.budgetcore.reactive.BehaviorSubject;
import io.github.budgetcore.reactive.Observable;
import io.github.budgetcore.reactive.Observer;
import io.github.budgetcore.reactive.Operators;
import io.github.budgetcore.reactive.Subject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mirrors every successful mutation into live {@link BehaviorSubject}s so subscribers see the current lists
 * without querying storage again.
 * <ul>
 *   <li>Expense events are debounced (100 ms by default) before they reach the event bus.</li>
 *   <li>Invalid input is rejected with {@link ValidationException} and announced as a {@code validation.failed} event.</li>
 *   <li>A monitoring pipeline combines the sizes of the three lists.</li>
 * </ul>
 */
public final class ReactiveBudgetService implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(ReactiveBudgetService.class);

    static final String SOURCE = "reactive_service";
    public static final Duration DEFAULT_EXPENSE_DEBOUNCE = Duration.ofMillis(100);

    private final BudgetRepository repository;
    private final EventBusInterface bus;

    private final BehaviorSubject<List<Expense>> expenses = new BehaviorSubject<>();
    private final BehaviorSubject<List<IncomeSource>> incomeSources = new BehaviorSubject<>();
    private final BehaviorSubject<List<BudgetSource>> budgetSources = new BehaviorSubject<>();
    private final BehaviorSubject<MonthlyData> monthlyData = new BehaviorSubject<>();

    private final Subject<Event> expenseEvents = new Subject<>();
    private final Subject<Event> validationEvents = new Subject<>();
    private final Observable<Event> debouncedExpenseEvents;
    private final Observable<RecordCounts> recordCounts;
    private final AtomicReference<RecordCounts> lastCounts = new AtomicReference<>();

    public ReactiveBudgetService(@NotNull BudgetRepository repository, @NotNull EventBusInterface bus) {
        this(repository, bus, DEFAULT_EXPENSE_DEBOUNCE);
    }

    public ReactiveBudgetService(@NotNull BudgetRepository repository, @NotNull EventBusInterface bus,
                                 @NotNull Duration expenseDebounce) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.bus = Objects.requireNonNull(bus, "bus");

        this.debouncedExpenseEvents = Operators.debounce(expenseEvents, expenseDebounce);
        debouncedExpenseEvents.subscribe("publish-to-bus", this::forwardToBus);
        validationEvents.subscribe("publish-to-bus", this::forwardToBus);

        Observable<Integer> expenseCount = Operators.map(expenses, List::size);
        Observable<Integer> incomeCount = Operators.map(incomeSources, List::size);
        Observable<Integer> budgetCount = Operators.map(budgetSources, List::size);
        Observable<int[]> expenseAndIncome = Operators.combineLatest(expenseCount, incomeCount,
                (e, i) -> new int[]{e, i});
        this.recordCounts = Operators.combineLatest(expenseAndIncome, budgetCount,
                (ei, b) -> new RecordCounts(ei[0], ei[1], b));
        recordCounts.subscribe("monitoring", counts -> {
            lastCounts.set(counts);
            logger.debug("Live record counts: {}", counts);
        });

        // seed after wiring, values replayed while attaching would not reach the monitoring pipeline
        expenses.next(Collections.emptyList());
        incomeSources.next(Collections.emptyList());
        budgetSources.next(Collections.emptyList());
    }

    // ======== Mutations ========

    public @NotNull Expense addExpense(@NotNull Expense draft, long userId) throws ValidationException, RepositoryException {
        validateExpense(draft);
        Expense saved = repository.addExpense(draft);
        expenses.next(repository.listExpenses(saved.getPeriod()));
        expenseEvents.next(DomainEvents.expenseCreated(saved, userId, SOURCE));
        return saved;
    }

    public void deleteExpense(long expenseId, @NotNull YearMonth period, long userId) throws RepositoryException {
        Expense existing = null;
        for (Expense e : repository.listExpenses(period)) {
            if (e.getId() == expenseId) {
                existing = e;
                break;
            }
        }
        if (existing == null) throw new RepositoryException("expense " + expenseId + " not found in " + period);
        repository.deleteExpense(expenseId);
        expenses.next(repository.listExpenses(period));
        expenseEvents.next(DomainEvents.expenseDeleted(existing, userId, SOURCE));
    }

    public @NotNull IncomeSource addIncomeSource(long userId, @NotNull String name, @NotNull YearMonth period,
                                                 long amountCents) throws ValidationException, RepositoryException {
        if (name.isBlank()) throw rejected("income_source", "income source name is required");
        if (amountCents <= 0) throw rejected("income_source", "income amount must be positive");
        IncomeSource created = repository.createIncomeSource(userId, name, period, amountCents);
        incomeSources.next(repository.listIncomeSources(userId, period));
        forwardToBus(DomainEvents.incomeSourceCreated(created, SOURCE));
        return created;
    }

    public @NotNull BudgetSource addBudgetSource(long userId, @NotNull String name, @NotNull YearMonth period,
                                                 long amountCents) throws ValidationException, RepositoryException {
        if (name.isBlank()) throw rejected("budget_source", "budget source name is required");
        if (amountCents < 0) throw rejected("budget_source", "budget amount cannot be negative");
        BudgetSource created = repository.createBudgetSource(userId, name, period, amountCents);
        budgetSources.next(repository.listBudgetSources(userId, period));
        forwardToBus(DomainEvents.budgetSourceCreated(created, SOURCE));
        return created;
    }

    /**
     * Reloads one month into all four live streams.
     */
    public @NotNull MonthlyData loadMonthlyData(long userId, @NotNull YearMonth period) throws RepositoryException {
        List<IncomeSource> income = repository.listIncomeSources(userId, period);
        List<BudgetSource> budgets = repository.listBudgetSources(userId, period);
        List<Expense> spent = repository.listExpenses(period);
        incomeSources.next(income);
        budgetSources.next(budgets);
        expenses.next(spent);
        MonthlyData data = new MonthlyData(period, income, budgets, spent);
        monthlyData.next(data);
        return data;
    }

    // ======== Streams ========

    public @NotNull BehaviorSubject<List<Expense>> getExpenseStream() {
        return expenses;
    }

    public @NotNull BehaviorSubject<List<IncomeSource>> getIncomeStream() {
        return incomeSources;
    }

    public @NotNull BehaviorSubject<List<BudgetSource>> getBudgetStream() {
        return budgetSources;
    }

    public @NotNull BehaviorSubject<MonthlyData> getMonthlyDataStream() {
        return monthlyData;
    }

    /**
     * Analytics recomputed on every change of the expense list, from the moment of this call on.
     */
    public @NotNull Observable<ExpenseAnalytics> expenseAnalytics() {
        return Operators.map(expenses, ExpenseAnalytics::of);
    }

    /**
     * Summary of every monthly view loaded from the moment of this call on.
     */
    public @NotNull Observable<Summary> financialSummary() {
        return Operators.map(Operators.filter(monthlyData, Objects::nonNull), MonthlyData::toSummary);
    }

    public @NotNull Observable<RecordCounts> recordCounts() {
        return recordCounts;
    }

    public RecordCounts lastRecordCounts() {
        return lastCounts.get();
    }

    public boolean subscribeToExpenseEvents(@NotNull String id, @NotNull Observer<? super Event> observer) {
        return debouncedExpenseEvents.subscribe(id, observer);
    }

    public boolean subscribeToValidationEvents(@NotNull String id, @NotNull Observer<? super Event> observer) {
        return validationEvents.subscribe(id, observer);
    }

    /**
     * Closes every stream owned by this service. The event bus is left open.
     */
    @Override
    public void close() {
        expenses.close();
        incomeSources.close();
        budgetSources.close();
        monthlyData.close();
        expenseEvents.close();
        validationEvents.close();
        debouncedExpenseEvents.close();
        recordCounts.close();
        logger.info("Reactive budget service closed");
    }

    // ======== Internals ========

    private void validateExpense(Expense expense) throws ValidationException {
        if (expense.getDescription().isBlank()) throw rejected("expense", "expense description is required");
        if (expense.getAmountCents() <= 0) throw rejected("expense", "expense amount must be positive");
    }

    private ValidationException rejected(String entity, String message) {
        validationEvents.next(new BaseEvent(EventTypes.VALIDATION_FAILED, SOURCE, message, Map.of("entity", entity)));
        logger.debug("Rejected {}: {}", entity, message);
        return new ValidationException(message);
    }

    private void forwardToBus(Event event) {
        try {
            bus.publishAsync(event);
        } catch (IllegalStateException e) {
            logger.warn("Event {} not forwarded: {}", event, e.getMessage());
        }
    }
}
