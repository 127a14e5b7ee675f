package io.github.budgetcore.domain;

import io.github.budgetcore.base_exceptions.RepositoryException;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed repository for tests. Any operation can be made to fail or to stall.
 */
public class InMemoryBudgetRepository implements BudgetRepository {

    public static final String LIST_INCOME = "listIncomeSources";
    public static final String LIST_BUDGETS = "listBudgetSources";
    public static final String LIST_EXPENSES = "listExpenses";

    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, Expense> expenses = new ConcurrentSkipListMap<>();
    private final Map<Long, IncomeSource> income = new ConcurrentSkipListMap<>();
    private final Map<Long, BudgetSource> budgets = new ConcurrentSkipListMap<>();

    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final Map<String, Long> delaysMillis = new ConcurrentHashMap<>();

    public void failOn(String operation, String message) {
        failures.put(operation, message);
    }

    public void delay(String operation, long millis) {
        delaysMillis.put(operation, millis);
    }

    private void enter(String operation) throws RepositoryException {
        Long d = delaysMillis.get(operation);
        if (d != null) {
            try {
                Thread.sleep(d);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RepositoryException(operation + " interrupted", e);
            }
        }
        String message = failures.get(operation);
        if (message != null) throw new RepositoryException(message);
    }

    @Override
    public @NotNull List<IncomeSource> listIncomeSources(long userId, @NotNull YearMonth period)
            throws RepositoryException {
        enter(LIST_INCOME);
        List<IncomeSource> out = new ArrayList<>();
        for (IncomeSource s : income.values()) {
            if (s.getUserId() == userId && s.getPeriod().equals(period)) out.add(s);
        }
        return out;
    }

    @Override
    public @NotNull List<BudgetSource> listBudgetSources(long userId, @NotNull YearMonth period)
            throws RepositoryException {
        enter(LIST_BUDGETS);
        List<BudgetSource> out = new ArrayList<>();
        for (BudgetSource s : budgets.values()) {
            if (s.getUserId() == userId && s.getPeriod().equals(period)) out.add(s);
        }
        return out;
    }

    @Override
    public @NotNull List<Expense> listExpenses(@NotNull YearMonth period) throws RepositoryException {
        enter(LIST_EXPENSES);
        List<Expense> out = new ArrayList<>();
        for (Expense e : expenses.values()) {
            if (e.getPeriod().equals(period)) out.add(e);
        }
        return out;
    }

    @Override
    public @NotNull Expense addExpense(@NotNull Expense draft) throws RepositoryException {
        enter("addExpense");
        Expense stored = draft.withId(ids.incrementAndGet());
        expenses.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public @NotNull Expense updateExpense(@NotNull Expense expense) throws RepositoryException {
        enter("updateExpense");
        if (!expenses.containsKey(expense.getId())) throw new RepositoryException("no expense " + expense.getId());
        expenses.put(expense.getId(), expense);
        return expense;
    }

    @Override
    public void deleteExpense(long expenseId) throws RepositoryException {
        enter("deleteExpense");
        if (expenses.remove(expenseId) == null) throw new RepositoryException("no expense " + expenseId);
    }

    @Override
    public @NotNull IncomeSource createIncomeSource(long userId, @NotNull String name,
                                                                 @NotNull YearMonth period, long amountCents)
            throws RepositoryException {
        enter("createIncomeSource");
        Instant now = Instant.now();
        IncomeSource s = new IncomeSource(ids.incrementAndGet(), userId, name, period, amountCents, now, now);
        income.put(s.getId(), s);
        return s;
    }

    @Override
    public @NotNull IncomeSource updateIncomeSource(long id, @NotNull String name, long amountCents)
            throws RepositoryException {
        enter("updateIncomeSource");
        IncomeSource s = income.get(id);
        if (s == null) throw new RepositoryException("no income source " + id);
        IncomeSource updated = s.withNameAndAmount(name, amountCents);
        income.put(id, updated);
        return updated;
    }

    @Override
    public @NotNull BudgetSource createBudgetSource(long userId, @NotNull String name,
                                                                 @NotNull YearMonth period, long amountCents)
            throws RepositoryException {
        enter("createBudgetSource");
        Instant now = Instant.now();
        BudgetSource s = new BudgetSource(ids.incrementAndGet(), userId, name, period, amountCents, now, now);
        budgets.put(s.getId(), s);
        return s;
    }

    @Override
    public @NotNull BudgetSource updateBudgetSource(long id, @NotNull String name, long amountCents)
            throws RepositoryException {
        enter("updateBudgetSource");
        BudgetSource s = budgets.get(id);
        if (s == null) throw new RepositoryException("no budget source " + id);
        BudgetSource updated = s.withNameAndAmount(name, amountCents);
        budgets.put(id, updated);
        return updated;
    }
}
