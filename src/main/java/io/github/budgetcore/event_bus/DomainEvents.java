package io.github.budgetcore.event_bus;

import io.github.budgetcore.domain.BudgetSource;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.IncomeSource;
import io.github.budgetcore.domain.MonthlyData;
import io.github.budgetcore.domain.YearMonth;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for the events the budgeting domain emits. The affected record is the event data; who did it
 * (and, for updates, the previous version) goes into the metadata.
 */
public final class DomainEvents {
    public static final String USER_ID = "user_id";
    public static final String PREVIOUS = "previous";

    private DomainEvents() {
    }

    public static @NotNull Event expenseCreated(@NotNull Expense expense, long userId, @NotNull String source) {
        return new BaseEvent(EventTypes.EXPENSE_CREATED, source, expense, user(userId));
    }

    public static @NotNull Event expenseUpdated(@NotNull Expense expense, @Nullable Expense previous, long userId,
                                                @NotNull String source) {
        return new BaseEvent(EventTypes.EXPENSE_UPDATED, source, expense, userAndPrevious(userId, previous));
    }

    public static @NotNull Event expenseDeleted(@NotNull Expense expense, long userId, @NotNull String source) {
        return new BaseEvent(EventTypes.EXPENSE_DELETED, source, expense, user(userId));
    }

    public static @NotNull Event incomeSourceCreated(@NotNull IncomeSource incomeSource, @NotNull String source) {
        return new BaseEvent(EventTypes.INCOME_SOURCE_CREATED, source, incomeSource, user(incomeSource.getUserId()));
    }

    public static @NotNull Event incomeSourceUpdated(@NotNull IncomeSource incomeSource, @Nullable IncomeSource previous,
                                                     @NotNull String source) {
        return new BaseEvent(EventTypes.INCOME_SOURCE_UPDATED, source, incomeSource,
                userAndPrevious(incomeSource.getUserId(), previous));
    }

    public static @NotNull Event budgetSourceCreated(@NotNull BudgetSource budgetSource, @NotNull String source) {
        return new BaseEvent(EventTypes.BUDGET_SOURCE_CREATED, source, budgetSource, user(budgetSource.getUserId()));
    }

    public static @NotNull Event budgetSourceUpdated(@NotNull BudgetSource budgetSource, @Nullable BudgetSource previous,
                                                     @NotNull String source) {
        return new BaseEvent(EventTypes.BUDGET_SOURCE_UPDATED, source, budgetSource,
                userAndPrevious(budgetSource.getUserId(), previous));
    }

    public static @NotNull Event monthlyDataUpdated(@NotNull MonthlyData data, long userId, @NotNull String source) {
        return new BaseEvent(EventTypes.MONTHLY_DATA_UPDATED, source, data, user(userId));
    }

    /**
     * Data is a map with {@code period}, {@code category}, {@code budget_cents}, {@code spent_cents} and
     * {@code exceeded_by_cents}.
     */
    public static @NotNull Event budgetExceeded(@NotNull YearMonth period, long userId, @NotNull String category,
                                                long budgetCents, long spentCents, @NotNull String source) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("period", period);
        data.put("category", category);
        data.put("budget_cents", budgetCents);
        data.put("spent_cents", spentCents);
        data.put("exceeded_by_cents", spentCents - budgetCents);
        return new BaseEvent(EventTypes.BUDGET_EXCEEDED, source, data, user(userId));
    }

    public static @NotNull Event userLoggedIn(long userId, @NotNull String username, @NotNull String source) {
        return new BaseEvent(EventTypes.USER_LOGGED_IN, source, username, user(userId));
    }

    public static @NotNull Event userLoggedOut(long userId, @NotNull String username, @NotNull String source) {
        return new BaseEvent(EventTypes.USER_LOGGED_OUT, source, username, user(userId));
    }

    public static @NotNull Event systemHealth(@NotNull String status, @NotNull String message,
                                              @NotNull Map<String, Object> metrics, @NotNull String source) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status);
        data.put("message", message);
        data.put("metrics", Map.copyOf(metrics));
        return new BaseEvent(EventTypes.SYSTEM_HEALTH, source, data);
    }

    /**
     * Reads the acting user from an event built by this factory, -1 when absent.
     */
    public static long userIdOf(@NotNull Event event) {
        Object v = event.getMetadata().get(USER_ID);
        return v instanceof Long ? (Long) v : -1L;
    }

    private static Map<String, Object> user(long userId) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(USER_ID, userId);
        return m;
    }

    private static Map<String, Object> userAndPrevious(long userId, @Nullable Object previous) {
        Map<String, Object> m = user(userId);
        if (previous != null) m.put(PREVIOUS, previous);
        return m;
    }
}
