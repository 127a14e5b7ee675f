package io.github.budgetcore.aggregator;

import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.base_exceptions.AggregationTimedOutException;
import io.github.budgetcore.base_exceptions.ValidationException;
import io.github.budgetcore.domain.BudgetRepository;
import io.github.budgetcore.domain.BudgetSource;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.IncomeSource;
import io.github.budgetcore.domain.YearMonth;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reads income sources, budget sources and expenses of one month concurrently.
 */
public final class MonthlyDataAggregator implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(MonthlyDataAggregator.class);

    public static final String INCOME_SOURCES = "income_sources";
    public static final String BUDGET_SOURCES = "budget_sources";
    public static final String EXPENSES = "expenses";

    private final ConcurrentAggregator<MonthKey> aggregator;
    private final AggregationPlan<MonthKey> plan;

    public MonthlyDataAggregator(@NotNull BudgetRepository repository) {
        this(repository, new ConcurrentAggregator<>());
    }

    public MonthlyDataAggregator(@NotNull BudgetRepository repository, @NotNull ConcurrentAggregator<MonthKey> aggregator) {
        Objects.requireNonNull(repository, "repository");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.plan = AggregationPlan.<MonthKey>builder()
                .field(INCOME_SOURCES, (k, token) -> repository.listIncomeSources(k.userId, k.period))
                .field(BUDGET_SOURCES, (k, token) -> repository.listBudgetSources(k.userId, k.period))
                .field(EXPENSES, (k, token) -> repository.listExpenses(k.period))
                .build();
    }

    /**
     * Fetch with the aggregator's default deadline (10 seconds unless configured otherwise).
     */
    public @NotNull MonthlyDataResult fetch(long userId, int year, int month)
            throws ValidationException, AggregationTimedOutException, InterruptedException {
        return fetch(userId, year, month, CancellationToken.withTimeout(aggregator.getDefaultTimeout()));
    }

    public @NotNull MonthlyDataResult fetch(long userId, int year, int month, @NotNull Duration timeout)
            throws ValidationException, AggregationTimedOutException, InterruptedException {
        return fetch(userId, year, month, CancellationToken.withTimeout(timeout));
    }

    /**
     * @throws ValidationException          if year or month is out of range; nothing is fetched
     * @throws AggregationTimedOutException if {@code token} is done before all three reads finish
     */
    public @NotNull MonthlyDataResult fetch(long userId, int year, int month, @NotNull CancellationToken token)
            throws ValidationException, AggregationTimedOutException, InterruptedException {
        YearMonth period = YearMonth.of(year, month);
        AggregateResult r = aggregator.aggregate(new MonthKey(userId, period), plan, token);
        MonthlyDataResult result = new MonthlyDataResult(period,
                listOrEmpty(r, INCOME_SOURCES, IncomeSource.class),
                listOrEmpty(r, BUDGET_SOURCES, BudgetSource.class),
                listOrEmpty(r, EXPENSES, Expense.class),
                r.errors());
        logger.debug("Monthly data for user {} {}: {}", userId, period, result);
        return result;
    }

    @Override
    public void close() {
        aggregator.close();
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> listOrEmpty(AggregateResult r, String field, Class<T> elementType) {
        List<T> list = (List<T>) r.get(field, List.class);
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * Aggregation key: whose data, which month.
     */
    public static final class MonthKey {
        public final long userId;
        public final YearMonth period;

        MonthKey(long userId, YearMonth period) {
            this.userId = userId;
            this.period = period;
        }

        @Override
        public String toString() {
            return "user " + userId + " " + period;
        }
    }
}
