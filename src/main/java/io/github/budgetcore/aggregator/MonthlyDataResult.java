package io.github.budgetcore.aggregator;

import io.github.budgetcore.domain.BudgetSource;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.IncomeSource;
import io.github.budgetcore.domain.MonthlyData;
import io.github.budgetcore.domain.YearMonth;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Monthly view assembled by {@link MonthlyDataAggregator}. A list whose fetch failed is empty and the
 * failure is listed in {@link #errors}.
 */
public final class MonthlyDataResult {
    public final YearMonth period;
    public final List<IncomeSource> incomeSources;
    public final List<BudgetSource> budgetSources;
    public final List<Expense> expenses;
    public final List<Throwable> errors;

    MonthlyDataResult(YearMonth period, List<IncomeSource> incomeSources, List<BudgetSource> budgetSources,
                      List<Expense> expenses, List<Throwable> errors) {
        this.period = period;
        this.incomeSources = List.copyOf(incomeSources);
        this.budgetSources = List.copyOf(budgetSources);
        this.expenses = List.copyOf(expenses);
        this.errors = List.copyOf(errors);
    }

    public boolean isDegraded() {
        return !errors.isEmpty();
    }

    public @NotNull MonthlyData toMonthlyData() {
        return new MonthlyData(period, incomeSources, budgetSources, expenses);
    }

    @Override
    public String toString() {
        return "MonthlyDataResult{period=" + period + ", incomeSources=" + incomeSources.size() +
                ", budgetSources=" + budgetSources.size() + ", expenses=" + expenses.size() +
                ", errors=" + errors.size() + '}';
    }
}
