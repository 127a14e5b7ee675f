package io.github.budgetcore.domain;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Everything known about one month for one user, with derived totals.
 */
public final class MonthlyData {
    public final YearMonth period;
    public final String monthName;
    public final List<IncomeSource> incomeSources;
    public final List<BudgetSource> budgetSources;
    public final List<Expense> expenses;
    public final long totalIncomeCents;
    public final long totalBudgetCents;
    public final long totalExpensesCents;
    public final long remainingCents;

    public MonthlyData(@NotNull YearMonth period, @NotNull List<IncomeSource> incomeSources,
                       @NotNull List<BudgetSource> budgetSources, @NotNull List<Expense> expenses) {
        this.period = period;
        this.monthName = period.monthName();
        this.incomeSources = List.copyOf(incomeSources);
        this.budgetSources = List.copyOf(budgetSources);
        this.expenses = List.copyOf(expenses);
        this.totalIncomeCents = incomeSources.stream().mapToLong(IncomeSource::getAmountCents).sum();
        this.totalBudgetCents = budgetSources.stream().mapToLong(BudgetSource::getAmountCents).sum();
        this.totalExpensesCents = expenses.stream().mapToLong(Expense::getAmountCents).sum();
        this.remainingCents = totalIncomeCents - totalExpensesCents;
    }

    public @NotNull Summary toSummary() {
        return new Summary(period, totalIncomeCents, totalBudgetCents, totalExpensesCents);
    }

    @Override
    public String toString() {
        return "MonthlyData{period=" + period + ", incomeSources=" + incomeSources.size() +
                ", budgetSources=" + budgetSources.size() + ", expenses=" + expenses.size() +
                ", remaining=" + remainingCents + '}';
    }
}
