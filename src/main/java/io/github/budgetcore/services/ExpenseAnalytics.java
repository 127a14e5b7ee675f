package io.github.budgetcore.services;

import io.github.budgetcore.domain.Expense;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running figures over the current expense list.
 */
public final class ExpenseAnalytics {
    public final long totalCents;
    public final int count;
    public final long averageCents;
    public final Map<String, Integer> countByCategory;

    private ExpenseAnalytics(long totalCents, int count, Map<String, Integer> countByCategory) {
        this.totalCents = totalCents;
        this.count = count;
        this.averageCents = count == 0 ? 0 : totalCents / count;
        this.countByCategory = Collections.unmodifiableMap(countByCategory);
    }

    public static @NotNull ExpenseAnalytics of(@NotNull List<Expense> expenses) {
        long total = 0;
        Map<String, Integer> byCategory = new TreeMap<>();
        for (Expense e : expenses) {
            total += e.getAmountCents();
            byCategory.merge(e.getCategory(), 1, Integer::sum);
        }
        return new ExpenseAnalytics(total, expenses.size(), byCategory);
    }

    @Override
    public String toString() {
        return "ExpenseAnalytics{total=" + totalCents + ", count=" + count + ", average=" + averageCents + '}';
    }
}
