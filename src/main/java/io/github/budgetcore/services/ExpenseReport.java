package io.github.budgetcore.services;

import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.Summary;
import io.github.budgetcore.domain.YearMonth;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of an {@code expense_report} background task.
 */
public final class ExpenseReport {
    public final YearMonth period;
    public final Instant generatedAt;
    public final Summary summary;
    public final Map<String, Long> spentByCategoryCents;
    public final List<Expense> largestExpenses;
    /**
     * Reads that failed while the report was assembled; an empty list means the report is complete.
     */
    public final List<String> warnings;

    ExpenseReport(YearMonth period, Instant generatedAt, Summary summary, Map<String, Long> spentByCategoryCents,
                  List<Expense> largestExpenses, List<String> warnings) {
        this.period = period;
        this.generatedAt = generatedAt;
        this.summary = summary;
        this.spentByCategoryCents = Map.copyOf(spentByCategoryCents);
        this.largestExpenses = List.copyOf(largestExpenses);
        this.warnings = List.copyOf(warnings);
    }

    public boolean isComplete() {
        return warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "ExpenseReport{period=" + period + ", summary=" + summary + ", categories=" +
                spentByCategoryCents.size() + ", warnings=" + warnings.size() + '}';
    }
}
