package io.github.budgetcore.services;

/**
 * How many expenses, income sources and budget sources the live streams currently hold.
 */
public final class RecordCounts {
    public final int expenses;
    public final int incomeSources;
    public final int budgetSources;

    RecordCounts(int expenses, int incomeSources, int budgetSources) {
        this.expenses = expenses;
        this.incomeSources = incomeSources;
        this.budgetSources = budgetSources;
    }

    @Override
    public String toString() {
        return "RecordCounts{expenses=" + expenses + ", incomeSources=" + incomeSources + ", budgetSources=" +
                budgetSources + '}';
    }
}
