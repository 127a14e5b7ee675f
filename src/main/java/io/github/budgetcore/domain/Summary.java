package io.github.budgetcore.domain;

import org.jetbrains.annotations.NotNull;

/**
 * Month totals in cents; {@code remaining = income - expenses}.
 */
public final class Summary {
    public final YearMonth period;
    public final long incomeCents;
    public final long budgetCents;
    public final long expenseCents;
    public final long remainingCents;

    public Summary(@NotNull YearMonth period, long incomeCents, long budgetCents, long expenseCents) {
        this.period = period;
        this.incomeCents = incomeCents;
        this.budgetCents = budgetCents;
        this.expenseCents = expenseCents;
        this.remainingCents = incomeCents - expenseCents;
    }

    @Override
    public String toString() {
        return "Summary{period=" + period + ", income=" + incomeCents + ", budget=" + budgetCents +
                ", expenses=" + expenseCents + ", remaining=" + remainingCents + '}';
    }
}
