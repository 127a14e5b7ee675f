package io.github.budgetcore.domain;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * A single spending entry. Amounts are in cents.
 */
public final class Expense {
    private final long id;
    private final YearMonth period;
    private final String category;
    private final String description;
    private final long amountCents;
    private final Instant createdAt;

    public Expense(long id, @NotNull YearMonth period, @Nullable String category, @NotNull String description,
                   long amountCents, @NotNull Instant createdAt) {
        this.id = id;
        this.period = Objects.requireNonNull(period, "period");
        this.category = category == null ? "" : category;
        this.description = Objects.requireNonNull(description, "description");
        this.amountCents = amountCents;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Unsaved expense; the repository assigns the id.
     */
    public static @NotNull Expense draft(@NotNull YearMonth period, @Nullable String category,
                                         @NotNull String description, long amountCents) {
        return new Expense(0, period, category, description, amountCents, Instant.now());
    }

    public @NotNull Expense withId(long newId) {
        return new Expense(newId, period, category, description, amountCents, createdAt);
    }

    public long getId() {
        return id;
    }

    public @NotNull YearMonth getPeriod() {
        return period;
    }

    public @NotNull String getCategory() {
        return category;
    }

    public @NotNull String getDescription() {
        return description;
    }

    public long getAmountCents() {
        return amountCents;
    }

    public @NotNull Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Expense{id=" + id + ", period=" + period + ", category='" + category + "', description='" +
                description + "', amountCents=" + amountCents + '}';
    }
}
