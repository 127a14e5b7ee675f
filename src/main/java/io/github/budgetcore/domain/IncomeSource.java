package io.github.budgetcore.domain;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;

/**
 * Named income stream for one month, owned by a user. Amounts are in cents.
 */
public final class IncomeSource {
    private final long id;
    private final long userId;
    private final String name;
    private final YearMonth period;
    private final long amountCents;
    private final Instant createdAt;
    private final Instant updatedAt;

    public IncomeSource(long id, long userId, @NotNull String name, @NotNull YearMonth period, long amountCents,
                        @NotNull Instant createdAt, @NotNull Instant updatedAt) {
        this.id = id;
        this.userId = userId;
        this.name = Objects.requireNonNull(name, "name");
        this.period = Objects.requireNonNull(period, "period");
        this.amountCents = amountCents;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public @NotNull IncomeSource withNameAndAmount(@NotNull String newName, long newAmountCents) {
        return new IncomeSource(id, userId, newName, period, newAmountCents, createdAt, Instant.now());
    }

    public long getId() {
        return id;
    }

    public long getUserId() {
        return userId;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull YearMonth getPeriod() {
        return period;
    }

    public long getAmountCents() {
        return amountCents;
    }

    public @NotNull Instant getCreatedAt() {
        return createdAt;
    }

    public @NotNull Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "IncomeSource{id=" + id + ", userId=" + userId + ", name='" + name + "', period=" + period +
                ", amountCents=" + amountCents + '}';
    }
}
