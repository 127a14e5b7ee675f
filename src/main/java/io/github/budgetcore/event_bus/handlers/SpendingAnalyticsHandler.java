package io.github.budgetcore.event_bus.handlers;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.YearMonth;
import io.github.budgetcore.event_bus.DomainEvents;
import io.github.budgetcore.event_bus.Event;
import io.github.budgetcore.event_bus.EventBusInterface;
import io.github.budgetcore.event_bus.EventHandler;
import io.github.budgetcore.event_bus.EventTypes;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps per-category spending totals from expense events and publishes {@code budget.exceeded} on the bus
 * when a total crosses its configured monthly limit. Subscribe it under {@code "expense.*"}.
 */
@ThreadSafe
public final class SpendingAnalyticsHandler implements EventHandler {
    private final static Logger logger = LoggerFactory.getLogger(SpendingAnalyticsHandler.class);

    static final String UNCATEGORIZED = "uncategorized";
    private static final String SOURCE = "spending-analytics";

    private final EventBusInterface bus;

    @GuardedBy("this")
    private final Map<String, Long> limitsCents = new HashMap<>();
    @GuardedBy("this")
    private final Map<Key, Long> totalsCents = new LinkedHashMap<>();

    public SpendingAnalyticsHandler(@NotNull EventBusInterface bus) {
        this.bus = Objects.requireNonNull(bus, "bus");
    }

    /**
     * Monthly limit for {@code category}, applied to every user and month.
     */
    public synchronized SpendingAnalyticsHandler setLimit(@NotNull String category, long limitCents) {
        if (limitCents < 0) throw new IllegalArgumentException("limit must be >= 0");
        limitsCents.put(normalize(category), limitCents);
        return this;
    }

    @Override
    public void handle(Event event, CancellationToken token) {
        if (!(event.getData() instanceof Expense)) {
            logger.debug("Ignoring {} without expense data", event);
            return;
        }
        Expense expense = (Expense) event.getData();
        long userId = DomainEvents.userIdOf(event);
        Crossing crossing;
        switch (event.getType()) {
            case EventTypes.EXPENSE_CREATED:
                crossing = add(userId, expense, expense.getAmountCents());
                break;
            case EventTypes.EXPENSE_DELETED:
                crossing = add(userId, expense, -expense.getAmountCents());
                break;
            case EventTypes.EXPENSE_UPDATED:
                Object previous = event.getMetadata().get(DomainEvents.PREVIOUS);
                if (previous instanceof Expense) {
                    Expense old = (Expense) previous;
                    add(userId, old, -old.getAmountCents());
                }
                crossing = add(userId, expense, expense.getAmountCents());
                break;
            default:
                return;
        }
        if (crossing != null) {
            logger.info("User {} exceeded {} budget for {}: spent {} of {} cents", userId, crossing.category,
                    crossing.period, crossing.spentCents, crossing.limitCents);
            bus.publish(DomainEvents.budgetExceeded(crossing.period, userId, crossing.category,
                    crossing.limitCents, crossing.spentCents, SOURCE), token);
        }
    }

    public synchronized long totalCents(long userId, @NotNull YearMonth period, @NotNull String category) {
        return totalsCents.getOrDefault(new Key(userId, period, normalize(category)), 0L);
    }

    public synchronized @NotNull Map<String, Long> categoryTotals(long userId, @NotNull YearMonth period) {
        Map<String, Long> out = new LinkedHashMap<>();
        totalsCents.forEach((k, v) -> {
            if (k.userId == userId && k.period.equals(period)) out.put(k.category, v);
        });
        return out;
    }

    /**
     * Applies {@code delta}; returns the crossing if this update took the total from within the limit to over it.
     */
    private synchronized Crossing add(long userId, Expense expense, long delta) {
        String category = normalize(expense.getCategory());
        Key key = new Key(userId, expense.getPeriod(), category);
        long before = totalsCents.getOrDefault(key, 0L);
        long after = before + delta;
        totalsCents.put(key, after);
        Long limit = limitsCents.get(category);
        if (limit != null && before <= limit && after > limit) {
            return new Crossing(expense.getPeriod(), category, limit, after);
        }
        return null;
    }

    private static String normalize(String category) {
        return category == null || category.isBlank() ? UNCATEGORIZED : category.trim().toLowerCase();
    }

    private static final class Key {
        final long userId;
        final YearMonth period;
        final String category;

        Key(long userId, YearMonth period, String category) {
            this.userId = userId;
            this.period = period;
            this.category = category;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key k = (Key) o;
            return userId == k.userId && period.equals(k.period) && category.equals(k.category);
        }

        @Override
        public int hashCode() {
            return Objects.hash(userId, period, category);
        }
    }

    private static final class Crossing {
        final YearMonth period;
        final String category;
        final long limitCents;
        final long spentCents;

        Crossing(YearMonth period, String category, long limitCents, long spentCents) {
            this.period = period;
            this.category = category;
            this.limitCents = limitCents;
            this.spentCents = spentCents;
        }
    }
}
