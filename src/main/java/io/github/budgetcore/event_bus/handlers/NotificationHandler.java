package io.github.budgetcore.event_bus.handlers;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.UuidProvider;
import io.github.budgetcore.domain.BudgetSource;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.IncomeSource;
import io.github.budgetcore.event_bus.DomainEvents;
import io.github.budgetcore.event_bus.Event;
import io.github.budgetcore.event_bus.EventHandler;
import io.github.budgetcore.event_bus.EventTypes;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns domain events into user and operator notifications and hands them to a {@link NotificationSender}.
 * <ul>
 *   <li>expense and source changes: in-app, normal priority, to the acting user</li>
 *   <li>{@code budget.exceeded}: email, high priority, to the acting user</li>
 *   <li>{@code system.health} with status {@code critical} or {@code error}: email, urgent, to the operator</li>
 * </ul>
 * Login and logout are only logged. Other event types are ignored. The last sent notifications are kept in memory.
 */
@ThreadSafe
public final class NotificationHandler implements EventHandler {
    private final static Logger logger = LoggerFactory.getLogger(NotificationHandler.class);

    public static final int DEFAULT_CAPACITY = 500;
    public static final String DEFAULT_OPERATOR = "operator";

    private final NotificationSender sender;
    private final String operatorRecipient;
    private final int capacity;
    @GuardedBy("this")
    private final ArrayDeque<Notification> sent;

    /**
     * Logs every notification instead of sending it.
     */
    public NotificationHandler() {
        this(n -> logger.info("Notification {} via {} to {}: {}", n.id, n.channel, n.recipient, n.message),
                DEFAULT_OPERATOR, DEFAULT_CAPACITY);
    }

    public NotificationHandler(@NotNull NotificationSender sender, @NotNull String operatorRecipient, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.operatorRecipient = Objects.requireNonNull(operatorRecipient, "operatorRecipient");
        this.capacity = capacity;
        this.sent = new ArrayDeque<>(Math.min(capacity, 64));
    }

    @Override
    public void handle(Event event, CancellationToken token) throws Exception {
        Notification n = toNotification(event);
        if (n == null) return;
        token.throwIfDone();
        sender.send(n);
        logger.debug("Sent {} for {}", n, event.getId());
        synchronized (this) {
            sent.addLast(n);
            while (sent.size() > capacity) sent.pollFirst();
        }
    }

    /**
     * Newest last.
     */
    public synchronized @NotNull List<Notification> sentNotifications() {
        return new ArrayList<>(sent);
    }

    private Notification toNotification(Event event) {
        String user = "user_" + DomainEvents.userIdOf(event);
        Map<String, Object> data = new LinkedHashMap<>();
        switch (event.getType()) {
            case EventTypes.EXPENSE_CREATED: {
                Expense e = dataAs(event, Expense.class);
                putExpense(data, e);
                return notification(event, Notification.Channel.IN_APP, Notification.Priority.NORMAL, user,
                        "Expense added", String.format(Locale.ROOT, "Your expense '%s' for %s has been added.",
                                e.getDescription(), money(e.getAmountCents())), data);
            }
            case EventTypes.EXPENSE_UPDATED: {
                Expense e = dataAs(event, Expense.class);
                putExpense(data, e);
                return notification(event, Notification.Channel.IN_APP, Notification.Priority.NORMAL, user,
                        "Expense updated", "Your expense '" + e.getDescription() + "' has been updated.", data);
            }
            case EventTypes.EXPENSE_DELETED: {
                Expense e = dataAs(event, Expense.class);
                data.put("expense_id", e.getId());
                data.put("description", e.getDescription());
                return notification(event, Notification.Channel.IN_APP, Notification.Priority.NORMAL, user,
                        "Expense deleted", "Your expense '" + e.getDescription() + "' has been deleted.", data);
            }
            case EventTypes.INCOME_SOURCE_CREATED: {
                IncomeSource s = dataAs(event, IncomeSource.class);
                data.put("income_source_id", s.getId());
                data.put("name", s.getName());
                data.put("amount_cents", s.getAmountCents());
                return notification(event, Notification.Channel.IN_APP, Notification.Priority.NORMAL, user,
                        "Income source added", String.format(Locale.ROOT, "Your income source '%s' for %s has been added.",
                                s.getName(), money(s.getAmountCents())), data);
            }
            case EventTypes.BUDGET_SOURCE_CREATED: {
                BudgetSource s = dataAs(event, BudgetSource.class);
                data.put("budget_source_id", s.getId());
                data.put("name", s.getName());
                data.put("amount_cents", s.getAmountCents());
                return notification(event, Notification.Channel.IN_APP, Notification.Priority.NORMAL, user,
                        "Budget source added", String.format(Locale.ROOT, "Your budget source '%s' for %s has been added.",
                                s.getName(), money(s.getAmountCents())), data);
            }
            case EventTypes.BUDGET_EXCEEDED:
                return budgetExceeded(event, user, data);
            case EventTypes.SYSTEM_HEALTH:
                return systemHealth(event);
            case EventTypes.USER_LOGGED_IN:
            case EventTypes.USER_LOGGED_OUT:
                logger.info("{} for {} ({})", event.getType(), user, event.getData());
                return null;
            default:
                logger.debug("No notification for {}", event.getType());
                return null;
        }
    }

    private Notification budgetExceeded(Event event, String user, Map<String, Object> data) {
        Map<?, ?> details = dataAs(event, Map.class);
        long budget = longValue(details.get("budget_cents"));
        long spent = longValue(details.get("spent_cents"));
        long exceededBy = spent - budget;
        data.put("category", details.get("category"));
        data.put("period", details.get("period"));
        data.put("budget_cents", budget);
        data.put("spent_cents", spent);
        data.put("exceeded_by_cents", exceededBy);
        if (budget > 0) data.put("exceeded_percent", exceededBy * 100.0 / budget);
        return notification(event, Notification.Channel.EMAIL, Notification.Priority.HIGH, user,
                "Budget exceeded", String.format(Locale.ROOT,
                        "Your '%s' budget has been exceeded by %s. Spent: %s, budget: %s.",
                        details.get("category"), money(exceededBy), money(spent), money(budget)), data);
    }

    private Notification systemHealth(Event event) {
        Map<?, ?> details = dataAs(event, Map.class);
        String status = String.valueOf(details.get("status"));
        if (!"critical".equals(status) && !"error".equals(status)) return null;
        Map<String, Object> data = new LinkedHashMap<>();
        details.forEach((k, v) -> data.put(String.valueOf(k), v));
        return notification(event, Notification.Channel.EMAIL, Notification.Priority.URGENT, operatorRecipient,
                "System health alert: " + status, String.valueOf(details.get("message")), data);
    }

    private static Notification notification(Event event, Notification.Channel channel, Notification.Priority priority,
                                             String recipient, String subject, String message, Map<String, Object> data) {
        return new Notification(UuidProvider.generatePrefixedId("notif"), event.getId(), channel, priority, recipient,
                subject, message, data, Instant.now());
    }

    private static void putExpense(Map<String, Object> data, Expense e) {
        data.put("expense_id", e.getId());
        data.put("amount_cents", e.getAmountCents());
        data.put("category", e.getCategory());
        data.put("description", e.getDescription());
        data.put("period", e.getPeriod());
    }

    private static <D> D dataAs(Event event, Class<D> type) {
        Object data = event.getData();
        if (!type.isInstance(data)) {
            throw new IllegalArgumentException(event.getType() + " carries " +
                    (data == null ? "no data" : data.getClass().getSimpleName()) + ", expected " + type.getSimpleName());
        }
        return type.cast(data);
    }

    private static long longValue(Object v) {
        return v instanceof Number ? ((Number) v).longValue() : 0L;
    }

    private static String money(long cents) {
        return String.format(Locale.ROOT, "$%.2f", cents / 100.0);
    }
}
