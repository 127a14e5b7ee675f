package io.github.budgetcore.event_bus;

public final class EventTypes {
    public static final String EXPENSE_CREATED = "expense.created";
    public static final String EXPENSE_UPDATED = "expense.updated";
    public static final String EXPENSE_DELETED = "expense.deleted";
    public static final String INCOME_SOURCE_CREATED = "income_source.created";
    public static final String INCOME_SOURCE_UPDATED = "income_source.updated";
    public static final String BUDGET_SOURCE_CREATED = "budget_source.created";
    public static final String BUDGET_SOURCE_UPDATED = "budget_source.updated";
    public static final String MONTHLY_DATA_UPDATED = "monthly_data.updated";
    public static final String BUDGET_EXCEEDED = "budget.exceeded";
    public static final String USER_LOGGED_IN = "user.logged_in";
    public static final String USER_LOGGED_OUT = "user.logged_out";
    public static final String SYSTEM_HEALTH = "system.health";
    public static final String VALIDATION_FAILED = "validation.failed";

    /**
     * Subscription pattern matching every event type.
     */
    public static final String ALL = "*";

    private EventTypes() {
    }
}
