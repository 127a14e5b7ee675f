package io.github.budgetcore.background_tasks;

/**
 * Lifecycle of a background task: PENDING → PROCESSING → {COMPLETED | FAILED | CANCELLED}.
 * CANCELLED may also be reached straight from PENDING.
 */
public enum TaskStatus {
    PENDING, PROCESSING, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
