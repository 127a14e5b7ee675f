package io.github.budgetcore.base_exceptions;

public class QueueFullException extends Exception {
    private final int capacity;

    public QueueFullException(String message, int capacity) {
        super(message);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
