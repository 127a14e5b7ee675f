package io.github.budgetcore.base_exceptions;

/**
 * A blocking call gave up because its {@link io.github.budgetcore.CancellationToken} expired or was stopped.
 */
public class OperationTimedOutException extends Exception {
    public OperationTimedOutException(String message) {
        super(message);
    }

    public OperationTimedOutException(Throwable cause) {
        super(cause);
    }

    public OperationTimedOutException(String message, Throwable cause) {
        super(message, cause);
    }

    public OperationTimedOutException(Throwable cause, String message) {
        super(message, cause);
    }
}
