package io.github.budgetcore.base_exceptions;

/**
 * The worker pool does not accept work: it was never started, is stopping, or has been stopped.
 */
public class PoolNotRunningException extends Exception {
    public PoolNotRunningException(String message) {
        super(message);
    }
}
