package io.github.budgetcore.base_exceptions;

/**
 * Input rejected before any state was touched, such as an out-of-range month or a non-positive amount.
 */
public class ValidationException extends Exception {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(Throwable cause) {
        super(cause);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ValidationException(Throwable cause, String message) {
        super(message, cause);
    }
}
