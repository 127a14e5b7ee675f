package io.github.budgetcore.base_exceptions;

import java.util.Collections;
import java.util.List;

/**
 * One or more handlers of a composite handler failed after their retries. The first failure is the cause, the
 * others are attached as suppressed exceptions.
 */
public class CompositeHandlerException extends Exception {
    private final List<Exception> failures;

    public CompositeHandlerException(String message, List<Exception> failures) {
        super(message, failures.isEmpty() ? null : failures.get(0));
        this.failures = Collections.unmodifiableList(failures);
        for (int i = 1; i < failures.size(); i++) {
            addSuppressed(failures.get(i));
        }
    }

    public List<Exception> getFailures() {
        return failures;
    }
}
