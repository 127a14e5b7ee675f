package io.github.budgetcore.base_exceptions;

/**
 * The persistence collaborator could not serve a read or write.
 */
public class RepositoryException extends Exception {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(Throwable cause) {
        super(cause);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(Throwable cause, String message) {
        super(message, cause);
    }
}
