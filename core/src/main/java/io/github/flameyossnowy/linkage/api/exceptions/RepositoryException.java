package io.github.flameyossnowy.linkage.api.exceptions;

/**
 * Base type of every error raised by the association layer.
 */
public class RepositoryException extends RuntimeException {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
