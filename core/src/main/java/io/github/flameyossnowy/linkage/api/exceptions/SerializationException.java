package io.github.flameyossnowy.linkage.api.exceptions;

public class SerializationException extends RepositoryException {
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
