package io.github.flameyossnowy.linkage.api.exceptions;

/**
 * Thrown when relationships or repositories are set up wrongly: a name that isn't a plain
 * identifier, an option outside the allow-list, an option value of the wrong shape, or a
 * lookup of a relationship that was never declared.
 */
public class ConfigurationException extends RepositoryException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
