package io.github.flameyossnowy.linkage.api.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a mutation needs a persisted record and doesn't get one, e.g. {@code create}
 * on the collection of an unsaved owner.
 */
public class RecordNotSavedException extends RepositoryException {
    private final Object record;

    public RecordNotSavedException(String message, @Nullable Object record) {
        super(message);
        this.record = record;
    }

    public @Nullable Object getRecord() {
        return record;
    }
}
