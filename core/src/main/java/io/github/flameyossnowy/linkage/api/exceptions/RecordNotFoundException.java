package io.github.flameyossnowy.linkage.api.exceptions;

import java.util.Collection;
import java.util.List;

public class RecordNotFoundException extends RepositoryException {
    private final List<Object> missingIds;

    public RecordNotFoundException(Class<?> type, Collection<?> missingIds) {
        super("Couldn't find all " + type.getSimpleName() + " with ids " + missingIds);
        this.missingIds = List.copyOf(missingIds);
    }

    public List<Object> getMissingIds() {
        return missingIds;
    }
}
