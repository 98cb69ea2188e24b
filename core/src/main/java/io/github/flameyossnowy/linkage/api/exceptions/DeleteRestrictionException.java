package io.github.flameyossnowy.linkage.api.exceptions;

/**
 * Raised by a {@code restrictWithException} cascade when the owner still has dependent records.
 */
public class DeleteRestrictionException extends RepositoryException {
    private final String association;

    public DeleteRestrictionException(String association) {
        super("Cannot delete record because of dependent " + association);
        this.association = association;
    }

    public String getAssociation() {
        return association;
    }
}
