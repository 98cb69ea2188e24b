package io.github.flameyossnowy.linkage.api.associations;

import io.github.flameyossnowy.linkage.api.Errors;
import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.exceptions.DeleteRestrictionException;
import io.github.flameyossnowy.linkage.api.options.SelectOption;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A to-many association whose members hold the owner's identity in their foreign key.
 */
public final class HasManyAssociation<T extends Record> extends CollectionAssociation<T> {
    public HasManyAssociation(@NotNull Record owner, @NotNull Reflection reflection) {
        super(owner, reflection);
    }

    /**
     * Applies the declared {@code dependent} policy before the owner is destroyed.
     *
     * @return false when the owner must not be destroyed
     * @throws DeleteRestrictionException under {@link DependentPolicy#RESTRICT_WITH_EXCEPTION} when members exist
     */
    public boolean handleDependency() {
        Optional<DependentPolicy> policy = reflection.dependent();
        if (policy.isEmpty()) return true;

        switch (policy.get()) {
            case RESTRICT_WITH_EXCEPTION -> {
                if (!isEmpty()) throw new DeleteRestrictionException(reflection.name());
            }
            case RESTRICT_WITH_ERROR -> {
                if (!isEmpty()) {
                    owner.getErrors().add(Errors.BASE, "Cannot delete record because dependent " + reflection.name() + " exist");
                    return false;
                }
            }
            case DESTROY -> {
                for (T record : loadTarget()) record.setDestroyedByAssociation(reflection);
                return destroyAll();
            }
            case DELETE_ALL -> {
                int deleted = scope().deleteAll();
                Logging.deepInfo(() -> "Deleted " + deleted + " dependent record(s) of " + reflection);
                reset();
            }
        }
        return true;
    }

    /**
     * Saves the members along with their owner: every member when the owner was just inserted,
     * else only the unsaved ones.
     *
     * @param ownerWasNew whether the owner was inserted by the current save
     * @return false when a member could not be saved
     */
    public boolean saveTargets(boolean ownerWasNew) {
        AssociationState<T> state = owner.associationCache().peek(reflection.name());
        if (state == null || state.target().isEmpty()) return true;

        boolean result = true;
        for (T record : new ArrayList<>(state.target())) {
            if (record.isDestroyed()) continue;
            if (ownerWasNew || record.isNewRecord()) result &= insertRecord(record, false);
        }
        if (ownerWasNew && result && state.loadState() == LoadState.LOADED) state.loaded(staleStateValue());
        return result;
    }

    /**
     * Validates the unsaved members.
     *
     * @return false when one of them is invalid
     */
    public boolean validateTargets() {
        AssociationState<T> state = owner.associationCache().peek(reflection.name());
        if (state == null) return true;

        boolean valid = true;
        for (T record : state.target()) {
            if (record.isNewRecord() && !record.isValid()) valid = false;
        }
        return valid;
    }

    @Override
    protected boolean insertRecord(@NotNull T record, boolean raise) {
        record.writeAttribute(reflection.foreignKey(), owner.getId());
        setInverseInstance(record);

        if (raise) {
            record.saveOrThrow();
            return true;
        }
        return record.save();
    }

    @Override
    protected boolean deleteRecords(@NotNull List<T> records, @NotNull RemovalPolicy policy) {
        if (policy == RemovalPolicy.DESTROY) {
            for (T record : records) {
                if (!record.destroy()) return false;
            }
            return true;
        }

        List<Object> ids = new ArrayList<>(records.size());
        for (T record : records) ids.add(record.getId());
        Scope<T> scope = scope().whereIn(primaryKeyName(), ids);

        if (policy == RemovalPolicy.DELETE) {
            scope.deleteAll();
        } else {
            scope.updateAll(Collections.singletonMap(reflection.foreignKey(), null));
            for (T record : records) record.writeAttribute(reflection.foreignKey(), null);
        }
        return true;
    }

    @Override
    protected int deleteOrNullifyAll(@NotNull RemovalPolicy policy) {
        if (policy == RemovalPolicy.NULLIFY) {
            return scope().updateAll(Collections.singletonMap(reflection.foreignKey(), null));
        }
        return scope().deleteAll();
    }

    @Override
    protected @NotNull List<SelectOption> scopeFilters() {
        return List.of(new SelectOption(reflection.foreignKey(), "=", owner.getId()));
    }

    @Override
    protected @Nullable Object staleStateValue() {
        return owner.getId();
    }

    @Override
    protected boolean foreignKeyPresent() {
        return false;
    }
}
