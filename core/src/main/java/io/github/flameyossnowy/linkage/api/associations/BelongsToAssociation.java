package io.github.flameyossnowy.linkage.api.associations;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.options.SelectOption;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A to-one association: the owner holds the foreign key of its target.
 */
public final class BelongsToAssociation<T extends Record> extends Association<T> {
    public BelongsToAssociation(@NotNull Record owner, @NotNull Reflection reflection) {
        super(owner, reflection);
    }

    @Override
    public @Nullable T read(boolean forceReload) {
        return reader(forceReload);
    }

    @Override
    public void write(@Nullable Object value) {
        raiseOnTypeMismatchUnlessNull(value);
        writer(relatedType().cast(value));
    }

    public @Nullable T reader() {
        return reader(false);
    }

    public @Nullable T reader(boolean forceReload) {
        if (forceReload) reset();
        return loadTarget();
    }

    /**
     * Sets the target and copies its identity into the owner's foreign key.
     *
     * @param record the new target, null to unlink
     */
    public void writer(@Nullable T record) {
        raiseOnTypeMismatchUnlessNull(record);
        owner.writeAttribute(reflection.foreignKey(), record == null ? null : record.getId());
        target(record);
    }

    /**
     * Loads the target when it has not been loaded yet or its foreign key changed.
     *
     * @return the target, null when the owner has no foreign key
     */
    public @Nullable T loadTarget() {
        AssociationState<T> state = state();
        if (isStale()) state.reset();

        if (findTargetWarranted()) {
            List<T> found = scope().limit(1).toList();
            Logging.deepInfo(() -> "Loaded " + reflection + ": " + found);
            state.replaceTarget(found);
        }
        state.loaded(staleStateValue());
        return state.single();
    }

    @Override
    public void reload() {
        reset();
        loadTarget();
    }

    /**
     * Builds an unsaved target and links it.
     *
     * @param attributes the attributes of the new record
     * @return the new record
     */
    public @NotNull T build(@NotNull Map<String, ?> attributes) {
        T record = relatedAdapter().instantiate();
        attributes.forEach(record::writeAttribute);
        writer(record);
        return record;
    }

    /**
     * Builds, saves and links a target.
     *
     * @param attributes the attributes of the new record
     * @return the new record, carrying its errors when it could not be saved
     */
    public @NotNull T create(@NotNull Map<String, ?> attributes) {
        T record = build(attributes);
        if (record.save()) writer(record);
        return record;
    }

    /**
     * Same as {@link #create(Map)} but raises when the record could not be saved.
     *
     * @throws io.github.flameyossnowy.linkage.api.exceptions.RecordInvalidException if validation failed
     */
    public @NotNull T createOrThrow(@NotNull Map<String, ?> attributes) {
        T record = build(attributes);
        record.saveOrThrow();
        writer(record);
        return record;
    }

    /**
     * Links the target without a query and without touching the owner's foreign key.
     *
     * @param record the target
     */
    public void target(@Nullable T record) {
        AssociationState<T> state = state();
        state.replaceTarget(record == null ? List.of() : List.of(record));
        state.loaded(staleStateValue());
    }

    /**
     * Saves a new target before its owner is saved and copies its identity into the owner.
     *
     * @return false when the target could not be saved
     */
    public boolean saveTarget() {
        AssociationState<T> state = owner.associationCache().peek(reflection.name());
        T target = state == null ? null : state.single();
        if (target == null) return true;

        if (target.isNewRecord() && !target.save()) return false;
        if (target.isPersisted()) {
            owner.writeAttribute(reflection.foreignKey(), target.getId());
            state.loaded(staleStateValue());
        }
        return true;
    }

    @Override
    protected @NotNull List<SelectOption> scopeFilters() {
        return List.of(new SelectOption(primaryKeyName(), "=", owner.readAttribute(reflection.foreignKey())));
    }

    @Override
    protected @Nullable Object staleStateValue() {
        return owner.readAttribute(reflection.foreignKey());
    }

    @Override
    protected boolean foreignKeyPresent() {
        return owner.readAttribute(reflection.foreignKey()) != null;
    }

    @Override
    protected boolean nullScope() {
        return !foreignKeyPresent();
    }

    private void raiseOnTypeMismatchUnlessNull(@Nullable Object record) {
        if (record != null) raiseOnTypeMismatch(record);
    }
}
