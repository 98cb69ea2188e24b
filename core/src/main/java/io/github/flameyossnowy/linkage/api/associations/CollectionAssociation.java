package io.github.flameyossnowy.linkage.api.associations;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.RepositoryAdapter;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotSavedException;
import io.github.flameyossnowy.linkage.api.reflect.AssociationKind;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import io.github.flameyossnowy.linkage.api.reflect.ReflectionRegistry;
import io.github.flameyossnowy.linkage.api.utils.IdentityKeys;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A to-many association.
 * <p>
 * The target list mixes records loaded from storage with records added in memory. Unsaved
 * records survive loading: the fetched records are merged into the list, in fetch order,
 * and the in-memory ones that storage does not know about are kept after them.
 *
 * @param <T> the related record type
 */
public abstract sealed class CollectionAssociation<T extends Record> extends Association<T> permits HasManyAssociation {
    protected CollectionAssociation(@NotNull Record owner, @NotNull Reflection reflection) {
        super(owner, reflection);
    }

    @Override
    public @NotNull CollectionProxy<T> read(boolean forceReload) {
        return reader(forceReload);
    }

    @Override
    public void write(@Nullable Object value) {
        writer(value == null ? List.of() : IdentityKeys.flatten(value));
    }

    public @NotNull CollectionProxy<T> reader() {
        return reader(false);
    }

    /**
     * @param forceReload whether to discard the cached target first
     * @return the proxy of this association, the same instance on every call
     */
    public @NotNull CollectionProxy<T> reader(boolean forceReload) {
        if (forceReload || isStale()) reload();

        AssociationState<T> state = state();
        CollectionProxy<T> proxy = state.proxy();
        if (proxy == null) {
            proxy = new CollectionProxy<>(reflection, owner);
            state.proxy(proxy);
        }
        return proxy;
    }

    /**
     * Replaces the members with {@code records}.
     */
    public void writer(@NotNull Collection<?> records) {
        replace(records);
    }

    /**
     * @return the identity keys of the members, without materialising records when not loaded
     */
    public @NotNull List<Object> idsReader() {
        if (isLoaded()) {
            List<T> target = state().target();
            List<Object> ids = new ArrayList<>(target.size());
            for (T record : target) ids.add(record.getId());
            return ids;
        }
        return scope().pluck(primaryKeyName());
    }

    /**
     * Replaces the members with the records identified by {@code ids}, in the given order.
     * Blank keys are dropped, duplicates keep their first position.
     *
     * @param ids a key, or a collection or array of keys, possibly nested
     * @throws RecordNotFoundException if some keys match no record
     */
    public void idsWriter(@Nullable Object ids) {
        RepositoryAdapter<T, Object, ?> adapter = relatedAdapter();
        List<Object> keys = IdentityKeys.normalize(ids, adapter.getIdType());

        List<T> found = keys.isEmpty() ? List.of() : adapter.findAllById(keys);
        Map<Object, T> byId = new HashMap<>(found.size());
        for (T record : found) byId.put(record.getId(), record);

        List<T> ordered = new ArrayList<>(keys.size());
        List<Object> missing = new ArrayList<>(0);
        for (Object key : keys) {
            T record = byId.get(key);
            if (record == null) missing.add(key);
            else ordered.add(record);
        }

        if (!missing.isEmpty()) throw new RecordNotFoundException(relatedType(), missing);
        replace(ordered);
    }

    /**
     * Projects attributes of the members straight from storage.
     */
    public @NotNull List<Map<String, Object>> select(@NotNull String... fields) {
        return scope().select(fields);
    }

    /**
     * Filters the loaded members in memory.
     */
    public @NotNull List<T> select(@NotNull Predicate<? super T> predicate) {
        List<T> selected = new ArrayList<>();
        for (T record : loadTarget()) {
            if (predicate.test(record)) selected.add(record);
        }
        return selected;
    }

    public @Nullable T first() {
        List<T> target = loadTarget();
        return target.isEmpty() ? null : target.get(0);
    }

    public @Nullable T last() {
        List<T> target = loadTarget();
        return target.isEmpty() ? null : target.get(target.size() - 1);
    }

    public @NotNull T build(@NotNull Map<String, ?> attributes) {
        return build(attributes, null);
    }

    /**
     * Builds an unsaved member carrying the foreign key of the owner.
     *
     * @param attributes the attributes of the new record
     * @param initializer called with the record before it is added
     * @return the new record
     */
    public @NotNull T build(@NotNull Map<String, ?> attributes, @Nullable Consumer<? super T> initializer) {
        T record = buildRecord(attributes);
        if (initializer != null) initializer.accept(record);
        return addToTarget(record);
    }

    public @NotNull List<T> build(@NotNull List<? extends Map<String, ?>> attributes) {
        List<T> records = new ArrayList<>(attributes.size());
        for (Map<String, ?> each : attributes) records.add(build(each, null));
        return records;
    }

    /**
     * Builds and saves a member.
     *
     * @param attributes the attributes of the new record
     * @return the record, carrying its errors when it could not be saved
     * @throws RecordNotSavedException if the owner is not saved
     */
    public @NotNull T create(@NotNull Map<String, ?> attributes) {
        return create(attributes, null);
    }

    public @NotNull T create(@NotNull Map<String, ?> attributes, @Nullable Consumer<? super T> initializer) {
        requirePersistedOwner();
        return createRecord(attributes, initializer, false);
    }

    public @NotNull List<T> create(@NotNull List<? extends Map<String, ?>> attributes) {
        requirePersistedOwner();
        List<T> records = new ArrayList<>(attributes.size());
        for (Map<String, ?> each : attributes) records.add(createRecord(each, null, false));
        return records;
    }

    /**
     * Same as {@link #create(Map)} but raises, and rolls the insertion back, when the record is invalid.
     *
     * @throws io.github.flameyossnowy.linkage.api.exceptions.RecordInvalidException if validation failed
     */
    public @NotNull T createOrThrow(@NotNull Map<String, ?> attributes) {
        return createOrThrow(attributes, null);
    }

    public @NotNull T createOrThrow(@NotNull Map<String, ?> attributes, @Nullable Consumer<? super T> initializer) {
        requirePersistedOwner();
        return createRecord(attributes, initializer, true);
    }

    public @NotNull List<T> createOrThrow(@NotNull List<? extends Map<String, ?>> attributes) {
        requirePersistedOwner();
        List<T> records = new ArrayList<>(attributes.size());
        for (Map<String, ?> each : attributes) records.add(createRecord(each, null, true));
        return records;
    }

    private T createRecord(Map<String, ?> attributes, @Nullable Consumer<? super T> initializer, boolean raise) {
        return relatedAdapter().runInTransaction(() -> {
            T record = buildRecord(attributes);
            if (initializer != null) initializer.accept(record);
            insertRecord(record, raise);
            return addToTarget(record);
        });
    }

    private void requirePersistedOwner() {
        if (!owner.isPersisted()) {
            throw new RecordNotSavedException("You cannot call create unless the parent is saved", owner);
        }
    }

    /**
     * Adds records to the members. On a saved owner each record is linked and saved, in one transaction.
     *
     * @param records records, or collections or arrays of records
     * @return false when a record could not be saved, the transaction is then rolled back
     * @throws io.github.flameyossnowy.linkage.api.exceptions.TypeMismatchException if a record has the wrong type
     */
    public boolean concat(@NotNull Object... records) {
        List<Object> flat = IdentityKeys.flatten(records);
        if (owner.isNewRecord()) {
            loadTarget();
            return concatRecords(flat);
        }
        return relatedAdapter().runAtomically(() -> concatRecords(flat));
    }

    private boolean concatRecords(List<?> records) {
        boolean result = true;
        for (Object each : records) {
            raiseOnTypeMismatch(each);
            T record = relatedType().cast(each);
            addToTarget(record);
            if (!owner.isNewRecord()) result &= insertRecord(record, false);
        }
        return result;
    }

    /**
     * Makes the members exactly {@code others}, in that order.
     * On a saved owner, removed members go through the removal policy and new ones are saved.
     *
     * @param others the new members
     * @throws RecordNotSavedException if a new member could not be saved or a removed one could not be destroyed,
     *         the original target is restored
     */
    public void replace(@NotNull Collection<?> others) {
        List<T> records = new ArrayList<>(others.size());
        for (Object each : others) {
            raiseOnTypeMismatch(each);
            records.add(relatedType().cast(each));
        }

        List<T> original = new ArrayList<>(loadTarget());
        if (owner.isNewRecord()) {
            replaceRecords(records, original);
        } else if (!records.equals(original)) {
            relatedAdapter().runInTransaction(() -> {
                replaceRecords(records, original);
                return null;
            });
        }
    }

    private void replaceRecords(List<T> records, List<T> original) {
        List<T> removed = new ArrayList<>(original);
        removed.removeAll(records);
        if (!deleteOrDestroy(removed, removalPolicy())) {
            state().replaceTarget(original);
            throw new RecordNotSavedException("Failed to replace " + reflection.name()
                + " because one or more of the removed records could not be destroyed.", owner);
        }

        List<T> added = new ArrayList<>(records);
        added.removeAll(original);
        if (!concatRecords(added)) {
            state().replaceTarget(original);
            throw new RecordNotSavedException("Failed to replace " + reflection.name()
                + " because one or more of the new records could not be saved.", owner);
        }
        state().replaceTarget(records);
    }

    /**
     * Removes the records following the removal policy of this association.
     *
     * @return false when a member refused to be destroyed, nothing is removed then
     */
    public boolean delete(@NotNull Object... records) {
        return deleteOrDestroy(castAll(IdentityKeys.flatten(records)), removalPolicy());
    }

    /**
     * Removes and destroys the records, whatever the removal policy.
     *
     * @return false when a member refused to be destroyed, nothing is removed then
     */
    public boolean destroy(@NotNull Object... records) {
        return deleteOrDestroy(castAll(IdentityKeys.flatten(records)), RemovalPolicy.DESTROY);
    }

    /**
     * Removes every member straight through storage, deleting them when the association destroys
     * or deletes its members and unlinking them otherwise.
     */
    public void deleteAll() {
        RemovalPolicy policy = removalPolicy() == RemovalPolicy.NULLIFY ? RemovalPolicy.NULLIFY : RemovalPolicy.DELETE;
        int affected = deleteOrNullifyAll(policy);
        Logging.deepInfo(() -> "Removed " + affected + " record(s) of " + reflection + " with " + policy);
        resetLoaded();
    }

    /**
     * Loads and destroys every member.
     *
     * @return false when a member refused to be destroyed
     */
    public boolean destroyAll() {
        List<T> records = new ArrayList<>(loadTarget());
        boolean result = relatedAdapter().runAtomically(() -> {
            for (T record : records) {
                if (!record.destroy()) return false;
            }
            return true;
        });
        if (result) resetLoaded();
        return result;
    }

    /**
     * Empties the association following its removal policy.
     */
    public void clear() {
        if (removalPolicy() == RemovalPolicy.DESTROY) destroyAll();
        else deleteAll();
    }

    private void resetLoaded() {
        AssociationState<T> state = state();
        state.reset();
        state.loaded(staleStateValue());
    }

    private boolean deleteOrDestroy(List<T> records, RemovalPolicy policy) {
        if (records.isEmpty()) return true;

        List<T> existing = new ArrayList<>(records.size());
        for (T record : records) {
            if (!record.isNewRecord()) existing.add(record);
        }

        if (existing.isEmpty()) {
            removeFromTarget(records);
            return true;
        }

        boolean removed = relatedAdapter().runAtomically(() -> deleteRecords(existing, policy));
        if (removed) removeFromTarget(records);
        return removed;
    }

    private void removeFromTarget(List<T> records) {
        List<T> target = state().target();
        for (T record : records) removeIdentical(target, record);
    }

    private List<T> castAll(List<Object> records) {
        List<T> cast = new ArrayList<>(records.size());
        for (Object each : records) {
            raiseOnTypeMismatch(each);
            cast.add(relatedType().cast(each));
        }
        return cast;
    }

    public boolean isEmpty() {
        if (isLoaded()) return size() == 0;
        return !hasUnsavedTargets() && !scope().exists();
    }

    public boolean any() {
        return !isEmpty();
    }

    public boolean any(@NotNull Predicate<? super T> predicate) {
        for (T record : loadTarget()) {
            if (predicate.test(record)) return true;
        }
        return false;
    }

    /**
     * @return whether there is more than one member, loading the target
     */
    public boolean many() {
        return loadTarget().size() > 1;
    }

    public boolean many(@NotNull Predicate<? super T> predicate) {
        int matches = 0;
        for (T record : loadTarget()) {
            if (predicate.test(record) && ++matches > 1) return true;
        }
        return false;
    }

    /**
     * @return the target size when loaded, else the unsaved members plus a count query
     */
    public int size() {
        if (!findTargetWarranted()) return state().target().size();

        int unsaved = 0;
        for (T record : state().target()) {
            if (record.isNewRecord()) unsaved++;
        }
        return unsaved + Math.toIntExact(scope().count());
    }

    /**
     * Checks membership, unsaved records by identity and saved ones by key.
     *
     * @param record any object
     * @return false for an object of the wrong type, without querying
     */
    public boolean include(@Nullable Object record) {
        if (!relatedType().isInstance(record)) return false;

        T candidate = relatedType().cast(record);
        if (candidate.isNewRecord()) return indexOfIdentical(state().target(), candidate) >= 0;
        if (isLoaded()) return state().target().contains(candidate);
        return candidate.getId() != null && scope().existsBy(candidate.getId());
    }

    /**
     * @return a read-only view of the current target, without loading it
     */
    public @Unmodifiable @NotNull List<T> target() {
        return Collections.unmodifiableList(state().target());
    }

    /**
     * Loads the target when warranted and merges it with the in-memory members.
     *
     * @return a read-only view of the target
     */
    public @Unmodifiable @NotNull List<T> loadTarget() {
        AssociationState<T> state = state();
        if (isStale()) state.reset();

        if (findTargetWarranted()) {
            List<T> fetched = findTarget();
            state.replaceTarget(mergeTargetLists(fetched, state.target()));
        }
        state.loaded(staleStateValue());
        return Collections.unmodifiableList(state.target());
    }

    @Override
    public void reload() {
        reset();
        loadTarget();
    }

    protected @NotNull List<T> findTarget() {
        List<T> records = scope().toList();
        for (T record : records) setInverseInstance(record);
        Logging.deepInfo(() -> "Fetched " + records.size() + " record(s) for " + reflection);
        return records;
    }

    private List<T> mergeTargetLists(List<T> fetched, List<T> memory) {
        if (memory.isEmpty()) return new ArrayList<>(fetched);
        if (fetched.isEmpty()) return new ArrayList<>(memory);

        List<T> remaining = new ArrayList<>(memory);
        List<T> merged = new ArrayList<>(fetched.size() + remaining.size());
        for (T record : fetched) {
            int index = remaining.indexOf(record);
            merged.add(index >= 0 ? remaining.remove(index) : record);
        }
        merged.addAll(remaining);
        return merged;
    }

    protected @NotNull T buildRecord(@NotNull Map<String, ?> attributes) {
        T record = relatedAdapter().instantiate();
        scope().scopeForCreate().forEach(record::writeAttribute);
        attributes.forEach(record::writeAttribute);
        setInverseInstance(record);
        return record;
    }

    protected @NotNull T addToTarget(@NotNull T record) {
        List<T> target = state().target();
        int index = record.isNewRecord() ? indexOfIdentical(target, record) : target.indexOf(record);
        if (index >= 0) target.set(index, record);
        else target.add(record);
        return record;
    }

    private boolean hasUnsavedTargets() {
        for (T record : state().target()) {
            if (record.isNewRecord()) return true;
        }
        return false;
    }

    /**
     * Links the to-one side of the related record back to the owner, without a query.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    protected void setInverseInstance(@NotNull T record) {
        Reflection inverse = inverseReflection();
        if (inverse == null) return;

        BelongsToAssociation association = (BelongsToAssociation) inverse.kind().create(record, inverse);
        association.target(owner);
    }

    private @Nullable Reflection inverseReflection() {
        Class<? extends Record> relatedType = relatedType();
        String inverseName = reflection.inverseOf().orElse(null);
        if (inverseName != null) {
            Reflection inverse = ReflectionRegistry.reflectOnAssociation(relatedType, inverseName);
            return inverse != null && inverse.kind() == AssociationKind.TO_ONE ? inverse : null;
        }

        for (Reflection candidate : ReflectionRegistry.reflectOnAllAssociations(relatedType, AssociationKind.TO_ONE)) {
            if (candidate.relatedType().isInstance(owner)) return candidate;
        }
        return null;
    }

    /**
     * Links the record to the owner and saves it.
     *
     * @param record the member to save
     * @param raise whether a validation failure raises instead of returning false
     * @return whether the record was saved
     */
    protected abstract boolean insertRecord(@NotNull T record, boolean raise);

    /**
     * @return false when a record refused to be destroyed
     */
    protected abstract boolean deleteRecords(@NotNull List<T> records, @NotNull RemovalPolicy policy);

    protected abstract int deleteOrNullifyAll(@NotNull RemovalPolicy policy);

    protected @NotNull RemovalPolicy removalPolicy() {
        return reflection.dependent()
            .map(policy -> switch (policy) {
                case DESTROY -> RemovalPolicy.DESTROY;
                case DELETE_ALL -> RemovalPolicy.DELETE;
                default -> RemovalPolicy.NULLIFY;
            })
            .orElse(RemovalPolicy.NULLIFY);
    }

    static <R> int indexOfIdentical(List<R> list, R element) {
        for (int i = 0, size = list.size(); i < size; i++) {
            if (list.get(i) == element) return i;
        }
        return -1;
    }

    static <R> void removeIdentical(List<R> list, R element) {
        int index = indexOfIdentical(list, element);
        if (index < 0) index = list.indexOf(element);
        if (index >= 0) list.remove(index);
    }

    /**
     * How members leave the association.
     */
    public enum RemovalPolicy {
        DESTROY,
        DELETE,
        NULLIFY
    }
}
