package io.github.flameyossnowy.linkage.api.associations;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.AbstractList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * The {@link List} returned by a has-many reader.
 * <p>
 * Every call is forwarded to the association of its owner, so a proxy held across mutations
 * and reloads always reflects the current target. Reads that need the members load them,
 * {@link #size()}, {@link #isEmpty()} and {@link #contains(Object)} avoid it when they can.
 */
public class CollectionProxy<T extends Record> extends AbstractList<T> {
    private final Reflection reflection;
    private final Record owner;

    public CollectionProxy(@NotNull Reflection reflection, @NotNull Record owner) {
        this.reflection = reflection;
        this.owner = owner;
    }

    /**
     * @return the association this proxy forwards to, reloaded first when its linking value changed
     */
    @SuppressWarnings("unchecked")
    public @NotNull CollectionAssociation<T> getAssociation() {
        CollectionAssociation<T> association = (CollectionAssociation<T>) reflection.kind().create(owner, reflection);
        if (association.isStale()) association.reload();
        return association;
    }

    public @NotNull List<T> loadTarget() {
        return getAssociation().loadTarget();
    }

    @Override
    public T get(int index) {
        return loadTarget().get(index);
    }

    @Override
    public int size() {
        return getAssociation().size();
    }

    @Override
    public boolean isEmpty() {
        return getAssociation().isEmpty();
    }

    @Override
    public boolean contains(Object o) {
        return getAssociation().include(o);
    }

    @Override
    public @NotNull Iterator<T> iterator() {
        return List.copyOf(loadTarget()).iterator();
    }

    @Override
    public @NotNull Object @NotNull [] toArray() {
        return loadTarget().toArray();
    }

    @Override
    public @NotNull <D> D @NotNull [] toArray(@NotNull D @NotNull [] a) {
        return loadTarget().toArray(a);
    }

    @Override
    public int indexOf(Object o) {
        return loadTarget().indexOf(o);
    }

    @Override
    public int lastIndexOf(Object o) {
        return loadTarget().lastIndexOf(o);
    }

    /**
     * Same as {@link #concat(Object...)} with one record.
     */
    @Override
    public boolean add(T record) {
        return getAssociation().concat(record);
    }

    @Override
    public boolean addAll(@NotNull Collection<? extends T> records) {
        return getAssociation().concat(records);
    }

    /**
     * Removes the record following the removal policy of the association.
     */
    @Override
    public boolean remove(Object o) {
        CollectionAssociation<T> association = getAssociation();
        if (!association.include(o)) return false;

        return association.delete(o);
    }

    @Override
    public boolean removeAll(@NotNull Collection<?> records) {
        boolean removed = false;
        for (Object record : records) removed |= remove(record);
        return removed;
    }

    @Override
    public void clear() {
        getAssociation().clear();
    }

    public boolean concat(@NotNull Object... records) {
        return getAssociation().concat(records);
    }

    public @NotNull T build(@NotNull Map<String, ?> attributes) {
        return getAssociation().build(attributes);
    }

    public @NotNull T build(@NotNull Map<String, ?> attributes, @Nullable Consumer<? super T> initializer) {
        return getAssociation().build(attributes, initializer);
    }

    public @NotNull List<T> build(@NotNull List<? extends Map<String, ?>> attributes) {
        return getAssociation().build(attributes);
    }

    public @NotNull T create(@NotNull Map<String, ?> attributes) {
        return getAssociation().create(attributes);
    }

    public @NotNull T create(@NotNull Map<String, ?> attributes, @Nullable Consumer<? super T> initializer) {
        return getAssociation().create(attributes, initializer);
    }

    public @NotNull List<T> create(@NotNull List<? extends Map<String, ?>> attributes) {
        return getAssociation().create(attributes);
    }

    public @NotNull T createOrThrow(@NotNull Map<String, ?> attributes) {
        return getAssociation().createOrThrow(attributes);
    }

    public @NotNull List<T> createOrThrow(@NotNull List<? extends Map<String, ?>> attributes) {
        return getAssociation().createOrThrow(attributes);
    }

    public boolean delete(@NotNull Object... records) {
        return getAssociation().delete(records);
    }

    public boolean destroy(@NotNull Object... records) {
        return getAssociation().destroy(records);
    }

    public void deleteAll() {
        getAssociation().deleteAll();
    }

    public boolean destroyAll() {
        return getAssociation().destroyAll();
    }

    public void replace(@NotNull Collection<?> records) {
        getAssociation().replace(records);
    }

    public @NotNull List<Object> ids() {
        return getAssociation().idsReader();
    }

    public void setIds(@Nullable Object ids) {
        getAssociation().idsWriter(ids);
    }

    public boolean anyMatch(@NotNull Predicate<? super T> predicate) {
        return getAssociation().any(predicate);
    }

    public boolean isMany() {
        return getAssociation().many();
    }

    public boolean isMany(@NotNull Predicate<? super T> predicate) {
        return getAssociation().many(predicate);
    }

    public @NotNull List<T> select(@NotNull Predicate<? super T> predicate) {
        return getAssociation().select(predicate);
    }

    public @NotNull List<Map<String, Object>> select(@NotNull String... fields) {
        return getAssociation().select(fields);
    }

    public @Nullable T first() {
        return getAssociation().first();
    }

    public @Nullable T last() {
        return getAssociation().last();
    }

    public @NotNull Scope<T> scope() {
        return getAssociation().scope();
    }

    public boolean isLoaded() {
        return getAssociation().isLoaded();
    }

    /**
     * Forgets the loaded members, storage is not touched.
     */
    public @NotNull CollectionProxy<T> reset() {
        getAssociation().reset();
        return this;
    }

    public @NotNull CollectionProxy<T> reload() {
        getAssociation().reload();
        return this;
    }

    @Override
    public String toString() {
        return loadTarget().toString();
    }
}
