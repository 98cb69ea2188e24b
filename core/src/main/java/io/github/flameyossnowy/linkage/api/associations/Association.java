package io.github.flameyossnowy.linkage.api.associations;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.RepositoryAdapter;
import io.github.flameyossnowy.linkage.api.RepositoryRegistry;
import io.github.flameyossnowy.linkage.api.exceptions.ConfigurationException;
import io.github.flameyossnowy.linkage.api.exceptions.TypeMismatchException;
import io.github.flameyossnowy.linkage.api.options.SelectOption;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import io.github.flameyossnowy.linkage.api.reflect.ReflectionRegistry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Runtime of one relationship bound to one owner instance.
 * <p>
 * Runtimes are created on every access and hold nothing themselves: the target and its load
 * state live in the owner's {@link AssociationCache}, so two runtimes for the same owner and
 * name always agree.
 *
 * @param <T> the related record type
 * @author FlameyosFlow
 */
public abstract sealed class Association<T extends Record> permits BelongsToAssociation, CollectionAssociation {
    protected final Record owner;
    protected final Reflection reflection;

    protected Association(@NotNull Record owner, @NotNull Reflection reflection) {
        this.owner = owner;
        this.reflection = reflection;
    }

    /**
     * Looks up the relationship declared under {@code name} on the owner's type and binds it.
     *
     * @param owner the owning record
     * @param name the relationship name
     * @return the runtime
     * @throws ConfigurationException if the type declares no such relationship
     */
    public static @NotNull Association<?> of(@NotNull Record owner, @NotNull String name) {
        Reflection reflection = ReflectionRegistry.reflectOnAssociation(owner.getClass(), name);
        if (reflection == null) {
            throw new ConfigurationException("Association named '" + name + "' was not found on "
                + owner.getClass().getSimpleName() + ", perhaps you misspelled it?");
        }
        return reflection.kind().create(owner, reflection);
    }

    public @NotNull Record owner() {
        return owner;
    }

    public @NotNull Reflection reflection() {
        return reflection;
    }

    /**
     * Reads the association the way its generated reader would.
     *
     * @param forceReload whether to discard the cached target first
     * @return the proxy of a collection, or the single related record
     */
    public abstract @Nullable Object read(boolean forceReload);

    /**
     * Writes the association the way its generated writer would.
     *
     * @param value the records, or the single record, to associate
     */
    public abstract void write(@Nullable Object value);

    /**
     * Forgets the target without touching storage.
     */
    public void reset() {
        state().reset();
    }

    /**
     * Forgets the target and loads it again.
     */
    public abstract void reload();

    public boolean isLoaded() {
        return state().loadState() == LoadState.LOADED;
    }

    public @NotNull LoadState loadState() {
        return state().loadState();
    }

    /**
     * @return whether the target was loaded for a linking value that has changed since
     */
    public boolean isStale() {
        return state().refresh(staleStateValue()) == LoadState.STALE;
    }

    /**
     * @return every related record, as a deferred query
     */
    public @NotNull Scope<T> scope() {
        Scope<T> scope = Scope.where(relatedAdapter(), scopeFilters());
        return nullScope() ? scope.none() : scope;
    }

    protected @NotNull AssociationState<T> state() {
        return owner.associationCache().state(reflection.name());
    }

    protected @NotNull RepositoryAdapter<T, Object, ?> relatedAdapter() {
        return RepositoryRegistry.require(relatedType());
    }

    @SuppressWarnings("unchecked")
    protected @NotNull Class<T> relatedType() {
        return (Class<T>) reflection.relatedType();
    }

    protected abstract @NotNull List<SelectOption> scopeFilters();

    /**
     * @return the value that links owner and target: the owner identity or the owner foreign key
     */
    protected abstract @Nullable Object staleStateValue();

    protected abstract boolean foreignKeyPresent();

    protected boolean nullScope() {
        return owner.isNewRecord() && !foreignKeyPresent();
    }

    protected boolean findTargetWarranted() {
        return !isLoaded() && (!owner.isNewRecord() || foreignKeyPresent());
    }

    protected void raiseOnTypeMismatch(@Nullable Object record) {
        if (!relatedType().isInstance(record)) {
            throw new TypeMismatchException(relatedType(), record);
        }
    }

    protected @NotNull String primaryKeyName() {
        return relatedAdapter().getPrimaryKeyName();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '[' + reflection + ", " + loadState() + ']';
    }
}
