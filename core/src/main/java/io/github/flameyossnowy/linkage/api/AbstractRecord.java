package io.github.flameyossnowy.linkage.api;

import io.github.flameyossnowy.linkage.api.associations.Association;
import io.github.flameyossnowy.linkage.api.associations.AssociationCache;
import io.github.flameyossnowy.linkage.api.associations.BelongsToAssociation;
import io.github.flameyossnowy.linkage.api.associations.CollectionProxy;
import io.github.flameyossnowy.linkage.api.associations.HasManyAssociation;
import io.github.flameyossnowy.linkage.api.associations.builder.AccessorTable;
import io.github.flameyossnowy.linkage.api.exceptions.RecordInvalidException;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotSavedException;
import io.github.flameyossnowy.linkage.api.reflect.AssociationKind;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import io.github.flameyossnowy.linkage.api.reflect.ReflectionRegistry;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for entities.
 * <p>
 * Attributes live in an ordered map, associations are declared in a static initializer:
 * <pre>{@code
 * public class Author extends AbstractRecord {
 *     static {
 *         Associations.hasMany(Author.class, "books", Map.of("dependent", "destroy"));
 *     }
 *
 *     public CollectionProxy<Book> books() {
 *         return collection("books");
 *     }
 * }
 * }</pre>
 */
public abstract class AbstractRecord implements Record {
    private final Map<String, Object> attributes = new LinkedHashMap<>(8);
    private final Map<String, Object> attributesView = Collections.unmodifiableMap(attributes);
    private final Errors errors = new Errors();
    private final AssociationCache associationCache = new AssociationCache();

    private boolean newRecord = true;
    private boolean destroyed;
    private Reflection destroyedByAssociation;

    protected AbstractRecord() {
        attributes.put(PRIMARY_KEY, null);
    }

    /**
     * Adds the validation errors of this record, nothing by default.
     *
     * @param errors the errors to add to
     */
    protected void validate(@NotNull Errors errors) {
    }

    @Override
    public @Nullable Object getId() {
        return attributes.get(PRIMARY_KEY);
    }

    public void setId(@Nullable Object id) {
        attributes.put(PRIMARY_KEY, id);
    }

    @Override
    public boolean isNewRecord() {
        return newRecord;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public @Nullable Object readAttribute(@NotNull String name) {
        return attributes.get(name);
    }

    @Override
    public void writeAttribute(@NotNull String name, @Nullable Object value) {
        attributes.put(name, value);
    }

    @Override
    public @Unmodifiable Map<String, Object> attributes() {
        return attributesView;
    }

    @Override
    public @NotNull Errors getErrors() {
        return errors;
    }

    @Override
    public boolean isValid() {
        errors.clear();
        validate(errors);

        for (Reflection reflection : ReflectionRegistry.reflectOnAllAssociations(getClass(), AssociationKind.TO_MANY)) {
            HasManyAssociation<?> association = (HasManyAssociation<?>) association(reflection.name());
            if (!association.validateTargets()) {
                errors.add(reflection.name(), "is invalid");
            }
        }
        return errors.isEmpty();
    }

    @Override
    public boolean save() {
        if (destroyed) {
            throw new RecordNotSavedException("Cannot save a destroyed " + getClass().getSimpleName(), this);
        }
        if (!isValid()) {
            Logging.deepInfo(() -> "Not saving " + this + ": " + errors.fullMessages());
            return false;
        }

        RepositoryAdapter<Record, Object, ?> adapter = RepositoryRegistry.require(getClass());
        return adapter.runAtomically(() -> createOrUpdate(adapter));
    }

    private boolean createOrUpdate(RepositoryAdapter<Record, Object, ?> adapter) {
        for (Reflection reflection : ReflectionRegistry.reflectOnAllAssociations(getClass(), AssociationKind.TO_ONE)) {
            BelongsToAssociation<?> association = (BelongsToAssociation<?>) association(reflection.name());
            if (!association.saveTarget()) {
                errors.add(reflection.name(), "could not be saved");
                return false;
            }
        }

        boolean wasNew = newRecord;
        if (wasNew) {
            adapter.insert(this).expect("Failed to insert " + this);
        } else {
            adapter.update(this).expect("Failed to update " + this);
        }

        for (Reflection reflection : ReflectionRegistry.reflectOnAllAssociations(getClass(), AssociationKind.TO_MANY)) {
            HasManyAssociation<?> association = (HasManyAssociation<?>) association(reflection.name());
            if (!association.saveTargets(wasNew)) {
                errors.add(reflection.name(), "could not be saved");
                return false;
            }
        }
        return true;
    }

    @Override
    public void saveOrThrow() {
        if (!save()) throw new RecordInvalidException(this);
    }

    @Override
    public boolean destroy() {
        if (destroyed) return true;
        if (newRecord) {
            destroyed = true;
            return true;
        }

        RepositoryAdapter<Record, Object, ?> adapter = RepositoryRegistry.require(getClass());
        return adapter.runAtomically(() -> {
            for (Reflection reflection : ReflectionRegistry.reflectOnAllAssociations(getClass(), AssociationKind.TO_MANY)) {
                if (reflection.dependent().isEmpty()) continue;

                HasManyAssociation<?> association = (HasManyAssociation<?>) association(reflection.name());
                if (!association.handleDependency()) return false;
            }

            adapter.delete(this).expect("Failed to delete " + this);
            return true;
        });
    }

    /**
     * Returns the runtime of the association declared under {@code name}.
     *
     * @param name the association name
     * @return a runtime bound to this record
     * @throws io.github.flameyossnowy.linkage.api.exceptions.ConfigurationException if no such association is declared
     */
    public @NotNull Association<?> association(@NotNull String name) {
        return Association.of(this, name);
    }

    /**
     * Reads an association or attribute through the accessor table of this type.
     */
    public @Nullable Object read(@NotNull String name) {
        return AccessorTable.of(getClass()).read(this, name);
    }

    /**
     * Writes an association or attribute through the accessor table of this type.
     */
    public void write(@NotNull String name, @Nullable Object value) {
        AccessorTable.of(getClass()).write(this, name, value);
    }

    @SuppressWarnings("unchecked")
    protected <T extends Record> CollectionProxy<T> collection(@NotNull String name) {
        return (CollectionProxy<T>) read(name);
    }

    @SuppressWarnings("unchecked")
    protected <T extends Record> @Nullable T reference(@NotNull String name) {
        return (T) read(name);
    }

    @Override
    public @NotNull AssociationCache associationCache() {
        return associationCache;
    }

    @Override
    public @Nullable Reflection getDestroyedByAssociation() {
        return destroyedByAssociation;
    }

    @Override
    public void setDestroyedByAssociation(@Nullable Reflection reflection) {
        this.destroyedByAssociation = reflection;
    }

    @Override
    @ApiStatus.Internal
    public void hydrate(@NotNull Map<String, Object> stored) {
        attributes.clear();
        attributes.put(PRIMARY_KEY, null);
        attributes.putAll(stored);
        markPersisted();
    }

    @Override
    @ApiStatus.Internal
    public void markPersisted() {
        newRecord = false;
        destroyed = false;
    }

    @Override
    @ApiStatus.Internal
    public void markDestroyed() {
        destroyed = true;
    }

    @Override
    @ApiStatus.Internal
    public void restoreTransactionState(boolean newRecord, boolean destroyed, @Nullable Object id) {
        this.newRecord = newRecord;
        this.destroyed = destroyed;
        attributes.put(PRIMARY_KEY, id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        AbstractRecord other = (AbstractRecord) o;
        Object id = getId();
        return id != null && !newRecord && !other.newRecord && id.equals(other.getId());
    }

    @Override
    public int hashCode() {
        Object id = getId();
        return id != null && !newRecord ? Objects.hash(getClass(), id) : System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + attributes;
    }
}
