package io.github.flameyossnowy.linkage.api;

import io.github.flameyossnowy.linkage.api.associations.AssociationCache;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;

import java.util.Map;

/**
 * A persistable entity that can own and be the target of associations.
 * <p>
 * Most entities extend {@link AbstractRecord} rather than implementing this directly.
 */
public interface Record {
    String PRIMARY_KEY = "id";

    @Nullable Object getId();

    /**
     * @return true until the record has been inserted
     */
    boolean isNewRecord();

    boolean isDestroyed();

    /**
     * @return whether the record exists in storage, that is, it is neither new nor destroyed
     */
    default boolean isPersisted() {
        return !isNewRecord() && !isDestroyed();
    }

    @Nullable Object readAttribute(@NotNull String name);

    void writeAttribute(@NotNull String name, @Nullable Object value);

    /**
     * @return an ordered view of every attribute, including the primary key
     */
    @Unmodifiable Map<String, Object> attributes();

    @NotNull Errors getErrors();

    /**
     * Clears and recomputes {@link #getErrors()}.
     *
     * @return whether no errors were found
     */
    boolean isValid();

    /**
     * Validates and persists the record together with its unsaved associated records.
     *
     * @return false when validation or an associated save failed
     */
    boolean save();

    /**
     * Same as {@link #save()} but raises instead of returning false.
     *
     * @throws io.github.flameyossnowy.linkage.api.exceptions.RecordInvalidException if validation failed
     */
    void saveOrThrow();

    /**
     * Deletes the record, applying the dependent policy of each of its has-many associations first.
     *
     * @return false when a dependent policy refused the deletion
     */
    boolean destroy();

    /**
     * @return the per-instance store of association state
     */
    @ApiStatus.Internal
    @NotNull AssociationCache associationCache();

    /**
     * @return the reflection whose cascade is destroying this record, if any
     */
    @Nullable Reflection getDestroyedByAssociation();

    void setDestroyedByAssociation(@Nullable Reflection reflection);

    /**
     * Replaces every attribute with the stored ones and marks the record persisted.
     */
    @ApiStatus.Internal
    void hydrate(@NotNull Map<String, Object> attributes);

    @ApiStatus.Internal
    void markPersisted();

    @ApiStatus.Internal
    void markDestroyed();

    /**
     * Puts the record back into the state it had when a rolled back transaction first touched it.
     */
    @ApiStatus.Internal
    void restoreTransactionState(boolean newRecord, boolean destroyed, @Nullable Object id);
}
