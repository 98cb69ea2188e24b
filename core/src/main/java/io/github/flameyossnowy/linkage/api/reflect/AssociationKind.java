package io.github.flameyossnowy.linkage.api.reflect;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.associations.Association;
import io.github.flameyossnowy.linkage.api.associations.BelongsToAssociation;
import io.github.flameyossnowy.linkage.api.associations.HasManyAssociation;
import org.jetbrains.annotations.NotNull;

/**
 * The closed set of relationship shapes. Each kind creates its own association runtime.
 */
public enum AssociationKind {
    TO_ONE {
        @Override
        public @NotNull Association<?> create(@NotNull Record owner, @NotNull Reflection reflection) {
            return new BelongsToAssociation<>(owner, reflection);
        }
    },
    TO_MANY {
        @Override
        public @NotNull Association<?> create(@NotNull Record owner, @NotNull Reflection reflection) {
            return new HasManyAssociation<>(owner, reflection);
        }
    };

    /**
     * Binds a runtime to the owner instance. Runtimes are cheap, the state they work on lives on the owner.
     *
     * @param owner the owning record
     * @param reflection a reflection of this kind
     * @return the runtime
     */
    public abstract @NotNull Association<?> create(@NotNull Record owner, @NotNull Reflection reflection);
}
