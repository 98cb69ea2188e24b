package io.github.flameyossnowy.linkage.api.associations;

import io.github.flameyossnowy.linkage.api.Record;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Association states of one owner instance, keyed by association name.
 */
@ApiStatus.Internal
public final class AssociationCache {
    private final Map<String, AssociationState<?>> states = new HashMap<>(4);

    @SuppressWarnings("unchecked")
    public <T extends Record> @NotNull AssociationState<T> state(@NotNull String name) {
        return (AssociationState<T>) states.computeIfAbsent(name, k -> new AssociationState<>());
    }

    @SuppressWarnings("unchecked")
    public <T extends Record> @Nullable AssociationState<T> peek(@NotNull String name) {
        return (AssociationState<T>) states.get(name);
    }

    public void clear() {
        states.clear();
    }
}
