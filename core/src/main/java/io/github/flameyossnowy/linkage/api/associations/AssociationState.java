package io.github.flameyossnowy.linkage.api.associations;

import io.github.flameyossnowy.linkage.api.Record;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * The part of an association that outlives a single access: target, load state and the
 * linking value captured when the target was loaded.
 */
@ApiStatus.Internal
public final class AssociationState<T extends Record> {
    private final List<T> target = new ArrayList<>(4);
    private LoadState loadState = LoadState.NOT_LOADED;
    private Object snapshot;
    private CollectionProxy<T> proxy;

    public @NotNull List<T> target() {
        return target;
    }

    public @Nullable T single() {
        return target.isEmpty() ? null : target.get(0);
    }

    public void replaceTarget(@NotNull Collection<? extends T> records) {
        target.clear();
        target.addAll(records);
    }

    public @NotNull LoadState loadState() {
        return loadState;
    }

    public void loaded(@Nullable Object linkingValue) {
        loadState = loadState.on(LoadState.Transition.LOAD);
        snapshot = linkingValue;
    }

    public void reset() {
        target.clear();
        loadState = loadState.on(LoadState.Transition.RESET);
        snapshot = null;
    }

    /**
     * Compares the current linking value with the one captured at load time.
     *
     * @param linkingValue the current value
     * @return the load state after the comparison
     */
    public @NotNull LoadState refresh(@Nullable Object linkingValue) {
        if (loadState == LoadState.LOADED && !Objects.equals(snapshot, linkingValue)) {
            loadState = loadState.on(LoadState.Transition.KEY_CHANGED);
        }
        return loadState;
    }

    @Nullable CollectionProxy<T> proxy() {
        return proxy;
    }

    void proxy(@NotNull CollectionProxy<T> proxy) {
        this.proxy = proxy;
    }
}
