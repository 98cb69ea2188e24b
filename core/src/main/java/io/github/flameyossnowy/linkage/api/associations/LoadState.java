package io.github.flameyossnowy.linkage.api.associations;

import org.jetbrains.annotations.NotNull;

/**
 * Load state of an association target.
 * <pre>
 * NOT_LOADED --LOAD--> LOADED --KEY_CHANGED--> STALE --LOAD--> LOADED
 * any --RESET--> NOT_LOADED
 * </pre>
 */
public enum LoadState {
    NOT_LOADED,
    LOADED,
    STALE;

    public enum Transition {
        LOAD,
        RESET,
        KEY_CHANGED
    }

    public @NotNull LoadState on(@NotNull Transition transition) {
        return switch (transition) {
            case LOAD -> LOADED;
            case RESET -> NOT_LOADED;
            case KEY_CHANGED -> this == LOADED ? STALE : this;
        };
    }
}
