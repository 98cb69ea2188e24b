package io.github.flameyossnowy.linkage.api.associations.builder;

import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Entry point for declaring relationships, meant to be called from a static initializer
 * of the owner type.
 * <pre>{@code
 * static {
 *     Associations.hasMany(Author.class, "books", Map.of("dependent", "destroy"));
 *     Associations.belongsTo(Author.class, "publisher");
 * }
 * }</pre>
 */
public final class Associations {
    private Associations() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static @NotNull Reflection hasMany(@NotNull Class<?> ownerType, @NotNull String name) {
        return hasMany(ownerType, name, Map.of());
    }

    public static @NotNull Reflection hasMany(@NotNull Class<?> ownerType, @NotNull String name, @NotNull Map<String, ?> options) {
        return new HasManyBuilder(ownerType, name, options).build();
    }

    public static @NotNull Reflection belongsTo(@NotNull Class<?> ownerType, @NotNull String name) {
        return belongsTo(ownerType, name, Map.of());
    }

    public static @NotNull Reflection belongsTo(@NotNull Class<?> ownerType, @NotNull String name, @NotNull Map<String, ?> options) {
        return new BelongsToBuilder(ownerType, name, options).build();
    }

    /**
     * Same as {@link #belongsTo(Class, String, Map)}.
     */
    public static @NotNull Reflection hasOne(@NotNull Class<?> ownerType, @NotNull String name, @NotNull Map<String, ?> options) {
        return belongsTo(ownerType, name, options);
    }

    public static @NotNull Reflection hasOne(@NotNull Class<?> ownerType, @NotNull String name) {
        return belongsTo(ownerType, name, Map.of());
    }
}
