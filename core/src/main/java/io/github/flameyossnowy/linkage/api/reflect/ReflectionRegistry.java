package io.github.flameyossnowy.linkage.api.reflect;

import io.github.flameyossnowy.linkage.api.exceptions.RepositoryException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-type registry of declared relationships.
 * <p>
 * Each type holds an immutable map. Declaring on a subtype copies the map of its nearest
 * registered ancestor, so parents never see their subtypes' relationships.
 */
public final class ReflectionRegistry {
    private static final Map<Class<?>, Map<String, Reflection>> REFLECTIONS = new ConcurrentHashMap<>(16);

    private ReflectionRegistry() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Adds a reflection to its owner type, replacing one declared under the same name.
     *
     * @param reflection the reflection to add
     */
    public static void add(@NotNull Reflection reflection) {
        Class<?> ownerType = reflection.ownerType();
        Map<String, Reflection> merged = new LinkedHashMap<>(nearest(ownerType));
        merged.put(reflection.name(), reflection);
        REFLECTIONS.put(ownerType, Collections.unmodifiableMap(merged));
    }

    /**
     * Returns every relationship of a type, including the inherited ones.
     *
     * @param type the owner type
     * @return the relationships by name, in declaration order
     */
    public static @Unmodifiable @NotNull Map<String, Reflection> reflections(@NotNull Class<?> type) {
        initialize(type);
        return nearest(type);
    }

    public static @Nullable Reflection reflectOnAssociation(@NotNull Class<?> type, @NotNull String name) {
        return reflections(type).get(name);
    }

    public static @NotNull List<Reflection> reflectOnAllAssociations(@NotNull Class<?> type, @NotNull AssociationKind kind) {
        Map<String, Reflection> reflections = reflections(type);
        if (reflections.isEmpty()) return List.of();

        List<Reflection> matching = new ArrayList<>(reflections.size());
        for (Reflection reflection : reflections.values()) {
            if (reflection.kind() == kind) matching.add(reflection);
        }
        return matching;
    }

    private static Map<String, Reflection> nearest(Class<?> type) {
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            Map<String, Reflection> reflections = REFLECTIONS.get(current);
            if (reflections != null) return reflections;
        }
        return Map.of();
    }

    // declarations live in static initializers
    private static void initialize(Class<?> type) {
        try {
            Class.forName(type.getName(), true, type.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new RepositoryException("Unable to initialize " + type.getName(), e);
        }
    }
}
