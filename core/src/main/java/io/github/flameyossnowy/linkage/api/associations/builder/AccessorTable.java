package io.github.flameyossnowy.linkage.api.associations.builder;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import io.github.flameyossnowy.linkage.api.reflect.ReflectionRegistry;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * The readers and writers a record type exposes by name.
 * <p>
 * Declaring an association installs its reader and writer here. Attribute readers are only
 * installed when the name has none yet, so a computed attribute defined before the association
 * keeps answering {@link #readAttribute(Record, String)}.
 * A subtype's table starts as a copy of its nearest ancestor's table.
 */
public final class AccessorTable {
    private static final Map<Class<?>, AccessorTable> TABLES = new ConcurrentHashMap<>(16);

    private final Class<?> ownerType;
    private final Map<String, Reflection> associations;
    private final Map<String, Function<Record, Object>> attributeReaders;

    private AccessorTable(Class<?> ownerType, Map<String, Reflection> associations, Map<String, Function<Record, Object>> attributeReaders) {
        this.ownerType = ownerType;
        this.associations = associations;
        this.attributeReaders = attributeReaders;
    }

    /**
     * @param type the record type
     * @return the table of the type or of its nearest ancestor that has one
     */
    public static @NotNull AccessorTable of(@NotNull Class<?> type) {
        // forces the static declarations of the type to run
        ReflectionRegistry.reflections(type);

        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            AccessorTable table = TABLES.get(current);
            if (table != null) return table;
        }
        return new AccessorTable(type, Map.of(), Map.of());
    }

    @ApiStatus.Internal
    static @NotNull AccessorTable forDeclaration(@NotNull Class<?> type) {
        return TABLES.computeIfAbsent(type, AccessorTable::inherit);
    }

    private static AccessorTable inherit(Class<?> type) {
        for (Class<?> current = type.getSuperclass(); current != null; current = current.getSuperclass()) {
            AccessorTable parent = TABLES.get(current);
            if (parent != null) {
                return new AccessorTable(type, new LinkedHashMap<>(parent.associations), new ConcurrentHashMap<>(parent.attributeReaders));
            }
        }
        return new AccessorTable(type, new LinkedHashMap<>(4), new ConcurrentHashMap<>(4));
    }

    /**
     * Defines a computed attribute, unless the name already has a reader.
     *
     * @param type the record type
     * @param name the attribute name
     * @param reader computes the value from the record
     * @return false when a reader was already defined
     */
    public static boolean defineReader(@NotNull Class<? extends Record> type, @NotNull String name, @NotNull Function<Record, Object> reader) {
        return forDeclaration(type).defineAttributeReaderIfAbsent(name, reader);
    }

    void defineAssociation(@NotNull Reflection reflection) {
        associations.put(reflection.name(), reflection);
    }

    boolean defineAttributeReaderIfAbsent(@NotNull String name, @NotNull Function<Record, Object> reader) {
        return attributeReaders.putIfAbsent(name, reader) == null;
    }

    public @NotNull Class<?> ownerType() {
        return ownerType;
    }

    public boolean hasAssociation(@NotNull String name) {
        return associations.containsKey(name);
    }

    public @NotNull Set<String> associationNames() {
        return associations.keySet();
    }

    /**
     * Reads an association through its runtime, else an attribute.
     */
    public @Nullable Object read(@NotNull Record owner, @NotNull String name) {
        Reflection reflection = associations.get(name);
        if (reflection != null) return reflection.kind().create(owner, reflection).read(false);
        return readAttribute(owner, name);
    }

    /**
     * Reads the attribute stored under {@code name}, bypassing associations.
     */
    public @Nullable Object readAttribute(@NotNull Record owner, @NotNull String name) {
        Function<Record, Object> reader = attributeReaders.get(name);
        return reader != null ? reader.apply(owner) : owner.readAttribute(name);
    }

    /**
     * Writes an association through its runtime, else an attribute.
     */
    public void write(@NotNull Record owner, @NotNull String name, @Nullable Object value) {
        Reflection reflection = associations.get(name);
        if (reflection != null) {
            reflection.kind().create(owner, reflection).write(value);
            return;
        }
        owner.writeAttribute(name, value);
    }
}
