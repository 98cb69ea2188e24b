package io.github.flameyossnowy.linkage.memory;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.exceptions.ConfigurationException;
import io.github.flameyossnowy.linkage.api.exceptions.RepositoryException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builder for creating {@link MemoryRepositoryAdapter} instances.
 *
 * @param <T> The record type
 * @param <ID> The identity key type
 */
public class MemoryRepositoryBuilder<T extends Record, ID> {
    private static final Set<Class<?>> ALLOWED_ID_TYPES = Set.of(String.class, Long.class, Integer.class, UUID.class);

    private final Class<T> elementType;
    private final Class<ID> idType;
    private MemoryDatabase database;
    private Supplier<T> factory;

    /**
     * Creates a new builder for the given record and identity key types.
     */
    public MemoryRepositoryBuilder(@NotNull Class<T> elementType, @NotNull Class<ID> idType) {
        if (!ALLOWED_ID_TYPES.contains(idType)) {
            throw new ConfigurationException("Unsupported identity key type " + idType.getName() + ", expected one of " + ALLOWED_ID_TYPES);
        }
        this.elementType = elementType;
        this.idType = idType;
    }

    /**
     * Shares the database with other adapters, required for transactions to span several record types.
     */
    public MemoryRepositoryBuilder<T, ID> database(@NotNull MemoryDatabase database) {
        this.database = database;
        return this;
    }

    /**
     * Creates records with {@code factory} instead of the no-arg constructor of the record type.
     */
    public MemoryRepositoryBuilder<T, ID> factory(@NotNull Supplier<T> factory) {
        this.factory = factory;
        return this;
    }

    public MemoryRepositoryAdapter<T, ID> build() {
        MemoryDatabase db = database != null ? database : new MemoryDatabase();
        Supplier<T> recordFactory = factory != null ? factory : constructorFactory();
        return new MemoryRepositoryAdapter<>(elementType, idType, db, recordFactory);
    }

    private Supplier<T> constructorFactory() {
        Constructor<T> constructor;
        try {
            constructor = elementType.getDeclaredConstructor();
            constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new ConfigurationException(elementType.getName() + " needs a no-arg constructor or a factory", e);
        }

        return () -> {
            try {
                return constructor.newInstance();
            } catch (ReflectiveOperationException e) {
                throw new RepositoryException("Unable to instantiate " + elementType.getName(), e);
            }
        };
    }
}
