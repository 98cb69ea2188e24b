package io.github.flameyossnowy.linkage.api;

import io.github.flameyossnowy.linkage.api.exceptions.RepositoryException;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Global registry of repository adapters.
 * <p>
 * Associations resolve their related records through the adapter registered for the related type.
 * <pre>{@code
 * MemoryDatabase database = new MemoryDatabase();
 * RepositoryRegistry.register("authors", MemoryRepositoryAdapter.builder(Author.class, Long.class).database(database).build());
 * RepositoryRegistry.register("books", MemoryRepositoryAdapter.builder(Book.class, Long.class).database(database).build());
 * }</pre>
 *
 * @author FlameyosFlow
 */
public final class RepositoryRegistry {
    private static final Map<String, RepositoryAdapter<?, ?, ?>> ADAPTERS = new ConcurrentHashMap<>(16);
    private static final Map<Class<?>, String> TYPE_TO_ADAPTER = new ConcurrentHashMap<>(16);

    private RepositoryRegistry() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Registers a repository adapter under a name, replacing any adapter registered under that name
     * or for the same record type.
     *
     * @param name the unique name for this adapter
     * @param adapter the repository adapter to register
     */
    public static <T extends Record, ID, C> void register(@NotNull String name, @NotNull RepositoryAdapter<T, ID, C> adapter) {
        ADAPTERS.put(name, adapter);
        TYPE_TO_ADAPTER.put(adapter.getElementType(), name);
        Logging.info("Registered repository adapter " + name + " for " + adapter.getElementType().getSimpleName());
    }

    /**
     * Retrieves a repository adapter by name.
     *
     * @param name the adapter name
     * @return the adapter, or null if not found
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public static <T extends Record, ID, C> RepositoryAdapter<T, ID, C> get(@NotNull String name) {
        return (RepositoryAdapter<T, ID, C>) ADAPTERS.get(name);
    }

    /**
     * Retrieves a repository adapter by record type.
     *
     * @param entityType the record class
     * @return the adapter, or null if not found
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public static <T extends Record, ID, C> RepositoryAdapter<T, ID, C> get(@NotNull Class<T> entityType) {
        String name = TYPE_TO_ADAPTER.get(entityType);
        return name != null ? (RepositoryAdapter<T, ID, C>) ADAPTERS.get(name) : null;
    }

    /**
     * Retrieves the adapter serving {@code entityType}, or fails.
     *
     * @param entityType the record class
     * @return the adapter
     * @throws RepositoryException if no adapter serves that type
     */
    @NotNull
    @SuppressWarnings("unchecked")
    public static <T extends Record> RepositoryAdapter<T, Object, ?> require(@NotNull Class<? extends T> entityType) {
        String name = TYPE_TO_ADAPTER.get(entityType);
        RepositoryAdapter<?, ?, ?> adapter = name != null ? ADAPTERS.get(name) : null;
        if (adapter == null) {
            throw new RepositoryException("No repository adapter registered for " + entityType.getName());
        }
        return (RepositoryAdapter<T, Object, ?>) adapter;
    }

    /**
     * Unregisters an adapter by name.
     *
     * @param name the adapter name
     * @return true if the adapter was removed, false if it didn't exist
     */
    public static boolean unregister(@NotNull String name) {
        RepositoryAdapter<?, ?, ?> removed = ADAPTERS.remove(name);

        if (removed != null) {
            TYPE_TO_ADAPTER.remove(removed.getElementType(), name);
            return true;
        }
        return false;
    }

    /**
     * Checks if an adapter with the given name is registered.
     *
     * @param name the adapter name
     * @return true if registered, false otherwise
     */
    public static boolean isRegistered(@NotNull String name) {
        return ADAPTERS.containsKey(name);
    }

    /**
     * Clears all registered adapters.
     * <p>
     * <b>Warning:</b> This should only be used for testing or cleanup purposes.
     */
    public static void clear() {
        ADAPTERS.clear();
        TYPE_TO_ADAPTER.clear();
    }

    public static int size() {
        return ADAPTERS.size();
    }
}
