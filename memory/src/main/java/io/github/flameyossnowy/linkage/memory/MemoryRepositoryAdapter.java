package io.github.flameyossnowy.linkage.memory;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.RepositoryAdapter;
import io.github.flameyossnowy.linkage.api.cache.TransactionResult;
import io.github.flameyossnowy.linkage.api.connection.TransactionContext;
import io.github.flameyossnowy.linkage.api.exceptions.RepositoryException;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import io.github.flameyossnowy.linkage.api.utils.IdentityKeys;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * A {@link RepositoryAdapter} keeping its records as attribute maps in a {@link MemoryDatabase}.
 * <p>
 * Reads hand out fresh record instances, so two reads of the same row are equal but not identical.
 * Missing identity keys are generated on insert: a sequence for {@code Long} and {@code Integer}
 * keys, a random UUID for {@code UUID} and {@code String} keys.
 *
 * @param <T> The record type
 * @param <ID> The identity key type
 */
public class MemoryRepositoryAdapter<T extends Record, ID> implements RepositoryAdapter<T, ID, MemoryDatabase> {
    private final Class<T> elementType;
    private final Class<ID> idType;
    private final MemoryDatabase database;
    private final Supplier<T> factory;

    MemoryRepositoryAdapter(Class<T> elementType, Class<ID> idType, MemoryDatabase database, Supplier<T> factory) {
        this.elementType = elementType;
        this.idType = idType;
        this.database = database;
        this.factory = factory;
    }

    @Contract("_, _ -> new")
    public static <T extends Record, ID> @NotNull MemoryRepositoryBuilder<T, ID> builder(@NotNull Class<T> elementType, @NotNull Class<ID> idType) {
        return new MemoryRepositoryBuilder<>(elementType, idType);
    }

    @Override
    public @NotNull Class<T> getElementType() {
        return elementType;
    }

    @Override
    public @NotNull Class<ID> getIdType() {
        return idType;
    }

    public @NotNull MemoryDatabase getDatabase() {
        return database;
    }

    @Override
    public @NotNull T instantiate() {
        return factory.get();
    }

    @Override
    public TransactionContext<MemoryDatabase> beginTransaction() {
        return database.begin();
    }

    @Override
    public List<T> find(@NotNull SelectQuery query) {
        List<Map<String, Object>> rows = database.read(elementType, table -> matchingRows(table, query));
        List<T> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) records.add(materialize(row));
        return records;
    }

    @Override
    public @Nullable T findById(@NotNull ID key) {
        Map<String, Object> row = database.read(elementType, table -> table.get(key));
        return row == null ? null : materialize(row);
    }

    @Override
    public List<T> findAllById(@NotNull Collection<? extends ID> keys) {
        List<Map<String, Object>> rows = database.read(elementType, table -> {
            List<Map<String, Object>> found = new ArrayList<>(keys.size());
            for (ID key : keys) {
                Map<String, Object> row = table.get(key);
                if (row != null) found.add(row);
            }
            return found;
        });

        List<T> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) records.add(materialize(row));
        return records;
    }

    @Override
    public List<Map<String, Object>> select(@NotNull SelectQuery query) {
        if (query.columns().isEmpty()) {
            throw new IllegalArgumentException("A projection needs at least one column");
        }

        return database.read(elementType, table -> {
            List<Map<String, Object>> rows = matchingRows(table, query);
            List<Map<String, Object>> projected = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                Map<String, Object> projection = new LinkedHashMap<>(query.columns().size());
                for (String column : query.columns()) projection.put(column, row.get(column));
                projected.add(projection);
            }
            return projected;
        });
    }

    @Override
    public long count(@NotNull SelectQuery query) {
        return database.read(elementType, table -> (long) matchingRows(table, query).size());
    }

    @Override
    public TransactionResult<Boolean> insert(@NotNull T value) {
        Object id = value.getId();
        if (id == null) {
            id = generateId();
        } else {
            id = IdentityKeys.convert(id, idType);
            if (id == null) return TransactionResult.failure(new RepositoryException("Invalid identity key " + value.getId() + " for " + elementType.getSimpleName()));
            if (id instanceof Number number) database.advanceSequence(elementType, number.longValue());
        }

        database.touch(value);
        Object key = id;
        value.writeAttribute(getPrimaryKeyName(), key);
        Map<String, Object> row = new LinkedHashMap<>(value.attributes());

        boolean inserted = database.write(elementType, table -> table.putIfAbsent(key, row) == null);
        if (!inserted) {
            return TransactionResult.failure(new RepositoryException("Duplicate key " + key + " for " + elementType.getSimpleName()));
        }

        value.markPersisted();
        Logging.deepInfo(() -> "Inserted " + value);
        return TransactionResult.success(true);
    }

    @Override
    public TransactionResult<Boolean> update(@NotNull T value) {
        Object key = value.getId();
        if (key == null) {
            return TransactionResult.failure(new RepositoryException("Cannot update " + elementType.getSimpleName() + " without identity key"));
        }

        database.touch(value);
        Map<String, Object> row = new LinkedHashMap<>(value.attributes());
        boolean updated = database.write(elementType, table -> table.replace(key, row) != null);
        if (!updated) {
            return TransactionResult.failure(new RepositoryException(elementType.getSimpleName() + " " + key + " does not exist"));
        }

        Logging.deepInfo(() -> "Updated " + value);
        return TransactionResult.success(true);
    }

    @Override
    public TransactionResult<Boolean> delete(@NotNull T value) {
        Object key = value.getId();
        if (key == null) return TransactionResult.success(false);

        database.touch(value);
        boolean removed = database.write(elementType, table -> table.remove(key) != null);
        value.markDestroyed();

        Logging.deepInfo(() -> "Deleted " + value);
        return TransactionResult.success(removed);
    }

    @Override
    public TransactionResult<Integer> delete(@NotNull DeleteQuery query) {
        int deleted = database.write(elementType, table -> {
            int count = 0;
            for (Iterator<Map<String, Object>> iterator = table.values().iterator(); iterator.hasNext(); ) {
                if (QueryMatcher.matchesAll(iterator.next(), query.filters())) {
                    iterator.remove();
                    count++;
                }
            }
            return count;
        });

        Logging.deepInfo(() -> "Deleted " + deleted + " " + elementType.getSimpleName() + " row(s) matching " + query.filters());
        return TransactionResult.success(deleted);
    }

    @Override
    public TransactionResult<Integer> updateAll(@NotNull UpdateQuery query) {
        if (query.updates().containsKey(getPrimaryKeyName())) {
            return TransactionResult.failure(new RepositoryException("Cannot update the identity key of " + elementType.getSimpleName()));
        }

        int updated = database.write(elementType, table -> {
            int count = 0;
            for (Map.Entry<Object, Map<String, Object>> entry : table.entrySet()) {
                if (!QueryMatcher.matchesAll(entry.getValue(), query.filters())) continue;

                Map<String, Object> row = new LinkedHashMap<>(entry.getValue());
                row.putAll(query.updates());
                entry.setValue(row);
                count++;
            }
            return count;
        });

        Logging.deepInfo(() -> "Updated " + updated + " " + elementType.getSimpleName() + " row(s) matching " + query.filters());
        return TransactionResult.success(updated);
    }

    @Override
    public TransactionResult<Boolean> clear() {
        database.write(elementType, table -> {
            table.clear();
            return null;
        });
        return TransactionResult.success(true);
    }

    /**
     * Drops the table of this adapter from its database.
     */
    @Override
    public void close() {
        database.dropTable(elementType);
    }

    private List<Map<String, Object>> matchingRows(Map<Object, Map<String, Object>> table, SelectQuery query) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : table.values()) {
            if (QueryMatcher.matchesAll(row, query.filters())) rows.add(row);
        }

        if (!query.sortOptions().isEmpty()) rows.sort(QueryMatcher.comparator(query.sortOptions()));
        if (query.limit() >= 0 && rows.size() > query.limit()) return new ArrayList<>(rows.subList(0, query.limit()));
        return rows;
    }

    private T materialize(Map<String, Object> row) {
        T record = factory.get();
        record.hydrate(new LinkedHashMap<>(row));
        return record;
    }

    private Object generateId() {
        if (idType == Long.class) return database.nextSequence(elementType);
        if (idType == Integer.class) return Math.toIntExact(database.nextSequence(elementType));
        if (idType == UUID.class) return UUID.randomUUID();
        if (idType == String.class) return UUID.randomUUID().toString();
        throw new RepositoryException("Cannot generate identity keys of type " + idType.getName() + ", assign them before inserting");
    }
}
