package io.github.flameyossnowy.linkage.memory;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.cache.TransactionResult;
import io.github.flameyossnowy.linkage.api.exceptions.RepositoryException;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Tables of every record type served by the {@link MemoryRepositoryAdapter}s sharing this database.
 * <p>
 * Rows are attribute maps kept in insertion order. A row is never mutated once stored, writes
 * replace it, so a transaction snapshot only copies the tables.
 * <p>
 * There is one transaction at a time: a transaction begun while another is open joins it.
 * Rolling back restores the tables and the persistence state of every record the transaction
 * inserted, updated or deleted. Rolling back a joined transaction marks the outer one
 * rollback-only, its commit then fails and rolls everything back.
 */
public final class MemoryDatabase {
    private final Map<Class<?>, Map<Object, Map<String, Object>>> tables = new HashMap<>(8);
    private final Map<Class<?>, Long> sequences = new HashMap<>(8);
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Record, RecordState> touched = new IdentityHashMap<>();
    private Map<Class<?>, Map<Object, Map<String, Object>>> snapshot;
    private int depth;
    private boolean rollbackOnly;

    @NotNull MemoryTransactionContext begin() {
        if (depth++ == 0) {
            snapshot = copyTables();
            rollbackOnly = false;
            touched.clear();
            Logging.deepInfo("Began memory transaction");
        }
        return new MemoryTransactionContext(this, depth == 1);
    }

    public boolean inTransaction() {
        return depth > 0;
    }

    @NotNull TransactionResult<Boolean> commit(boolean outermost) {
        depth--;
        if (!outermost) return TransactionResult.success(true);

        if (rollbackOnly) {
            Logging.warn("Memory transaction was marked rollback-only by a nested transaction, rolling back");
            restore();
            return TransactionResult.failure(new RepositoryException("Transaction was rolled back by a nested transaction"));
        }

        snapshot = null;
        touched.clear();
        Logging.deepInfo("Committed memory transaction");
        return TransactionResult.success(true);
    }

    void rollback(boolean outermost) {
        depth--;
        if (!outermost) {
            rollbackOnly = true;
            return;
        }
        restore();
    }

    private void restore() {
        lock.writeLock().lock();
        try {
            tables.clear();
            tables.putAll(snapshot);
        } finally {
            lock.writeLock().unlock();
        }

        touched.forEach((record, state) -> record.restoreTransactionState(state.newRecord(), state.destroyed(), state.id()));
        Logging.deepInfo(() -> "Rolled back memory transaction, restored " + touched.size() + " record(s)");

        snapshot = null;
        touched.clear();
        rollbackOnly = false;
    }

    /**
     * Remembers the persistence state of a record before the current transaction writes it.
     *
     * @param record the record about to be written
     */
    @ApiStatus.Internal
    public void touch(@NotNull Record record) {
        if (depth > 0) {
            touched.putIfAbsent(record, new RecordState(record.isNewRecord(), record.isDestroyed(), record.getId()));
        }
    }

    <R> R read(@NotNull Class<?> type, @NotNull Function<Map<Object, Map<String, Object>>, R> reader) {
        lock.readLock().lock();
        try {
            Map<Object, Map<String, Object>> table = tables.get(type);
            return reader.apply(table == null ? Map.of() : table);
        } finally {
            lock.readLock().unlock();
        }
    }

    <R> R write(@NotNull Class<?> type, @NotNull Function<Map<Object, Map<String, Object>>, R> writer) {
        lock.writeLock().lock();
        try {
            return writer.apply(tables.computeIfAbsent(type, k -> new LinkedHashMap<>()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    long nextSequence(@NotNull Class<?> type) {
        lock.writeLock().lock();
        try {
            return sequences.merge(type, 1L, Long::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void advanceSequence(@NotNull Class<?> type, long used) {
        lock.writeLock().lock();
        try {
            sequences.merge(type, used, Math::max);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void dropTable(@NotNull Class<?> type) {
        lock.writeLock().lock();
        try {
            tables.remove(type);
            sequences.remove(type);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Map<Class<?>, Map<Object, Map<String, Object>>> copyTables() {
        lock.readLock().lock();
        try {
            Map<Class<?>, Map<Object, Map<String, Object>>> copy = new HashMap<>(tables.size());
            tables.forEach((type, table) -> copy.put(type, new LinkedHashMap<>(table)));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    private record RecordState(boolean newRecord, boolean destroyed, Object id) {}
}
