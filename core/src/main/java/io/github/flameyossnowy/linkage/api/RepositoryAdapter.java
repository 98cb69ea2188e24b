package io.github.flameyossnowy.linkage.api;

import com.google.errorprone.annotations.CheckReturnValue;
import io.github.flameyossnowy.linkage.api.cache.TransactionResult;
import io.github.flameyossnowy.linkage.api.connection.TransactionContext;
import io.github.flameyossnowy.linkage.api.exceptions.RepositoryException;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.Query;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * The storage collaborator the association layer runs against.
 * <p>
 * One adapter serves one record type. Associations find the adapter of their related type
 * through {@link RepositoryRegistry} and only ever talk to storage through this interface.
 *
 * @param <T> the record type
 * @param <ID> the identity key type
 * @param <C> the connection type handed out by {@link #beginTransaction()}
 */
@SuppressWarnings("unused")
public interface RepositoryAdapter<T extends Record, ID, C> extends AutoCloseable {
    /**
     * @return the record type served by this adapter
     */
    @NotNull Class<T> getElementType();

    /**
     * @return the type of the identity key of {@link #getElementType()}
     */
    @NotNull Class<ID> getIdType();

    /**
     * @return the attribute holding the identity key
     */
    default @NotNull String getPrimaryKeyName() {
        return Record.PRIMARY_KEY;
    }

    /**
     * Creates a new, unsaved record of {@link #getElementType()}.
     *
     * @return a fresh record that {@link Record#isNewRecord() is a new record}
     */
    @Contract("-> new")
    @NotNull T instantiate();

    /**
     * Starts a transaction on the underlying storage.
     * <p>
     * Transactions begun while another one is open on the same storage join the outer one.
     *
     * @return A transaction context that will be used to commit or roll back the
     * transaction.
     */
    @CheckReturnValue
    TransactionContext<C> beginTransaction();

    /**
     * Runs the block inside a transaction, committing when it returns and rolling back when it throws.
     *
     * @param block the work to run
     * @return the value returned by the block
     * @param <R> the result type
     */
    default <R> R runInTransaction(@NotNull Supplier<R> block) {
        try (TransactionContext<C> transaction = beginTransaction()) {
            R result;
            try {
                result = block.get();
            } catch (RuntimeException | Error e) {
                rollback(transaction, e);
                throw e;
            }
            transaction.commit().expect("Failed to commit transaction on " + getElementType().getSimpleName());
            return result;
        }
    }

    /**
     * Runs the block inside a transaction, committing when it returns {@code true} and
     * rolling back when it returns {@code false} or throws.
     *
     * @param block the work to run
     * @return the value returned by the block, {@code false} as well when the commit failed
     */
    default boolean runAtomically(@NotNull BooleanSupplier block) {
        try (TransactionContext<C> transaction = beginTransaction()) {
            boolean result;
            try {
                result = block.getAsBoolean();
            } catch (RuntimeException | Error e) {
                rollback(transaction, e);
                throw e;
            }

            if (!result) {
                rollback(transaction, null);
                return false;
            }
            return transaction.commit().isSuccess();
        }
    }

    private static void rollback(@NotNull TransactionContext<?> transaction, @Nullable Throwable cause) {
        try {
            transaction.rollback();
        } catch (Exception rollbackFailure) {
            Logging.error("Failed to roll back transaction", rollbackFailure);
            if (cause == null) throw new RepositoryException("Failed to roll back transaction", rollbackFailure);
            cause.addSuppressed(rollbackFailure);
        }
    }

    /**
     * Executes a select query on the underlying storage.
     *
     * @param query The query to execute.
     * @return the matching records, in storage order unless the query sorts them.
     */
    @CheckReturnValue
    List<T> find(@NotNull SelectQuery query);

    /**
     * @return every record of this repository.
     */
    @CheckReturnValue
    default List<T> find() {
        return find(Query.select().build());
    }

    /**
     * Finds the record with the given identity key.
     *
     * @param key The primary key of the item to find.
     * @return The item with the specified key, or null if no such item exists.
     */
    @CheckReturnValue
    @Nullable T findById(@NotNull ID key);

    /**
     * Finds every record whose key is in {@code keys}. The order of the result is not specified.
     *
     * @param keys the keys to look up
     * @return the records found, missing keys are skipped
     */
    @CheckReturnValue
    default List<T> findAllById(@NotNull Collection<? extends ID> keys) {
        if (keys.isEmpty()) return List.of();
        return find(Query.select().whereIn(getPrimaryKeyName(), new ArrayList<>(keys)).build());
    }

    /**
     * Executes a projecting query, {@link SelectQuery#columns()} names the attributes of each row.
     *
     * @param query the query, with at least one column
     * @return one ordered map per matching record
     */
    @CheckReturnValue
    List<Map<String, Object>> select(@NotNull SelectQuery query);

    /**
     * Projects a single attribute of every matching record.
     *
     * @param query the filters to apply
     * @param column the attribute to project
     * @return the values, in storage order
     */
    @CheckReturnValue
    default List<Object> pluck(@NotNull SelectQuery query, @NotNull String column) {
        List<Map<String, Object>> rows = select(query.withColumns(column));
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) values.add(row.get(column));
        return values;
    }

    /**
     * @param query the filters to apply
     * @return the number of matching records
     */
    @CheckReturnValue
    long count(@NotNull SelectQuery query);

    /**
     * @param query the filters to apply
     * @return whether at least one record matches
     */
    @CheckReturnValue
    default boolean exists(@NotNull SelectQuery query) {
        return count(query.withLimit(1)) > 0;
    }

    /**
     * Inserts the record, assigning its identity key when it has none, and marks it persisted.
     *
     * @param value The record to insert.
     * @return the result of the insertion.
     */
    TransactionResult<Boolean> insert(@NotNull T value);

    /**
     * Writes the attributes of an already persisted record.
     *
     * @param value The record to update.
     * @return the result of the update.
     */
    TransactionResult<Boolean> update(@NotNull T value);

    /**
     * Deletes the record and marks it destroyed.
     *
     * @param value The item to be deleted from the repository.
     * @return the result of the deletion.
     */
    TransactionResult<Boolean> delete(@NotNull T value);

    /**
     * Deletes every record matching the query, without loading them.
     *
     * @param query The query specifying the items to be deleted.
     * @return the number of deleted records.
     */
    TransactionResult<Integer> delete(@NotNull DeleteQuery query);

    /**
     * Updates every record matching the query, without loading them.
     *
     * @param query The query specifying the items to be updated.
     * @return the number of updated records.
     */
    TransactionResult<Integer> updateAll(@NotNull UpdateQuery query);

    /**
     * Removes all items from the repository.
     */
    TransactionResult<Boolean> clear();

    @Override
    void close();
}
