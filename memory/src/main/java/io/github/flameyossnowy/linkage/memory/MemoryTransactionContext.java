package io.github.flameyossnowy.linkage.memory;

import io.github.flameyossnowy.linkage.api.cache.TransactionResult;
import io.github.flameyossnowy.linkage.api.connection.TransactionContext;

/**
 * Transaction context of a {@link MemoryDatabase}.
 * <p>
 * Only the outermost context restores the database on rollback; a nested one marks the
 * outer transaction rollback-only.
 */
public class MemoryTransactionContext implements TransactionContext<MemoryDatabase> {
    private final MemoryDatabase database;
    private final boolean outermost;
    private boolean committed = false;
    private boolean rolledBack = false;

    MemoryTransactionContext(MemoryDatabase database, boolean outermost) {
        this.database = database;
        this.outermost = outermost;
    }

    @Override
    public MemoryDatabase connection() {
        return database;
    }

    public boolean isOutermost() {
        return outermost;
    }

    @Override
    public TransactionResult<Boolean> commit() {
        if (rolledBack) {
            return TransactionResult.failure(new IllegalStateException("Transaction already rolled back"));
        }
        if (committed) {
            return TransactionResult.success(true);
        }

        committed = true;
        return database.commit(outermost);
    }

    @Override
    public void rollback() {
        if (committed) {
            throw new IllegalStateException("Transaction already committed");
        }
        if (rolledBack) return;

        rolledBack = true;
        database.rollback(outermost);
    }

    @Override
    public void close() {
        if (!committed && !rolledBack) {
            rollback();
        }
    }
}
