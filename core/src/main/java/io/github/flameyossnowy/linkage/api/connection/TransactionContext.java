package io.github.flameyossnowy.linkage.api.connection;

import io.github.flameyossnowy.linkage.api.cache.TransactionResult;

/**
 * TransactionContext is used to manage a transaction for a connection.
 * <p>
 * Every multi-step association mutation (create, concat, replace, cascades) runs inside one
 * of these, obtained from {@link io.github.flameyossnowy.linkage.api.RepositoryAdapter#beginTransaction()}.
 * @param <C> The type of connection being managed by this transaction context.
 * @author flameyosflow
 */
public interface TransactionContext<C> extends AutoCloseable {
    /**
     * Get the connection being managed by this transaction context.
     *
     * @return The connection
     */
    C connection();

    /**
     * Closes the transaction context. This will
     * rollback the transaction if not already committed.
     */
    @Override
    void close();

    /**
     * Commits the transaction.
     *
     * @return a result object that can be used to find out if the commit was
     * successful or not which includes the exception if the commit failed.
     */
    TransactionResult<Boolean> commit();

    /**
     * Rolls back the transaction.
     *
     * @throws Exception If the rollback failed.
     */
    void rollback() throws Exception;
}
