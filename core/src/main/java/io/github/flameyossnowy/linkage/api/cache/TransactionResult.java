package io.github.flameyossnowy.linkage.api.cache;

import io.github.flameyossnowy.linkage.api.exceptions.RepositoryException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;

public final class TransactionResult<T> {
    private final T result;
    private final Throwable error;

    private TransactionResult(T result, Throwable error) {
        this.result = result;
        this.error = error;
    }

    /**
     * Returns a successful TransactionResult with the given value.
     *
     * @param value the value to be returned by the successful TransactionResult
     * @return a successful TransactionResult
     */
    @Contract(value = "_ -> new", pure = true)
    public static <T> @NotNull TransactionResult<T> success(T value) {
        return new TransactionResult<>(value, null);
    }

    /**
     * Returns a failed TransactionResult with the given error.
     *
     * @param error the error to be returned by the failed TransactionResult
     * @return a failed TransactionResult
     */
    @Contract(value = "_ -> new", pure = true)
    public static <T> @NotNull TransactionResult<T> failure(Throwable error) {
        return new TransactionResult<>(null, error);
    }

    /**
     * Checks if the transaction resulted in a success.
     * @return true if the transaction was successful, false otherwise
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Checks if the transaction resulted in an error.
     *
     * @return true if the transaction resulted in an error, false otherwise
     */
    public boolean isError() {
        return error != null;
    }

    /**
     * Retrieves the error of the transaction if it resulted in an error.
     *
     * @return an Optional containing the error if the transaction resulted in an error,
     *         or an empty Optional if the transaction was successful.
     */
    @Contract(pure = true)
    public @NotNull Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Retrieves the result of the transaction if it was successful, or throws a
     * RepositoryException with the given message wrapping the error.
     *
     * @param message the message to include in the RepositoryException
     * @return the result of the transaction if successful
     * @throws RepositoryException if the transaction resulted in an error
     */
    public T expect(String message) {
        if (isSuccess()) return result;
        if (error instanceof RepositoryException repositoryException) throw repositoryException;
        throw new RepositoryException(message, error);
    }
}
