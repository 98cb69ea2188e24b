import io.github.flameyossnowy.linkage.api.RepositoryAdapter;
import io.github.flameyossnowy.linkage.api.cache.TransactionResult;
import io.github.flameyossnowy.linkage.api.connection.TransactionContext;
import io.github.flameyossnowy.linkage.api.exceptions.RepositoryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RepositoryAdapterTest {

    @Mock
    RepositoryAdapter<Book, Object, Object> adapter;

    @Mock
    TransactionContext<Object> transaction;

    @BeforeEach
    void setup() {
        when(adapter.beginTransaction()).thenReturn(transaction);
        lenient().when(adapter.getElementType()).thenReturn(Book.class);
        lenient().doCallRealMethod().when(adapter).runAtomically(any(BooleanSupplier.class));
        lenient().doCallRealMethod().when(adapter).runInTransaction(any(Supplier.class));
    }

    @Test
    void commitsWhenTheBlockSucceeds() throws Exception {
        when(transaction.commit()).thenReturn(TransactionResult.success(true));

        assertTrue(adapter.runAtomically(() -> true));

        verify(transaction).commit();
        verify(transaction, never()).rollback();
        verify(transaction).close();
    }

    @Test
    void rollsBackWhenTheBlockReturnsFalse() throws Exception {
        assertFalse(adapter.runAtomically(() -> false));

        verify(transaction).rollback();
        verify(transaction, never()).commit();
    }

    @Test
    void rollsBackAndRethrowsWhenTheBlockThrows() throws Exception {
        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> adapter.runInTransaction(() -> {
            throw new IllegalStateException("failed");
        }));

        assertEquals("failed", thrown.getMessage());
        verify(transaction).rollback();
        verify(transaction, never()).commit();
    }

    @Test
    void rollbackFailureIsAttachedAsSuppressed() throws Exception {
        doThrow(new IllegalStateException("rollback failed")).when(transaction).rollback();

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () -> adapter.runInTransaction(() -> {
            throw new IllegalArgumentException("failed");
        }));

        assertEquals(1, thrown.getSuppressed().length);
        assertEquals("rollback failed", thrown.getSuppressed()[0].getMessage());
    }

    @Test
    void failedCommitRaises() {
        when(transaction.commit()).thenReturn(TransactionResult.failure(new IllegalStateException("disk full")));

        RepositoryException thrown = assertThrows(RepositoryException.class, () -> adapter.runInTransaction(() -> 42));
        assertEquals("disk full", thrown.getCause().getMessage());
    }
}
