import io.github.flameyossnowy.linkage.api.RepositoryAdapter;
import io.github.flameyossnowy.linkage.api.RepositoryRegistry;
import io.github.flameyossnowy.linkage.api.associations.HasManyAssociation;
import io.github.flameyossnowy.linkage.api.associations.LoadState;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotSavedException;
import io.github.flameyossnowy.linkage.api.exceptions.TypeMismatchException;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.SelectOption;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HasManyAssociationTest {

    @Mock
    RepositoryAdapter<Book, Object, Object> books;

    Author author;

    @BeforeEach
    void setup() {
        lenient().when(books.getElementType()).thenReturn(Book.class);
        lenient().when(books.getPrimaryKeyName()).thenReturn("id");
        lenient().when(books.instantiate()).thenAnswer(invocation -> new Book());

        RepositoryRegistry.clear();
        RepositoryRegistry.register("books", books);

        author = new Author();
        author.hydrate(Map.of("id", 1L, "name", "Ann"));
    }

    @AfterEach
    void teardown() {
        RepositoryRegistry.clear();
    }

    @SuppressWarnings("unchecked")
    private HasManyAssociation<Book> association(Author owner) {
        return (HasManyAssociation<Book>) owner.association("books");
    }

    @Test
    void idsReaderProjectsWithoutLoadingRecords() {
        when(books.pluck(any(SelectQuery.class), eq("id"))).thenReturn(List.of(3L, 4L));

        assertEquals(List.of(3L, 4L), association(author).idsReader());

        ArgumentCaptor<SelectQuery> captor = ArgumentCaptor.forClass(SelectQuery.class);
        verify(books).pluck(captor.capture(), eq("id"));
        assertEquals(List.of(new SelectOption("authorId", "=", 1L)), captor.getValue().filters());
        verify(books, never()).find(any(SelectQuery.class));
    }

    @Test
    void includeOfAForeignTypeMakesNoQuery() {
        HasManyAssociation<Book> association = association(author);

        assertFalse(association.include(new Author()));
        assertFalse(association.include("not a record"));
        assertFalse(association.include(null));

        verify(books, never()).exists(any(SelectQuery.class));
        verify(books, never()).find(any(SelectQuery.class));
        verify(books, never()).count(any(SelectQuery.class));
    }

    @Test
    void persistedCandidateIsCheckedInStorageWhenNotLoaded() {
        when(books.exists(any(SelectQuery.class))).thenReturn(true);
        Book stored = new Book();
        stored.hydrate(Map.of("id", 9L, "authorId", 1L));

        assertTrue(association(author).include(stored));
        verify(books, never()).find(any(SelectQuery.class));
    }

    @Test
    void unsavedMemberMakesTheCollectionNonEmptyWithoutQuery() {
        HasManyAssociation<Book> association = association(author);
        Book draft = association.build(Map.of("title", "draft"));

        assertFalse(association.isEmpty());
        assertTrue(association.any());
        assertTrue(association.include(draft));
        assertEquals(1L, draft.readAttribute("authorId"));
        verify(books, never()).exists(any(SelectQuery.class));
    }

    @Test
    void emptinessIsCheckedInStorage() {
        when(books.exists(any(SelectQuery.class))).thenReturn(false);
        HasManyAssociation<Book> association = association(author);

        assertTrue(association.isEmpty());
        assertFalse(association.any());
        assertFalse(association.isLoaded());
    }

    @Test
    void sizeAddsUnsavedMembersToTheCount() {
        when(books.count(any(SelectQuery.class))).thenReturn(2L);
        HasManyAssociation<Book> association = association(author);
        association.build(Map.of("title", "draft"));

        assertEquals(3, association.size());
        verify(books, never()).find(any(SelectQuery.class));
    }

    @Test
    void loadTargetKeepsABuiltRecordExactlyOnce() {
        Book stored = new Book();
        stored.hydrate(Map.of("id", 7L, "authorId", 1L, "title", "stored"));
        when(books.find(any(SelectQuery.class))).thenReturn(List.of(stored));

        HasManyAssociation<Book> association = association(author);
        Book built = association.build(Map.of("title", "built"));

        List<Book> target = association.loadTarget();
        assertEquals(2, target.size());
        assertSame(stored, target.get(0));
        assertSame(built, target.get(1));

        assertEquals(target, association(author).loadTarget());
        verify(books, times(1)).find(any(SelectQuery.class));
        assertSame(author, stored.author());
    }

    @Test
    void resetForgetsTheTargetWithoutTouchingStorage() {
        HasManyAssociation<Book> association = association(author);
        association.build(Map.of("title", "draft"));
        association.loadTarget();

        association.reset();

        assertEquals(LoadState.NOT_LOADED, association.loadState());
        assertTrue(association.target().isEmpty());
        verify(books, never()).delete(any(DeleteQuery.class));
        verify(books, never()).delete(any(Book.class));
    }

    @Test
    void isEmptyAgreesWithAnyInEveryState() {
        when(books.exists(any(SelectQuery.class))).thenReturn(true);
        when(books.find(any(SelectQuery.class))).thenReturn(List.of());
        HasManyAssociation<Book> association = association(author);

        assertEquals(association.isEmpty(), !association.any());
        association.loadTarget();
        assertEquals(association.isEmpty(), !association.any());
        association.build(Map.of("title", "draft"));
        assertEquals(association.isEmpty(), !association.any());
        assertFalse(association.isEmpty());
    }

    @Test
    void unsavedOwnerUsesAScopeThatNeverQueries() {
        Author fresh = new Author();
        HasManyAssociation<Book> association = association(fresh);

        assertTrue(association.scope().isNone());
        assertTrue(association.isEmpty());
        assertEquals(List.of(), association.idsReader());
        assertEquals(0, association.size());

        verify(books, never()).exists(any(SelectQuery.class));
        verify(books, never()).pluck(any(SelectQuery.class), any(String.class));
    }

    @Test
    void concatRejectsForeignTypes() {
        Author fresh = new Author();

        assertThrows(TypeMismatchException.class, () -> fresh.books().concat(new Author()));
        assertTrue(association(fresh).target().isEmpty());
    }

    @Test
    void createRequiresASavedOwner() {
        Author fresh = new Author();

        assertThrows(RecordNotSavedException.class, () -> fresh.books().create(Map.of("title", "x")));
        assertThrows(RecordNotSavedException.class, () -> fresh.books().createOrThrow(Map.of("title", "x")));
        verify(books, never()).instantiate();
    }

    @Test
    void proxyIsCachedOnTheOwner() {
        assertSame(author.books(), author.books());
    }
}
