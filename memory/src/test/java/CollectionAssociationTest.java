import io.github.flameyossnowy.linkage.api.RepositoryRegistry;
import io.github.flameyossnowy.linkage.api.associations.CollectionAssociation;
import io.github.flameyossnowy.linkage.api.associations.CollectionProxy;
import io.github.flameyossnowy.linkage.api.associations.LoadState;
import io.github.flameyossnowy.linkage.api.exceptions.RecordInvalidException;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotSavedException;
import io.github.flameyossnowy.linkage.api.exceptions.TypeMismatchException;
import io.github.flameyossnowy.linkage.api.options.Query;
import io.github.flameyossnowy.linkage.memory.MemoryDatabase;
import io.github.flameyossnowy.linkage.memory.MemoryRepositoryAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectionAssociationTest {

    MemoryRepositoryAdapter<Author, Long> authors;
    MemoryRepositoryAdapter<Book, Long> books;

    @BeforeEach
    void setup() {
        MemoryDatabase database = new MemoryDatabase();
        authors = MemoryRepositoryAdapter.builder(Author.class, Long.class).database(database).build();
        books = MemoryRepositoryAdapter.builder(Book.class, Long.class).database(database).build();

        RepositoryRegistry.register("authors", authors);
        RepositoryRegistry.register("books", books);
    }

    @AfterEach
    void teardown() {
        authors.close();
        books.close();
        RepositoryRegistry.clear();
    }

    private Author savedAuthor(String name) {
        Author author = new Author(name);
        assertTrue(author.save());
        return author;
    }

    private long storedBooksOf(Author author) {
        return books.count(Query.select().where("authorId", author.getId()).build());
    }

    @Test
    void buildOnUnsavedOwnerThenCreateAfterSave() {
        Author author = new Author("Ann");
        Book a = author.books().build(Map.of("title", "a"));

        assertFalse(author.books().isEmpty());
        assertEquals(1, author.books().size());
        assertEquals(0, books.count(Query.select().build()));

        assertTrue(author.save());
        Book b = author.books().create(Map.of("title", "b"));

        assertTrue(a.isPersisted());
        assertTrue(b.isPersisted());
        assertEquals(author.getId(), a.readAttribute("authorId"));
        assertEquals(author.getId(), b.readAttribute("authorId"));

        List<Book> members = new ArrayList<>(author.books());
        assertEquals(2, members.size());
        assertSame(a, members.get(0));
        assertSame(b, members.get(1));
        assertEquals(2, storedBooksOf(author));
    }

    @Test
    void createLinksTheInverseWithoutQuery() {
        Author author = savedAuthor("Ann");
        Book book = author.books().create(Map.of("title", "Dune"));

        assertSame(author, book.author());
    }

    @Test
    void loadedTargetKeepsUnsavedMembersAfterStoredOnes() {
        Author author = savedAuthor("Ann");
        author.books().create(Map.of("title", "stored"));
        author.books().reset();

        Book draft = author.books().build(Map.of("title", "draft"));
        List<Book> target = author.books().loadTarget();

        assertEquals(List.of("stored", "draft"), target.stream().map(Book::getTitle).toList());
        assertSame(draft, target.get(1));
        assertEquals(1, target.stream().filter(book -> book == draft).count());
    }

    @Test
    void setIdsKeepsOrderDropsBlanksAndDuplicates() {
        Author author = savedAuthor("Ann");
        List<Book> stored = new ArrayList<>();
        for (String title : List.of("one", "two", "three")) {
            Book book = new Book(title);
            assertTrue(book.save());
            stored.add(book);
        }

        Object third = stored.get(2).getId();
        Object first = stored.get(0).getId();
        author.books().setIds(Arrays.asList(third, "", first, third, null, String.valueOf(stored.get(1).getId())));

        assertEquals(List.of(third, first, stored.get(1).getId()), author.books().ids());
        assertEquals(3, storedBooksOf(author));
    }

    @Test
    void setIdsWithUnknownKeyRaisesAndKeepsMembers() {
        Author author = savedAuthor("Ann");
        Book kept = author.books().create(Map.of("title", "kept"));

        RecordNotFoundException exception = assertThrows(RecordNotFoundException.class, () -> author.books().setIds(List.of(kept.getId(), 999L)));

        assertEquals(List.of(999L), exception.getMissingIds());
        assertEquals(List.of(kept.getId()), author.books().ids());
    }

    @Test
    void resetForgetsMembersButKeepsStorage() {
        Author author = savedAuthor("Ann");
        author.books().create(Map.of("title", "Dune"));

        author.books().reset();

        assertFalse(author.books().isLoaded());
        assertEquals(1, storedBooksOf(author));
        assertEquals(1, author.books().size());
    }

    @Test
    void concatSavesMembersOfASavedOwner() {
        Author author = savedAuthor("Ann");
        Book first = new Book("first");
        Book second = new Book("second");

        assertTrue(author.books().concat(List.of(first, new Book[] { second })));

        assertTrue(first.isPersisted());
        assertTrue(second.isPersisted());
        assertEquals(2, storedBooksOf(author));
    }

    @Test
    void concatWithAnInvalidRecordRollsBack() {
        Author author = savedAuthor("Ann");
        Book valid = new Book("valid");
        Book invalid = new Book("");

        assertFalse(author.books().concat(valid, invalid));

        assertTrue(valid.isNewRecord());
        assertNull(valid.getId());
        assertEquals(List.of("can't be blank"), invalid.getErrors().on("title"));
        assertEquals(0, books.count(Query.select().build()));
    }

    @Test
    void concatRejectsForeignTypes() {
        Author author = savedAuthor("Ann");

        assertThrows(TypeMismatchException.class, () -> author.books().concat(new Book("fine"), new Author("Bob")));
        assertEquals(0, books.count(Query.select().build()));
    }

    @Test
    void createOnUnsavedOwnerRaises() {
        Author author = new Author("Ann");

        assertThrows(RecordNotSavedException.class, () -> author.books().create(Map.of("title", "Dune")));
        assertTrue(author.books().getAssociation().target().isEmpty());
    }

    @Test
    void createWithInvalidAttributesReturnsTheRecordWithErrors() {
        Author author = savedAuthor("Ann");

        Book book = author.books().create(Map.of("title", " "));

        assertTrue(book.isNewRecord());
        assertFalse(book.getErrors().isEmpty());
        assertEquals(0, storedBooksOf(author));
    }

    @Test
    void createOrThrowRaisesAndLeavesNothingBehind() {
        Author author = savedAuthor("Ann");

        assertThrows(RecordInvalidException.class, () -> author.books().createOrThrow(Map.of("title", "")));

        assertTrue(author.books().getAssociation().target().isEmpty());
        assertEquals(0, storedBooksOf(author));
    }

    @Test
    void replaceUnlinksRemovedMembersAndSavesNewOnes() {
        Author author = savedAuthor("Ann");
        Book a = author.books().create(Map.of("title", "a"));
        Book b = author.books().create(Map.of("title", "b"));
        Book c = author.books().create(Map.of("title", "c"));
        Book d = new Book("d");

        author.books().replace(List.of(c, d));

        assertEquals(List.of(c, d), new ArrayList<>(author.books()));
        assertNull(a.readAttribute("authorId"));
        assertNull(books.findById((Long) b.getId()).readAttribute("authorId"));
        assertTrue(d.isPersisted());
        assertEquals(2, storedBooksOf(author));
        assertEquals(4, books.count(Query.select().build()));
    }

    @Test
    void failedReplaceRestoresTheOriginalMembers() {
        Author author = savedAuthor("Ann");
        Book a = author.books().create(Map.of("title", "a"));
        Book invalid = new Book("");

        assertThrows(RecordNotSavedException.class, () -> author.books().replace(List.of(invalid)));

        assertEquals(List.of(a), author.books().getAssociation().target());
        assertEquals(1, storedBooksOf(author));
        assertEquals(author.getId(), books.findById((Long) a.getId()).readAttribute("authorId"));
    }

    @Test
    void deleteWithoutDependentNullifiesTheForeignKey() {
        Author author = savedAuthor("Ann");
        Book a = author.books().create(Map.of("title", "a"));
        author.books().create(Map.of("title", "b"));

        author.books().remove(a);

        assertNull(a.readAttribute("authorId"));
        assertFalse(a.isDestroyed());
        assertEquals(1, author.books().size());
        assertEquals(2, books.count(Query.select().build()));
    }

    @Test
    void destroyRemovesFromStorage() {
        Author author = savedAuthor("Ann");
        Book a = author.books().create(Map.of("title", "a"));

        author.books().destroy(a);

        assertTrue(a.isDestroyed());
        assertTrue(author.books().isEmpty());
        assertEquals(0, books.count(Query.select().build()));
    }

    @Test
    void deleteAllUnlinksEveryMemberInStorage() {
        Author author = savedAuthor("Ann");
        author.books().create(Map.of("title", "a"));
        author.books().create(Map.of("title", "b"));

        author.books().deleteAll();

        assertTrue(author.books().isEmpty());
        assertEquals(0, storedBooksOf(author));
        assertEquals(2, books.count(Query.select().build()));
    }

    @Test
    void readerSeesBooksOfAFreshlyLoadedOwner() {
        Author author = savedAuthor("Ann");
        author.books().create(Map.of("title", "a"));
        author.books().create(Map.of("title", "b"));

        Author loaded = authors.findById((Long) author.getId());

        assertNotNull(loaded);
        assertFalse(loaded.books().isLoaded());
        assertTrue(loaded.books().isMany());
        assertEquals("a", loaded.books().first().getTitle());
        assertEquals("b", loaded.books().last().getTitle());
        assertSame(loaded, loaded.books().get(0).author());
        assertEquals(List.of(Map.of("title", "a"), Map.of("title", "b")), loaded.books().select("title"));
    }

    @Test
    void selectFieldsProjectsStoredMembersWithoutLoading() {
        Author author = savedAuthor("Ann");
        author.books().create(Map.of("title", "a"));
        author.books().create(Map.of("title", "b"));
        author.books().reset();

        List<Map<String, Object>> projected = author.books().select("id", "title");

        assertEquals(List.of(Map.of("id", 1L, "title", "a"), Map.of("id", 2L, "title", "b")), projected);
        assertFalse(author.books().isLoaded());
    }

    @Test
    void selectPredicateFiltersLoadedAndUnsavedMembers() {
        Author author = savedAuthor("Ann");
        author.books().create(Map.of("title", "a"));
        Book b = author.books().create(Map.of("title", "b"));
        author.books().reset();
        Book c = author.books().build(Map.of("title", "c"));

        List<Book> selected = author.books().select(book -> !"a".equals(book.getTitle()));

        assertEquals(2, selected.size());
        assertEquals(b, selected.get(0));
        assertSame(c, selected.get(1));
        assertTrue(author.books().isLoaded());
    }

    @Test
    void manyCountsUnsavedMembersAndHonoursThePredicate() {
        Author author = savedAuthor("Ann");
        assertFalse(author.books().isMany());

        author.books().create(Map.of("title", "a"));
        assertFalse(author.books().isMany());

        author.books().build(Map.of("title", "b"));
        assertTrue(author.books().isMany());
        assertTrue(author.books().isMany(book -> book.getTitle() != null));
        assertFalse(author.books().isMany(book -> "a".equals(book.getTitle())));
    }

    @Test
    void forcedReaderAndReloadPickUpRowsWrittenElsewhere() {
        Author author = savedAuthor("Ann");
        author.books().create(Map.of("title", "a"));
        CollectionProxy<Book> proxy = author.books();
        assertEquals(1, proxy.loadTarget().size());

        Book outside = new Book("b");
        outside.writeAttribute("authorId", author.getId());
        assertTrue(outside.save());
        assertEquals(1, proxy.size());

        CollectionAssociation<Book> association = proxy.getAssociation();
        CollectionProxy<Book> reloaded = association.reader(true);

        assertSame(proxy, reloaded);
        assertTrue(association.isLoaded());
        assertEquals(2, reloaded.size());

        Book third = new Book("c");
        third.writeAttribute("authorId", author.getId());
        assertTrue(third.save());

        assertEquals(List.of("a", "b", "c"), proxy.reload().stream().map(Book::getTitle).toList());
    }

    @Test
    void proxyReloadsAfterTheOwnerIdentityChanges() {
        Author ann = savedAuthor("Ann");
        ann.books().create(Map.of("title", "a"));
        Author bob = savedAuthor("Bob");
        bob.books().create(Map.of("title", "c"));

        CollectionProxy<Book> proxy = ann.books();
        assertEquals(1, proxy.loadTarget().size());

        ann.setId(bob.getId());

        CollectionAssociation<?> association = (CollectionAssociation<?>) ann.association("books");
        assertTrue(association.isStale());
        assertEquals(LoadState.STALE, association.loadState());

        assertEquals(List.of("c"), proxy.stream().map(Book::getTitle).toList());
        assertTrue(proxy.isLoaded());
        assertFalse(association.isStale());
    }
}
