import io.github.flameyossnowy.linkage.api.AbstractRecord;
import io.github.flameyossnowy.linkage.api.associations.CollectionProxy;
import io.github.flameyossnowy.linkage.api.associations.builder.Associations;

public class Author extends AbstractRecord {
    static {
        Associations.hasMany(Author.class, "books");
    }

    public CollectionProxy<Book> books() {
        return collection("books");
    }
}
