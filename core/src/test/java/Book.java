import io.github.flameyossnowy.linkage.api.AbstractRecord;
import io.github.flameyossnowy.linkage.api.associations.builder.Associations;

public class Book extends AbstractRecord {
    static {
        Associations.belongsTo(Book.class, "author");
    }

    public Author author() {
        return reference("author");
    }
}
