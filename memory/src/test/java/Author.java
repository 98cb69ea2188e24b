import io.github.flameyossnowy.linkage.api.AbstractRecord;
import io.github.flameyossnowy.linkage.api.Errors;
import io.github.flameyossnowy.linkage.api.associations.CollectionProxy;
import io.github.flameyossnowy.linkage.api.associations.builder.Associations;
import io.github.flameyossnowy.linkage.api.utils.IdentityKeys;

import java.util.Map;

public class Author extends AbstractRecord {
    static {
        Associations.hasMany(Author.class, "books");
        Associations.belongsTo(Author.class, "featured", Map.of("relatedType", Book.class));
    }

    public Author() {}

    public Author(String name) {
        writeAttribute("name", name);
    }

    public String getName() {
        return (String) readAttribute("name");
    }

    public CollectionProxy<Book> books() {
        return collection("books");
    }

    public Book featured() {
        return reference("featured");
    }

    @Override
    protected void validate(Errors errors) {
        if (IdentityKeys.isBlank(readAttribute("name"))) errors.add("name", "can't be blank");
    }
}
