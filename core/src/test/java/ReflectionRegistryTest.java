import io.github.flameyossnowy.linkage.api.AbstractRecord;
import io.github.flameyossnowy.linkage.api.associations.builder.Associations;
import io.github.flameyossnowy.linkage.api.exceptions.ConfigurationException;
import io.github.flameyossnowy.linkage.api.reflect.AssociationKind;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import io.github.flameyossnowy.linkage.api.reflect.ReflectionRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReflectionRegistryTest {

    public static class Animal extends AbstractRecord {
        static {
            Associations.hasMany(Animal.class, "toys", Map.of("relatedType", Toy.class));
        }
    }

    public static class Dog extends Animal {
        static {
            Associations.hasMany(Dog.class, "bones", Map.of("relatedType", Toy.class));
            Associations.belongsTo(Dog.class, "owner", Map.of("relatedType", Toy.class, "foreignKey", "keeperId"));
        }
    }

    public static class Puppy extends Dog {
    }

    public static class Toy extends AbstractRecord {
    }

    @Test
    void subtypeSeesInheritedAndOwnReflections() {
        assertEquals(List.of("toys", "bones", "owner"), List.copyOf(ReflectionRegistry.reflections(Dog.class).keySet()));
    }

    @Test
    void parentDoesNotSeeSubtypeReflections() {
        assertEquals(List.of("toys"), List.copyOf(ReflectionRegistry.reflections(Animal.class).keySet()));
    }

    @Test
    void undeclaredSubtypeAnswersWithNearestAncestor() {
        assertSame(ReflectionRegistry.reflections(Dog.class), ReflectionRegistry.reflections(Puppy.class));
        assertNotNull(ReflectionRegistry.reflectOnAssociation(Puppy.class, "bones"));
    }

    @Test
    void reflectionsAreUnmodifiable() {
        Map<String, Reflection> reflections = ReflectionRegistry.reflections(Dog.class);
        assertThrows(UnsupportedOperationException.class, () -> reflections.remove("toys"));
    }

    @Test
    void reflectionsAreFilteredByKind() {
        List<Reflection> toOne = ReflectionRegistry.reflectOnAllAssociations(Dog.class, AssociationKind.TO_ONE);

        assertEquals(1, toOne.size());
        assertEquals("owner", toOne.get(0).name());
        assertEquals(2, ReflectionRegistry.reflectOnAllAssociations(Dog.class, AssociationKind.TO_MANY).size());
    }

    @Test
    void foreignKeysFollowTheOwnerOrTheName() {
        assertEquals("authorId", ReflectionRegistry.reflectOnAssociation(Author.class, "books").foreignKey());
        assertEquals("authorId", ReflectionRegistry.reflectOnAssociation(Book.class, "author").foreignKey());
        assertEquals("dogId", ReflectionRegistry.reflectOnAssociation(Dog.class, "bones").foreignKey());
        assertEquals("keeperId", ReflectionRegistry.reflectOnAssociation(Dog.class, "owner").foreignKey());
    }

    @Test
    void relatedTypeIsResolvedFromTheAccessor() {
        assertEquals(Book.class, ReflectionRegistry.reflectOnAssociation(Author.class, "books").relatedType());
        assertEquals(Author.class, ReflectionRegistry.reflectOnAssociation(Book.class, "author").relatedType());
    }

    @Test
    void unresolvableRelatedTypeIsReported() {
        Reflection reflection = Associations.hasMany(Toy.class, "widgets");
        assertThrows(ConfigurationException.class, reflection::relatedType);
    }
}
