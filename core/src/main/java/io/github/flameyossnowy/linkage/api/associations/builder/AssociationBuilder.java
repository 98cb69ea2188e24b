package io.github.flameyossnowy.linkage.api.associations.builder;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.exceptions.ConfigurationException;
import io.github.flameyossnowy.linkage.api.reflect.AssociationKind;
import io.github.flameyossnowy.linkage.api.reflect.Reflection;
import io.github.flameyossnowy.linkage.api.reflect.ReflectionRegistry;
import io.github.flameyossnowy.linkage.api.serializer.RecordSerializer;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import javax.lang.model.SourceVersion;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Validates a relationship declaration, registers its {@link Reflection} and installs its accessors.
 * <p>
 * Every check runs at declaration time, so a misspelled option fails when the declaring
 * class is initialised rather than on first use.
 */
public abstract class AssociationBuilder {
    protected static final Set<String> VALID_OPTIONS = Set.of(
        "virtualValue", "embed", "except", "only", "serializer",
        "relatedType", "foreignKey", "inverseOf"
    );

    private static final Set<String> EMBED_MODES = Set.of("ids", "objects");

    protected final Class<? extends Record> ownerType;
    protected final String name;
    protected final Map<String, Object> options;

    protected AssociationBuilder(@NotNull Class<?> ownerType, @NotNull String name, @NotNull Map<String, ?> options) {
        if (!Record.class.isAssignableFrom(ownerType)) {
            throw new ConfigurationException(ownerType.getName() + " cannot declare associations, it is not a Record");
        }
        this.ownerType = ownerType.asSubclass(Record.class);
        this.name = name;
        this.options = new LinkedHashMap<>(options);
    }

    protected abstract @NotNull AssociationKind kind();

    protected @NotNull Set<String> validOptions() {
        return VALID_OPTIONS;
    }

    /**
     * Validates the declaration, registers its reflection and defines its accessors.
     *
     * @return the registered reflection
     * @throws ConfigurationException if the name or an option is invalid
     */
    public final @NotNull Reflection build() {
        validateName();
        validateOptions();

        Reflection reflection = new Reflection(kind(), name, options, ownerType);
        ReflectionRegistry.add(reflection);
        defineAccessors(reflection);

        Logging.deepInfo(() -> "Declared " + reflection + " with options " + options);
        return reflection;
    }

    private void validateName() {
        if (name.isBlank() || !SourceVersion.isIdentifier(name) || SourceVersion.isKeyword(name)) {
            throw new ConfigurationException("'" + name + "' is not a valid association name on " + ownerType.getSimpleName());
        }
    }

    private void validateOptions() {
        Set<String> valid = validOptions();
        for (Map.Entry<String, Object> entry : options.entrySet()) {
            String key = entry.getKey();
            if (!valid.contains(key)) {
                throw new ConfigurationException("Unknown key: " + key + " in " + ownerType.getSimpleName() + '#' + name
                    + ", valid keys are " + valid);
            }

            Object value = entry.getValue();
            if (value == null) {
                throw new ConfigurationException("Option " + key + " of " + ownerType.getSimpleName() + '#' + name + " is null");
            }
            validateOption(key, value);
        }
    }

    /**
     * Checks the value of an allowed option.
     *
     * @param key the option
     * @param value its non-null value
     */
    protected void validateOption(@NotNull String key, @NotNull Object value) {
        switch (key) {
            case "embed" -> {
                if (!EMBED_MODES.contains(value.toString())) invalid(key, value, "one of " + EMBED_MODES);
            }
            case "serializer" -> requireSerializerClass(key, value);
            case "relatedType" -> {
                if (!(value instanceof Class<?> type) || !Record.class.isAssignableFrom(type)) invalid(key, value, "a Record class");
            }
            case "only", "except" -> requireStrings(key, value);
            case "foreignKey", "inverseOf" -> {
                if (!(value instanceof String text) || text.isBlank()) invalid(key, value, "a non-blank string");
            }
            default -> {
                // virtualValue takes any value
            }
        }
    }

    protected final void requireSerializerClass(@NotNull String key, @NotNull Object value) {
        if (!(value instanceof Class<?> type) || !RecordSerializer.class.isAssignableFrom(type)) {
            invalid(key, value, "a RecordSerializer class");
        }
    }

    private void requireStrings(String key, Object value) {
        if (value instanceof String) return;
        if (value instanceof String[]) return;
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (!(element instanceof String)) invalid(key, value, "a collection of strings");
            }
            return;
        }
        invalid(key, value, "a string or a collection of strings");
    }

    protected final void invalid(@NotNull String key, @NotNull Object value, @NotNull String expected) {
        throw new ConfigurationException("Invalid value " + value + " for " + key + " in "
            + ownerType.getSimpleName() + '#' + name + ", expected " + expected);
    }

    private void defineAccessors(Reflection reflection) {
        AccessorTable table = AccessorTable.forDeclaration(ownerType);
        table.defineAssociation(reflection);
        table.defineAttributeReaderIfAbsent(name, owner -> owner.readAttribute(reflection.name()));
    }
}
