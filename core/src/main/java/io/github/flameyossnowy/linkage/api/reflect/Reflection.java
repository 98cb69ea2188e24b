package io.github.flameyossnowy.linkage.api.reflect;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.associations.DependentPolicy;
import io.github.flameyossnowy.linkage.api.exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.Unmodifiable;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of one declared relationship.
 *
 * @author FlameyosFlow
 */
public final class Reflection {
    private final AssociationKind kind;
    private final String name;
    private final Map<String, Object> options;
    private final Class<? extends Record> ownerType;

    private volatile Class<? extends Record> relatedType;

    public Reflection(@NotNull AssociationKind kind,
                      @NotNull String name,
                      @NotNull Map<String, ?> options,
                      @NotNull Class<? extends Record> ownerType) {
        this.kind = kind;
        this.name = name;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        this.ownerType = ownerType;
    }

    public @NotNull AssociationKind kind() {
        return kind;
    }

    public @NotNull String name() {
        return name;
    }

    public @Unmodifiable @NotNull Map<String, Object> options() {
        return options;
    }

    public @NotNull Optional<Object> option(@NotNull String key) {
        return Optional.ofNullable(options.get(key));
    }

    public @NotNull Class<? extends Record> ownerType() {
        return ownerType;
    }

    public boolean isCollection() {
        return kind == AssociationKind.TO_MANY;
    }

    /**
     * Resolves the type of the related records on first use.
     * <p>
     * The {@code relatedType} option wins, then the return type of a public no-arg accessor
     * named like the association on the owner, then a field of that name.
     * To-many accessors and fields contribute their element type.
     *
     * @return the related record type
     * @throws ConfigurationException if the type cannot be resolved
     */
    public @NotNull Class<? extends Record> relatedType() {
        Class<? extends Record> type = relatedType;
        if (type == null) {
            type = resolveRelatedType();
            relatedType = type;
        }
        return type;
    }

    /**
     * @return the attribute holding the link: on the related records for a to-many reflection,
     * on the owner for a to-one reflection
     */
    public @NotNull String foreignKey() {
        Object declared = options.get("foreignKey");
        if (declared != null) return (String) declared;

        if (kind == AssociationKind.TO_MANY) {
            String simpleName = ownerType.getSimpleName();
            return Character.toLowerCase(simpleName.charAt(0)) + simpleName.substring(1) + "Id";
        }
        return name + "Id";
    }

    public @NotNull Optional<DependentPolicy> dependent() {
        Object declared = options.get("dependent");
        return declared == null ? Optional.empty() : DependentPolicy.fromOption(declared.toString());
    }

    public @NotNull Optional<String> inverseOf() {
        return option("inverseOf").map(Object::toString);
    }

    private Class<? extends Record> resolveRelatedType() {
        Object declared = options.get("relatedType");
        if (declared instanceof Class<?> type) return asRecordType(type);

        Type generic = accessorType();
        if (generic == null) {
            throw new ConfigurationException("Cannot resolve the related type of " + this
                + ", declare an accessor named " + name + " or the relatedType option");
        }

        if (kind == AssociationKind.TO_MANY) {
            if (!(generic instanceof ParameterizedType parameterized)
                || !(parameterized.getActualTypeArguments()[0] instanceof Class<?> element)) {
                throw new ConfigurationException("Cannot resolve the element type of " + this + " from " + generic);
            }
            return asRecordType(element);
        }

        if (!(generic instanceof Class<?> type)) {
            throw new ConfigurationException("Cannot resolve the related type of " + this + " from " + generic);
        }
        return asRecordType(type);
    }

    private @Nullable Type accessorType() {
        for (Method method : ownerType.getMethods()) {
            if (method.getName().equals(name) && method.getParameterCount() == 0
                && !method.isBridge() && method.getReturnType() != void.class) {
                return method.getGenericReturnType();
            }
        }

        for (Class<?> current = ownerType; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(name)) return field.getGenericType();
            }
        }
        return null;
    }

    private Class<? extends Record> asRecordType(Class<?> type) {
        if (!Record.class.isAssignableFrom(type)) {
            throw new ConfigurationException("Related type " + type.getName() + " of " + this + " is not a Record");
        }
        return type.asSubclass(Record.class);
    }

    @Override
    public String toString() {
        return ownerType.getSimpleName() + '#' + name + " (" + kind + ')';
    }
}
