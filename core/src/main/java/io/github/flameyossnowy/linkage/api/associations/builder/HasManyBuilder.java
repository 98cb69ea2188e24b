package io.github.flameyossnowy.linkage.api.associations.builder;

import io.github.flameyossnowy.linkage.api.associations.DependentPolicy;
import io.github.flameyossnowy.linkage.api.reflect.AssociationKind;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

public final class HasManyBuilder extends AssociationBuilder {
    private static final Set<String> VALID_HAS_MANY_OPTIONS;

    static {
        Set<String> options = new HashSet<>(VALID_OPTIONS);
        options.add("eachSerializer");
        options.add("dependent");
        VALID_HAS_MANY_OPTIONS = Set.copyOf(options);
    }

    public HasManyBuilder(@NotNull Class<?> ownerType, @NotNull String name, @NotNull Map<String, ?> options) {
        super(ownerType, name, options);
    }

    @Override
    protected @NotNull AssociationKind kind() {
        return AssociationKind.TO_MANY;
    }

    @Override
    protected @NotNull Set<String> validOptions() {
        return VALID_HAS_MANY_OPTIONS;
    }

    @Override
    protected void validateOption(@NotNull String key, @NotNull Object value) {
        switch (key) {
            case "eachSerializer" -> requireSerializerClass(key, value);
            case "dependent" -> {
                if (DependentPolicy.fromOption(value.toString()).isEmpty()) {
                    invalid(key, value, "one of " + Arrays.stream(DependentPolicy.values()).map(DependentPolicy::option).toList());
                }
            }
            default -> super.validateOption(key, value);
        }
    }
}
