package io.github.flameyossnowy.linkage.api.associations.builder;

import io.github.flameyossnowy.linkage.api.reflect.AssociationKind;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

public final class BelongsToBuilder extends AssociationBuilder {
    public BelongsToBuilder(@NotNull Class<?> ownerType, @NotNull String name, @NotNull Map<String, ?> options) {
        super(ownerType, name, options);
    }

    @Override
    protected @NotNull AssociationKind kind() {
        return AssociationKind.TO_ONE;
    }
}
