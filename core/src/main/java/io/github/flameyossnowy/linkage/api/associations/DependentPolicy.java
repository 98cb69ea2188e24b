package io.github.flameyossnowy.linkage.api.associations;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * What happens to the members of a has-many association when their owner is destroyed.
 */
public enum DependentPolicy {
    /**
     * Refuse with a {@link io.github.flameyossnowy.linkage.api.exceptions.DeleteRestrictionException}.
     */
    RESTRICT_WITH_EXCEPTION("restrictWithException"),
    /**
     * Refuse by adding an error to the owner.
     */
    RESTRICT_WITH_ERROR("restrictWithError"),
    /**
     * Destroy every member, running their own cascades.
     */
    DESTROY("destroy"),
    /**
     * Delete every member in one statement, without loading them.
     */
    DELETE_ALL("deleteAll");

    private static final DependentPolicy[] VALUES = values();

    private final String option;

    DependentPolicy(String option) {
        this.option = option;
    }

    /**
     * @return the value of the {@code dependent} declaration option naming this policy
     */
    public @NotNull String option() {
        return option;
    }

    public static @NotNull Optional<DependentPolicy> fromOption(@NotNull String option) {
        for (DependentPolicy policy : VALUES) {
            if (policy.option.equals(option)) return Optional.of(policy);
        }
        return Optional.empty();
    }
}
