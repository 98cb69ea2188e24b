package io.github.flameyossnowy.linkage.api.options;

/**
 * The sort option
 * @param field The field
 * @param order The order
 */
public record SortOption(String field, SortOrder order) {
}
