package io.github.flameyossnowy.linkage.api.options;

/**
 * The select option.
 * @param option The attribute name.
 * @param operator The operator, usually defaults to "=".
 * @param value The value to compare with.
 */
public record SelectOption(String option, String operator, Object value) {
}
