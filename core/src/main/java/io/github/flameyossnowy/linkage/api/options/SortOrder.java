package io.github.flameyossnowy.linkage.api.options;

public enum SortOrder {
    ASCENDING,
    DESCENDING
}
