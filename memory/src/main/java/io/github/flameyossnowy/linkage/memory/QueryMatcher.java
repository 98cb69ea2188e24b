package io.github.flameyossnowy.linkage.memory;

import io.github.flameyossnowy.linkage.api.options.SelectOption;
import io.github.flameyossnowy.linkage.api.options.SortOption;
import io.github.flameyossnowy.linkage.api.options.SortOrder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates query filters and sort options against stored rows.
 * Integral numbers compare by value, so a {@code Long} key matches an {@code Integer} filter.
 */
final class QueryMatcher {
    private QueryMatcher() {}

    static boolean matchesAll(@NotNull Map<String, Object> row, @NotNull List<SelectOption> filters) {
        for (SelectOption filter : filters) {
            if (!matches(row, filter)) return false;
        }
        return true;
    }

    static boolean matches(@NotNull Map<String, Object> row, @NotNull SelectOption filter) {
        Object value = row.get(filter.option());
        Object filterValue = filter.value();
        String operator = filter.operator();

        if (value == null) {
            return switch (operator) {
                case "=" -> filterValue == null;
                case "!=" -> filterValue != null;
                default -> false;
            };
        }

        return switch (operator) {
            case "=" -> valuesEqual(value, filterValue);
            case "!=" -> !valuesEqual(value, filterValue);
            case ">" -> filterValue != null && compare(value, filterValue) > 0;
            case "<" -> filterValue != null && compare(value, filterValue) < 0;
            case ">=" -> filterValue != null && compare(value, filterValue) >= 0;
            case "<=" -> filterValue != null && compare(value, filterValue) <= 0;
            case "IN" -> {
                if (filterValue instanceof Collection<?> candidates) {
                    for (Object candidate : candidates) {
                        if (valuesEqual(value, candidate)) yield true;
                    }
                }
                yield false;
            }
            default -> throw new IllegalArgumentException("Unsupported operator " + operator);
        };
    }

    static boolean valuesEqual(@Nullable Object left, @Nullable Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            return ((Number) left).longValue() == ((Number) right).longValue();
        }
        return Objects.equals(left, right);
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static int compare(Object value, Object filterValue) {
        if (isIntegral(value) && isIntegral(filterValue)) {
            return Long.compare(((Number) value).longValue(), ((Number) filterValue).longValue());
        }
        if (value instanceof Comparable comparable && value.getClass().isInstance(filterValue)) {
            return comparable.compareTo(filterValue);
        }
        throw new IllegalArgumentException("Cannot compare " + value + " with " + filterValue);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    static @NotNull Comparator<Map<String, Object>> comparator(@NotNull List<SortOption> sortOptions) {
        Comparator<Map<String, Object>> comparator = null;
        for (SortOption sortOption : sortOptions) {
            Comparator<Map<String, Object>> current = Comparator.comparing(
                row -> (Comparable) row.get(sortOption.field()),
                Comparator.nullsFirst(Comparator.naturalOrder())
            );
            if (sortOption.order() == SortOrder.DESCENDING) current = current.reversed();
            comparator = comparator == null ? current : comparator.thenComparing(current);
        }
        return comparator == null ? (left, right) -> 0 : comparator;
    }
}
