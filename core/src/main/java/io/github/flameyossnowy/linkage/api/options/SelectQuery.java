package io.github.flameyossnowy.linkage.api.options;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public record SelectQuery(List<String> columns, List<SelectOption> filters, List<SortOption> sortOptions, int limit) implements Query {
    public SelectQuery {
        columns = List.copyOf(columns);
        filters = List.copyOf(filters);
        sortOptions = List.copyOf(sortOptions);
    }

    /**
     * Returns a copy of this query projecting only the given columns.
     *
     * @param columns the columns to project
     * @return the projecting query
     */
    @Contract("_ -> new")
    public @NotNull SelectQuery withColumns(String... columns) {
        return new SelectQuery(List.of(columns), filters, sortOptions, limit);
    }

    /**
     * Returns a copy of this query with one more filter.
     *
     * @param option the filter to add
     * @return the narrowed query
     */
    @Contract("_ -> new")
    public @NotNull SelectQuery and(@NotNull SelectOption option) {
        List<SelectOption> narrowed = new ArrayList<>(filters.size() + 1);
        narrowed.addAll(filters);
        narrowed.add(option);
        return new SelectQuery(columns, narrowed, sortOptions, limit);
    }

    /**
     * Returns a copy of this query with a different limit.
     *
     * @param limit the new limit, negative for none
     * @return the limited query
     */
    @Contract("_ -> new")
    public @NotNull SelectQuery withLimit(int limit) {
        return new SelectQuery(columns, filters, sortOptions, limit);
    }

    public static class SelectQueryBuilder {
        private final List<String> columns;
        private final List<SelectOption> filters = new ArrayList<>(2);
        private final List<SortOption> sortOptions = new ArrayList<>(1);
        private int limit = -1;

        public SelectQueryBuilder(String... columns) {
            this.columns = List.of(columns);
        }

        /**
         * Adds a condition to the query based on the specified key, operator, and value.
         *
         * @param key the field to apply the condition on
         * @param operator the comparison operator (e.g., '=', '<', '>', etc.)
         * @param value the value to compare the field against
         * @return the updated SelectQueryBuilder instance
         */
        public SelectQueryBuilder where(String key, String operator, Object value) {
            filters.add(new SelectOption(key, operator, value));
            return this;
        }

        /**
         * Adds a condition to the query based on the specified key and value, using the
         * default equality operator.
         *
         * @param key the field to apply the condition on
         * @param value the value to compare the field against
         * @return the updated SelectQueryBuilder instance
         */
        public SelectQueryBuilder where(String key, Object value) {
            filters.add(new SelectOption(key, "=", value));
            return this;
        }

        /**
         * Adds conditions based on all fields of List&lt;SelectOption&gt;
         * @param options the options
         * @return the updated SelectQueryBuilder instance
         */
        public SelectQueryBuilder where(List<SelectOption> options) {
            filters.addAll(options);
            return this;
        }

        /**
         * Adds a condition to the query based on the specified key and list of values, using the
         * {@code IN} operator.
         *
         * @param key the field to apply the condition on
         * @param values the list of values to compare the field against
         * @return the updated SelectQueryBuilder instance
         */
        public SelectQueryBuilder whereIn(String key, Collection<?> values) {
            filters.add(new SelectOption(key, "IN", values));
            return this;
        }

        /**
         * Specifies the field and direction to order the query results by.
         *
         * @param field the field to order the results by
         * @param direction the direction to sort the results
         * @return the updated SelectQueryBuilder instance
         */
        public SelectQueryBuilder orderBy(String field, SortOrder direction) {
            sortOptions.add(new SortOption(field, direction));
            return this;
        }

        /**
         * Limits the number of records to be returned from the query.
         *
         * @param limit the maximum number of records to return. If set to a negative value, the limit
         *              will be disabled.
         * @return the updated SelectQueryBuilder instance
         */
        public SelectQueryBuilder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(columns, filters, sortOptions, limit);
        }
    }
}
