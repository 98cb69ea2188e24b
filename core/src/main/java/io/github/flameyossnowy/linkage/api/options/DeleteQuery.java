package io.github.flameyossnowy.linkage.api.options;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public record DeleteQuery(List<SelectOption> filters) implements Query {
    public DeleteQuery {
        filters = List.copyOf(filters);
    }

    public static class DeleteQueryBuilder {
        private final List<SelectOption> filters = new ArrayList<>(3);

        /**
         * Adds a condition to the query based on the specified key, operator, and value.
         *
         * @param option the field to apply the condition on
         * @param operator the comparison operator (e.g., '=', '<', '>', etc.)
         * @param value the value to compare the field against
         * @return the updated DeleteQueryBuilder instance
         */
        public DeleteQueryBuilder where(String option, String operator, Object value) {
            filters.add(new SelectOption(option, operator, value));
            return this;
        }

        public DeleteQueryBuilder where(String option, Object value) {
            filters.add(new SelectOption(option, "=", value));
            return this;
        }

        public DeleteQueryBuilder where(List<SelectOption> options) {
            filters.addAll(options);
            return this;
        }

        public DeleteQueryBuilder whereIn(String key, Collection<?> values) {
            filters.add(new SelectOption(key, "IN", values));
            return this;
        }

        public DeleteQuery build() {
            return new DeleteQuery(filters);
        }
    }
}
