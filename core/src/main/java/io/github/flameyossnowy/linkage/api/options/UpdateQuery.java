package io.github.flameyossnowy.linkage.api.options;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record UpdateQuery(Map<String, Object> updates, List<SelectOption> filters) implements Query {
    public UpdateQuery {
        // values may be null
        updates = Collections.unmodifiableMap(new LinkedHashMap<>(updates));
        filters = List.copyOf(filters);
    }

    public static class UpdateQueryBuilder {
        private final Map<String, Object> updates = new LinkedHashMap<>(3);
        private final List<SelectOption> conditions = new ArrayList<>(3);

        public UpdateQueryBuilder set(String field, Object value) {
            updates.put(field, value);
            return this;
        }

        public UpdateQueryBuilder where(String field, String operator, Object value) {
            conditions.add(new SelectOption(field, operator, value));
            return this;
        }

        public UpdateQueryBuilder where(String field, Object value) {
            conditions.add(new SelectOption(field, "=", value));
            return this;
        }

        public UpdateQueryBuilder whereIn(String key, Collection<?> values) {
            conditions.add(new SelectOption(key, "IN", values));
            return this;
        }

        public UpdateQuery build() {
            return new UpdateQuery(updates, conditions);
        }
    }
}
