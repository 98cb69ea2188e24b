package io.github.flameyossnowy.linkage.api.associations;

import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.RepositoryAdapter;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.Query;
import io.github.flameyossnowy.linkage.api.options.SelectOption;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A deferred query over the related records of an association.
 * <p>
 * Nothing runs until a terminal method is called. A {@link #none() none} scope answers
 * every terminal method with an empty result and never reaches the adapter.
 */
public final class Scope<T extends Record> {
    private final RepositoryAdapter<T, Object, ?> adapter;
    private final SelectQuery query;
    private final boolean none;

    private Scope(RepositoryAdapter<T, Object, ?> adapter, SelectQuery query, boolean none) {
        this.adapter = adapter;
        this.query = query;
        this.none = none;
    }

    public static <T extends Record> @NotNull Scope<T> where(@NotNull RepositoryAdapter<T, Object, ?> adapter,
                                                             @NotNull List<SelectOption> filters) {
        return new Scope<>(adapter, Query.select().where(filters).build(), false);
    }

    @Contract("-> new")
    public @NotNull Scope<T> none() {
        return new Scope<>(adapter, query, true);
    }

    public boolean isNone() {
        return none;
    }

    @Contract("_, _ -> new")
    public @NotNull Scope<T> where(@NotNull String key, Object value) {
        return new Scope<>(adapter, query.and(new SelectOption(key, "=", value)), none);
    }

    @Contract("_, _ -> new")
    public @NotNull Scope<T> whereIn(@NotNull String key, @NotNull Collection<?> values) {
        return new Scope<>(adapter, query.and(new SelectOption(key, "IN", List.copyOf(values))), none);
    }

    @Contract("_ -> new")
    public @NotNull Scope<T> limit(int limit) {
        return new Scope<>(adapter, query.withLimit(limit), none);
    }

    public @NotNull SelectQuery query() {
        return query;
    }

    public @NotNull RepositoryAdapter<T, Object, ?> adapter() {
        return adapter;
    }

    public @NotNull List<T> toList() {
        return none ? List.of() : adapter.find(query);
    }

    public @NotNull List<Object> pluck(@NotNull String column) {
        return none ? List.of() : adapter.pluck(query, column);
    }

    public @NotNull List<Map<String, Object>> select(@NotNull String... columns) {
        return none ? List.of() : adapter.select(query.withColumns(columns));
    }

    public long count() {
        return none ? 0 : adapter.count(query);
    }

    public boolean exists() {
        return !none && adapter.exists(query);
    }

    public boolean existsBy(@NotNull Object id) {
        return !none && adapter.exists(query.and(new SelectOption(adapter.getPrimaryKeyName(), "=", id)));
    }

    /**
     * @return the attributes every record created through this scope starts with
     */
    public @NotNull Map<String, Object> scopeForCreate() {
        Map<String, Object> attributes = new LinkedHashMap<>(query.filters().size());
        for (SelectOption filter : query.filters()) {
            if ("=".equals(filter.operator())) attributes.put(filter.option(), filter.value());
        }
        return attributes;
    }

    /**
     * Deletes every matching record without loading them.
     *
     * @return the number of deleted records
     */
    public int deleteAll() {
        if (none) return 0;
        DeleteQuery delete = Query.delete().where(query.filters()).build();
        return adapter.delete(delete).expect("Failed to delete from " + adapter.getElementType().getSimpleName());
    }

    /**
     * Updates every matching record without loading them.
     *
     * @param updates the attributes to write, null values allowed
     * @return the number of updated records
     */
    public int updateAll(@NotNull Map<String, ?> updates) {
        if (none) return 0;
        UpdateQuery.UpdateQueryBuilder builder = Query.update();
        updates.forEach(builder::set);
        for (SelectOption filter : query.filters()) builder.where(filter.option(), filter.operator(), filter.value());
        return adapter.updateAll(builder.build()).expect("Failed to update " + adapter.getElementType().getSimpleName());
    }

    @Override
    public String toString() {
        return "Scope[" + adapter.getElementType().getSimpleName() + ", " + query.filters() + (none ? ", none]" : "]");
    }
}
