package io.github.flameyossnowy.linkage.api.options;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

public sealed interface Query permits DeleteQuery, SelectQuery, UpdateQuery {
    /**
     * Create a new select query builder with the given columns.
     * <p>
     * An empty column list selects whole records.
     *
     * @param columns the columns to select
     * @return a new select query builder
     */
    @Contract("_ -> new")
    static SelectQuery.@NotNull SelectQueryBuilder select(String... columns) {
        return new SelectQuery.SelectQueryBuilder(columns);
    }

    /**
     * Create a new delete query builder.
     *
     * @return a new delete query builder
     */
    @Contract(" -> new")
    static DeleteQuery.@NotNull DeleteQueryBuilder delete() {
        return new DeleteQuery.DeleteQueryBuilder();
    }

    /**
     * Create a new update query builder.
     *
     * @return a new update query builder
     */
    @Contract(" -> new")
    static UpdateQuery.@NotNull UpdateQueryBuilder update() {
        return new UpdateQuery.UpdateQueryBuilder();
    }
}
