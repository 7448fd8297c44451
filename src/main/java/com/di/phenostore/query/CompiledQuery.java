package com.di.phenostore.query;

import com.di.phenostore.sql.ast.SelectQuery;

import java.util.List;

/**
 * Query tree plus the description of its output. The first projection is always the
 * subject id, aliased {@code eid}; {@code columns} describes the remaining ones in order.
 */
public record CompiledQuery(SelectQuery query, List<OutputColumn> columns) {

    public CompiledQuery {
        columns = List.copyOf(columns);
    }

    /** The same query without ORDER BY, for use as a derived table. */
    public SelectQuery unordered() {
        return query.toBuilder().orderBy(List.of()).build();
    }
}
