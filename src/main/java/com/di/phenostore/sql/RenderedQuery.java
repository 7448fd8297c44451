package com.di.phenostore.sql;

import java.util.List;

/**
 * SQL text plus its positional parameters, ready for a prepared statement.
 */
public record RenderedQuery(String sql, List<Object> parameters) {

    public RenderedQuery {
        parameters = List.copyOf(parameters);
    }
}
