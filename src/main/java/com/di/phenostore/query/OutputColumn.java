package com.di.phenostore.query;

import com.di.phenostore.registry.DataKind;

/**
 * A column of a compiled query's result, subject id excluded.
 *
 * @param label name shown to consumers
 * @param alias SQL alias of the projection
 * @param kind  registered kind when the column is a plain field, otherwise {@code null}
 */
public record OutputColumn(String label, String alias, DataKind kind) {

    public boolean isInteger() {
        return kind == DataKind.INTEGER;
    }
}
