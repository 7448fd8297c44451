package com.di.phenostore.stream;

import java.util.Collections;
import java.util.List;

/**
 * One subject's values, in output column order. {@code null} marks a missing value.
 */
public record ResultRow(long subjectId, List<Object> values) {

    public ResultRow {
        values = Collections.unmodifiableList(values);
    }

    public Object get(int column) {
        return values.get(column);
    }
}
