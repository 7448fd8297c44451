package com.di.phenostore.stream;

import lombok.Value;

import java.util.List;

/**
 * What a query hands to serializers: column names, the lazy chunk cursor, the sentinel to
 * print for missing values and the preferred order table the rows were arranged by
 * ({@code null} when none).
 */
@Value
public class QueryResult implements AutoCloseable {
    List<String> columns;
    ResultCursor cursor;
    String missingCode;
    String orderTable;

    @Override
    public void close() {
        cursor.close();
    }
}
