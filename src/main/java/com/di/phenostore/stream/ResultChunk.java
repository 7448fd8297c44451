package com.di.phenostore.stream;

import lombok.Value;

import java.util.List;

@Value
public class ResultChunk {
    /** Output column labels, subject id excluded. */
    List<String> columns;
    List<ResultRow> rows;

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
