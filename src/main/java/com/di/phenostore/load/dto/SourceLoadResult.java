package com.di.phenostore.load.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SourceLoadResult {
    int sourceIndex;
    String sourceName;
    List<String> tables;
    int fieldCount;
    /** Columns dropped because an earlier source of the run already loaded them. */
    List<String> skippedColumns;
    long rows;
}
