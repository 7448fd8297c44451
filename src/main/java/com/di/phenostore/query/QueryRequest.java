package com.di.phenostore.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Fields to select and filters to apply.
 */
@Value
@Builder
public class QueryRequest {
    /** Literal fields and derived expressions, each optionally aliased. */
    @Singular
    List<String> columns;
    /** Regular expressions expanded against registered field names. */
    @Singular
    List<String> regexColumns;
    /** Boolean predicates, combined with AND. */
    @Singular
    List<String> filters;
    @Builder.Default
    JoinMode joinMode = JoinMode.INNER;
}
