package com.di.phenostore.load.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one load run.
 */
@Value
@Builder
public class LoadReport {
    String runId;
    List<SourceLoadResult> sources;
    long anchorSubjects;
    long eventRows;
    /** Rows of the preferred-order table, or -1 when no sample file was configured. */
    int orderedSamples;
    /** SQL files executed after the sources. */
    int sqlFiles;
    /** Rows of the codings table, or -1 when no codings directory was configured. */
    int codingRows;
    long durationMs;
}
