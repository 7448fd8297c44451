package com.di.phenostore.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable loader settings handed to the orchestrator at construction.
 * Built from {@link PhenoStoreProperties.Load} in the application, directly in tests.
 */
@Value
@Builder
public class LoadSettings {

    @Builder.Default
    String tablePrefix = "ukb_pheno_";
    @Builder.Default
    int columnsPerTable = Integer.MAX_VALUE;
    @Builder.Default
    int chunkSize = 5_000;
    @Builder.Default
    int workers = 4;
    Path tmpDir;
    @Builder.Default
    boolean deleteStagingFiles = true;
    Path sampleOrderFile;
    /** Directory of {@code coding_<N>.tsv} files; unset skips the codings table. */
    Path codingsDir;
    /** SQL files run after the sources, before the derived tables are rebuilt. */
    @Builder.Default
    List<Path> sqlFiles = List.of();
    boolean vacuum;

    public static LoadSettings from(PhenoStoreProperties.Load load) {
        return LoadSettings.builder()
                .tablePrefix(load.getTablePrefix())
                .columnsPerTable(load.getColumnsPerTable())
                .chunkSize(load.getChunkSize())
                .workers(load.getWorkers())
                .tmpDir(Path.of(load.getTmpDir()))
                .deleteStagingFiles(load.isDeleteStagingFiles())
                .sampleOrderFile(load.getSampleOrderFile() == null ? null : Path.of(load.getSampleOrderFile()))
                .codingsDir(load.getCodingsDir() == null ? null : Path.of(load.getCodingsDir()))
                .sqlFiles(load.getSqlFiles().stream().map(Path::of).toList())
                .vacuum(load.isVacuum())
                .build();
    }
}
