package com.di.phenostore.load;

import com.di.phenostore.config.LoadSettings;
import com.di.phenostore.exception.ErrorTranslator;
import com.di.phenostore.exception.PhenoStoreException;
import com.di.phenostore.load.dto.LoadReport;
import com.di.phenostore.load.dto.SourceLoadResult;
import com.di.phenostore.load.plan.ColumnShardPlanner;
import com.di.phenostore.load.plan.ShardSpec;
import com.di.phenostore.load.source.ColumnNaming;
import com.di.phenostore.load.source.FieldDictionary;
import com.di.phenostore.load.source.SourceDataset;
import com.di.phenostore.load.source.WideCsvReader;
import com.di.phenostore.load.stage.BulkImporter;
import com.di.phenostore.load.stage.ShardLoadTask;
import com.di.phenostore.load.stage.ShardTableManager;
import com.di.phenostore.load.stage.StagingExtractWriter;
import com.di.phenostore.registry.DataKind;
import com.di.phenostore.registry.FieldEntry;
import com.di.phenostore.registry.FieldRegistry;
import com.di.phenostore.sql.BackendDialect;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Loads wide sources into shard tables and rebuilds the derived tables.
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────────┐
 * │  per source, in order                                            │
 * │   PLAN     header → renamed columns → duplicates dropped         │
 * │            → ceil(columns / width) shards                        │
 * │   SCHEMA   drop + create every shard table                       │
 * │   STAGE    one pass over the source → one extract CSV per shard  │
 * │   IMPORT   extract → table (parallel on multi-writer backends,   │
 * │            sequential otherwise)                                 │
 * │   REGISTER fields → registry, one transaction                    │
 * │   on any failure: drop this source's tables, remove its rows     │
 * ├──────────────────────────────────────────────────────────────────┤
 * │  SQL      user SQL files, in order                               │
 * │  DERIVED  all_eids, events, indexes, bgen_samples, codings,      │
 * │           analyze                                                │
 * └──────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * Only one load runs at a time.
 */
@Slf4j
public class WideTableLoadOrchestrator {

    private final FieldRegistry registry;
    private final BackendDialect dialect;
    private final LoadSettings settings;
    private final ColumnShardPlanner planner;
    private final ShardTableManager tableManager;
    private final StagingExtractWriter extractWriter;
    private final BulkImporter importer;
    private final ShardWorkerPool workerPool;
    private final DerivedTablesBuilder derivedTables;
    private final SampleOrderLoader sampleOrderLoader;
    private final CodingsLoader codingsLoader;
    private final SqlScriptLoader sqlScriptLoader;
    private final ReentrantLock loadLock = new ReentrantLock();

    public WideTableLoadOrchestrator(JdbcTemplate jdbc, FieldRegistry registry, BackendDialect dialect,
                                     LoadSettings settings) {
        this(jdbc, registry, dialect, settings,
                BulkImporter.forDialect(dialect, jdbc.getDataSource()));
    }

    public WideTableLoadOrchestrator(JdbcTemplate jdbc, FieldRegistry registry, BackendDialect dialect,
                                     LoadSettings settings, BulkImporter importer) {
        this.registry = registry;
        this.dialect = dialect;
        this.settings = settings;
        this.planner = new ColumnShardPlanner(settings.getTablePrefix());
        this.tableManager = new ShardTableManager(jdbc, dialect);
        this.extractWriter = new StagingExtractWriter(settings.getChunkSize());
        this.importer = importer;
        this.workerPool = new ShardWorkerPool(settings.getWorkers());
        this.derivedTables = new DerivedTablesBuilder(jdbc, dialect);
        this.sampleOrderLoader = new SampleOrderLoader(jdbc);
        this.codingsLoader = new CodingsLoader(jdbc, dialect);
        this.sqlScriptLoader = new SqlScriptLoader(jdbc.getDataSource());
    }

    /**
     * Loads every source in list order; the list position is the source index.
     * The registry starts empty for every run. Each source is loaded all-or-nothing. A failed source stops the run after the
     * derived tables have been rebuilt for the sources that did load.
     *
     * @throws PhenoStoreException describing the first failed source
     */
    public LoadReport load(List<SourceDataset> sources) {
        loadLock.lock();
        String runId = UUID.randomUUID().toString();
        MDC.put("loadRunId", runId);
        long startMs = System.currentTimeMillis();
        Path stagingDir = null;
        try {
            stagingDir = createStagingDir();
            registry.recreate();
            log.info("[LOAD] run={} sources={} width={} backend={} staging={}",
                    runId, sources.size(), settings.getColumnsPerTable(), dialect, stagingDir);

            List<SourceLoadResult> results = new ArrayList<>();
            Set<String> loadedColumns = new HashSet<>();
            PhenoStoreException failure = null;
            for (int i = 0; i < sources.size(); i++) {
                try {
                    results.add(loadSource(i, sources.get(i), loadedColumns, stagingDir));
                } catch (RuntimeException e) {
                    failure = ErrorTranslator.translate(e);
                    log.error("[LOAD] source={} ({}) failed: {}", i, sources.get(i).name(), failure.getMessage());
                    break;
                }
            }

            int sqlFiles = 0;
            if (failure == null) {
                for (Path script : settings.getSqlFiles()) {
                    try {
                        sqlScriptLoader.run(script);
                        sqlFiles++;
                    } catch (RuntimeException e) {
                        failure = ErrorTranslator.translate(e);
                        log.error("[LOAD] SQL file {} failed: {}", script, failure.getMessage());
                        break;
                    }
                }
            }

            long anchorSubjects;
            long eventRows;
            int orderedSamples = -1;
            int codingRows = -1;
            try {
                registry.ensureExists();
                anchorSubjects = derivedTables.rebuildAnchor(registry.shardTables());
                eventRows = derivedTables.rebuildEvents(registry.fieldsOfType(FieldEntry.CATEGORICAL_MULTIPLE));
                derivedTables.createIndexes();
                if (failure == null && settings.getSampleOrderFile() != null) {
                    orderedSamples = sampleOrderLoader.load(settings.getSampleOrderFile());
                }
                if (failure == null && settings.getCodingsDir() != null) {
                    codingRows = codingsLoader.load(settings.getCodingsDir());
                }
                if (failure == null && settings.isVacuum()) {
                    derivedTables.analyze();
                }
            } catch (RuntimeException e) {
                if (failure != null) {
                    failure.addSuppressed(e);
                    throw failure;
                }
                throw ErrorTranslator.translate(e);
            }
            if (failure != null) {
                throw failure;
            }

            LoadReport report = LoadReport.builder()
                    .runId(runId)
                    .sources(results)
                    .anchorSubjects(anchorSubjects)
                    .eventRows(eventRows)
                    .orderedSamples(orderedSamples)
                    .sqlFiles(sqlFiles)
                    .codingRows(codingRows)
                    .durationMs(System.currentTimeMillis() - startMs)
                    .build();
            log.info("[LOAD] run={} completed: {} source(s), {} subjects, {} events in {}ms",
                    runId, results.size(), anchorSubjects, eventRows, report.getDurationMs());
            return report;
        } finally {
            if (stagingDir != null && settings.isDeleteStagingFiles()) {
                deleteRecursively(stagingDir);
            }
            MDC.remove("loadRunId");
            loadLock.unlock();
        }
    }

    private SourceLoadResult loadSource(int sourceIndex, SourceDataset source, Set<String> loadedColumns,
                                        Path stagingDir) {
        FieldDictionary dictionary = FieldDictionary.load(source.dictionary(), source.encoding());

        List<String> header;
        try (WideCsvReader reader = new WideCsvReader(source)) {
            header = reader.columnNames();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read source " + source.name(), e);
        }

        Set<String> columns = new LinkedHashSet<>();
        List<String> skipped = new ArrayList<>();
        for (String column : header) {
            if (column.equals(ColumnNaming.SUBJECT_ID)) {
                continue;
            }
            if (loadedColumns.contains(column) || !columns.add(column)) {
                skipped.add(column);
            }
        }
        if (!skipped.isEmpty()) {
            log.warn("[LOAD] source={} ({}): {} column(s) already loaded, skipped: {}",
                    sourceIndex, source.name(), skipped.size(), skipped);
        }

        List<ShardSpec> shards = planner.plan(sourceIndex, new ArrayList<>(columns), settings.getColumnsPerTable());
        if (shards.isEmpty()) {
            log.warn("[LOAD] source={} ({}) has no new columns, nothing loaded", sourceIndex, source.name());
            return SourceLoadResult.builder()
                    .sourceIndex(sourceIndex).sourceName(source.name())
                    .tables(List.of()).fieldCount(0).skippedColumns(skipped).rows(0)
                    .build();
        }

        List<ShardLoadTask> tasks = new ArrayList<>(shards.size());
        List<FieldEntry> entries = new ArrayList<>(columns.size());
        for (ShardSpec shard : shards) {
            List<DataKind> kinds = new ArrayList<>(shard.getColumns().size());
            for (String column : shard.getColumns()) {
                String type = dictionary.typeOf(column);
                kinds.add(DataKind.fromDeclaredType(type));
                ColumnNaming.FieldInfo info = ColumnNaming.fieldInfo(column);
                entries.add(FieldEntry.builder()
                        .fieldName(column)
                        .tableName(shard.getTableName())
                        .fieldId(info.fieldId())
                        .instance(info.instance())
                        .array(info.array())
                        .coding(dictionary.codingOf(column))
                        .valueType(type)
                        .description(dictionary.descriptionOf(column))
                        .build());
            }
            tasks.add(new ShardLoadTask(shard, kinds, stagingDir.resolve(shard.getTableName() + ".csv")));
        }

        List<String> created = new ArrayList<>();
        AtomicLong rows = new AtomicLong();
        try {
            for (ShardLoadTask task : tasks) {
                created.add(task.tableName());
                tableManager.recreate(task.shard(), task.kinds());
            }

            workerPool.runSequential("stage", List.of(source), SourceDataset::name,
                    s -> rows.set(extractWriter.write(s, tasks)));

            if (dialect.supportsConcurrentBulkImport()) {
                workerPool.runParallel("import", tasks, ShardLoadTask::tableName, importer::importExtract);
            } else {
                workerPool.runSequential("import", tasks, ShardLoadTask::tableName, importer::importExtract);
            }

            registry.register(entries);
            loadedColumns.addAll(columns);
        } catch (RuntimeException e) {
            rollback(sourceIndex, created);
            throw e;
        }

        log.info("[LOAD] source={} ({}) loaded: {} field(s) in {} table(s), {} rows",
                sourceIndex, source.name(), entries.size(), shards.size(), rows.get());
        return SourceLoadResult.builder()
                .sourceIndex(sourceIndex)
                .sourceName(source.name())
                .tables(shards.stream().map(ShardSpec::getTableName).toList())
                .fieldCount(entries.size())
                .skippedColumns(skipped)
                .rows(rows.get())
                .build();
    }

    /** Drops every table created for the source in this run and removes its registry rows. */
    private void rollback(int sourceIndex, List<String> created) {
        log.warn("[LOAD] source={} rolling back {} table(s)", sourceIndex, created.size());
        for (String table : created) {
            try {
                tableManager.drop(table);
            } catch (RuntimeException e) {
                log.error("[LOAD] rollback could not drop {}: {}", table, e.getMessage());
            }
        }
        try {
            registry.removeTables(created);
        } catch (RuntimeException e) {
            log.error("[LOAD] rollback could not clean registry rows of {}: {}", created, e.getMessage());
        }
    }

    private Path createStagingDir() {
        try {
            Path base = settings.getTmpDir() != null ? settings.getTmpDir() : Path.of(System.getProperty("java.io.tmpdir"));
            Files.createDirectories(base);
            return Files.createTempDirectory(base, "phenostore-load-");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create staging directory", e);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("[LOAD] could not delete staging file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("[LOAD] could not clean staging directory {}: {}", dir, e.getMessage());
        }
    }
}
