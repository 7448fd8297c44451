package com.di.phenostore;

import com.di.phenostore.cohort.CohortResolver;
import com.di.phenostore.config.DbConfigSnapshot;
import com.di.phenostore.config.LoadSettings;
import com.di.phenostore.config.QuerySettings;
import com.di.phenostore.load.WideTableLoadOrchestrator;
import com.di.phenostore.load.dto.LoadReport;
import com.di.phenostore.load.source.SourceDataset;
import com.di.phenostore.query.CompiledQuery;
import com.di.phenostore.query.PhenotypeQueryService;
import com.di.phenostore.query.QueryCompiler;
import com.di.phenostore.query.document.QueryDocumentParser;
import com.di.phenostore.registry.FieldRegistry;
import com.di.phenostore.sql.BackendDialect;
import com.di.phenostore.sql.SqlRenderer;
import com.di.phenostore.stream.ResultCursor;
import com.di.phenostore.stream.ResultRow;
import com.di.phenostore.stream.ResultStreamer;
import com.di.phenostore.util.PooledDataSources;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Wires the store by hand over a private in-memory H2 database, and provides the
 * standard fixture used by the integration tests.
 *
 * <pre>
 * main.csv   subjects 1..6, seven fields, width 3 -> ukb_pheno_0_00 .. ukb_pheno_0_02
 * extra.csv  subjects 1, 2, 7; c21003_0_0 repeated (skipped), c22001_0_0 -> ukb_pheno_1_00
 * order.sample  preferred order 5, 3, 1, 99
 * </pre>
 */
public final class TestStore implements AutoCloseable {

    public static final String MAIN_CSV = String.join("\n",
            "eid,31-0.0,21003-0.0,50-0.0,41270-0.0,41270-0.1,20116-0.0,53-0.0",
            "1,0,40,165.5,I10,E11,0,2010-01-05",
            "2,1,55,180.2,E11,,1,2011-03-12",
            "3,1,61,NA,J45,,2,2009-07-01",
            "4,0,47,158.0,,,0,2012-11-30",
            "5,1,38,172.4,I10,,NA,2010-05-17",
            "6,0,52,169.9,N18,,1,");

    public static final String MAIN_DICTIONARY = String.join("\n",
            "column,type,description",
            "31-0.0,Categorical (single),Sex Uses data-coding 9",
            "21003-0.0,Integer,Age when attended assessment centre",
            "50-0.0,Continuous,Standing height",
            "41270-0.0,Categorical (multiple),Diagnoses - ICD10 Uses data-coding 19",
            "41270-0.1,Categorical (multiple),Diagnoses - ICD10 Uses data-coding 19",
            "20116-0.0,Integer,Smoking status Uses data-coding 90",
            "53-0.0,Date,Date of attending assessment centre");

    public static final String EXTRA_CSV = String.join("\n",
            "eid,21003-0.0,22001-0.0",
            "1,40,0",
            "2,55,1",
            "7,33,1");

    public static final String EXTRA_DICTIONARY = String.join("\n",
            "column,type,description",
            "22001-0.0,Integer,Genetic sex Uses data-coding 9");

    public static final String SAMPLE_FILE = String.join("\n",
            "ID_1 ID_2 missing sex",
            "0 0 0 D",
            "5 5 0 1",
            "3 3 0 1",
            "1 1 0 2",
            "99 99 0 1");

    public final String jdbcUrl;
    public final DataSource dataSource;
    public final JdbcTemplate jdbc;
    public final BackendDialect dialect;
    public final FieldRegistry registry;
    public final QueryCompiler compiler;
    public final CohortResolver cohortResolver;
    public final ResultStreamer streamer;
    public final PhenotypeQueryService service;

    private final DbConfigSnapshot snapshot;

    private TestStore(Integer chunkSize) {
        this.jdbcUrl = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        this.snapshot = DbConfigSnapshot.of(jdbcUrl, "sa", "");
        this.dataSource = PooledDataSources.INSTANCE.getOrInit(snapshot);
        this.jdbc = new JdbcTemplate(dataSource);
        this.dialect = BackendDialect.detect(dataSource);
        this.registry = new FieldRegistry(jdbc, new TransactionTemplate(new DataSourceTransactionManager(dataSource)), dialect);
        this.compiler = new QueryCompiler(registry);
        this.cohortResolver = new CohortResolver(registry, compiler);
        QuerySettings settings = new QuerySettings(chunkSize, "NA", "bgen_samples");
        this.streamer = new ResultStreamer(dataSource, new SqlRenderer(dialect), settings);
        this.service = new PhenotypeQueryService(registry, compiler, cohortResolver, new QueryDocumentParser(),
                streamer, settings);
    }

    public static TestStore create(Integer chunkSize) {
        return new TestStore(chunkSize);
    }

    public WideTableLoadOrchestrator orchestrator(LoadSettings settings) {
        return new WideTableLoadOrchestrator(jdbc, registry, dialect, settings);
    }

    public static LoadSettings.LoadSettingsBuilder settings(Path dir) {
        return LoadSettings.builder()
                .columnsPerTable(3)
                .chunkSize(2)
                .workers(3)
                .tmpDir(dir.resolve("tmp"));
    }

    /** Loads main.csv and extra.csv with width 3 and the sample order file. */
    public LoadReport loadStandard(Path dir) {
        List<SourceDataset> sources = List.of(
                SourceDataset.of(write(dir, "main.csv", MAIN_CSV), write(dir, "main_dictionary.csv", MAIN_DICTIONARY)),
                SourceDataset.of(write(dir, "extra.csv", EXTRA_CSV), write(dir, "extra_dictionary.csv", EXTRA_DICTIONARY)));
        return orchestrator(settings(dir).sampleOrderFile(write(dir, "order.sample", SAMPLE_FILE)).build()).load(sources);
    }

    /** Every row of a compiled query, in result order. */
    public List<ResultRow> rows(CompiledQuery query) {
        List<ResultRow> rows = new ArrayList<>();
        try (ResultCursor cursor = streamer.open(query)) {
            cursor.forEachRemaining(chunk -> rows.addAll(chunk.getRows()));
        }
        return rows;
    }

    /** Subject id to value of the given output column. */
    public static Map<Long, Object> column(List<ResultRow> rows, int index) {
        Map<Long, Object> values = new LinkedHashMap<>();
        rows.forEach(r -> values.put(r.subjectId(), r.get(index)));
        return values;
    }

    public static Path write(Path dir, String name, String content) {
        try {
            Files.createDirectories(dir);
            return Files.writeString(dir.resolve(name), content + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Could not write fixture " + name, e);
        }
    }

    @Override
    public void close() {
        jdbc.execute("SHUTDOWN");
        PooledDataSources.INSTANCE.close(snapshot);
    }
}
