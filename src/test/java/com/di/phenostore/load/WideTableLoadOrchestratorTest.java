package com.di.phenostore.load;

import com.di.phenostore.TestStore;
import com.di.phenostore.exception.BackendExecutionException;
import com.di.phenostore.load.dto.LoadReport;
import com.di.phenostore.load.dto.SourceLoadResult;
import com.di.phenostore.load.source.SourceDataset;
import com.di.phenostore.registry.DataKind;
import com.di.phenostore.registry.FieldEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WideTableLoadOrchestrator Tests")
class WideTableLoadOrchestratorTest {

    @TempDir
    Path dir;

    private TestStore store;

    @BeforeEach
    void setUp() {
        store = TestStore.create(2);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private long count(String sql) {
        Long n = store.jdbc.queryForObject(sql, Long.class);
        return n == null ? 0 : n;
    }

    private boolean tableExists(String table) {
        return count("SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = '"
                + table.toUpperCase() + "'") > 0;
    }

    // ==================== Successful load ====================

    @Test
    @DisplayName("Shards every source by width and reports what was loaded")
    void testLoad_Report() {
        LoadReport report = store.loadStandard(dir);

        assertEquals(2, report.getSources().size());
        SourceLoadResult main = report.getSources().get(0);
        assertEquals(List.of("ukb_pheno_0_00", "ukb_pheno_0_01", "ukb_pheno_0_02"), main.getTables());
        assertEquals(7, main.getFieldCount());
        assertEquals(6, main.getRows());
        assertTrue(main.getSkippedColumns().isEmpty());

        SourceLoadResult extra = report.getSources().get(1);
        assertEquals(List.of("ukb_pheno_1_00"), extra.getTables());
        assertEquals(1, extra.getFieldCount());
        assertEquals(List.of("c21003_0_0"), extra.getSkippedColumns());
        assertEquals(3, extra.getRows());

        assertEquals(7, report.getAnchorSubjects());
        assertEquals(6, report.getEventRows());
        assertEquals(4, report.getOrderedSamples());
        assertNotNull(report.getRunId());
    }

    @Test
    @DisplayName("Every loaded column is registered exactly once with its shard table")
    void testLoad_Registry() {
        store.loadStandard(dir);

        assertEquals(List.of("c20116_0_0", "c21003_0_0", "c22001_0_0", "c31_0_0",
                "c41270_0_0", "c41270_0_1", "c50_0_0", "c53_0_0"), store.registry.fieldNames());

        FieldEntry diagnosis = store.registry.resolve(List.of("c41270_0_1")).get("c41270_0_1");
        assertEquals("ukb_pheno_0_01", diagnosis.getTableName());
        assertEquals("41270", diagnosis.getFieldId());
        assertEquals(0, diagnosis.getInstance());
        assertEquals(1, diagnosis.getArray());
        assertEquals(19, diagnosis.getCoding());
        assertEquals(FieldEntry.CATEGORICAL_MULTIPLE, diagnosis.getValueType());

        // the repeated column keeps the table of the source that loaded it first
        assertEquals("ukb_pheno_0_00", store.registry.resolve(List.of("c21003_0_0")).get("c21003_0_0").getTableName());

        Map<String, DataKind> kinds = store.registry.kindsFor(List.of("c21003_0_0", "c50_0_0", "c53_0_0", "c31_0_0"));
        assertEquals(DataKind.INTEGER, kinds.get("c21003_0_0"));
        assertEquals(DataKind.CONTINUOUS, kinds.get("c50_0_0"));
        assertEquals(DataKind.TIMESTAMP, kinds.get("c53_0_0"));
        assertEquals(DataKind.TEXT, kinds.get("c31_0_0"));
    }

    @Test
    @DisplayName("Missing tokens load as NULL and values keep their types")
    void testLoad_Values() {
        store.loadStandard(dir);

        assertNull(store.jdbc.queryForObject("SELECT c50_0_0 FROM ukb_pheno_0_00 WHERE eid = 3", Double.class));
        assertEquals(180.2, store.jdbc.queryForObject("SELECT c50_0_0 FROM ukb_pheno_0_00 WHERE eid = 2", Double.class));
        assertNull(store.jdbc.queryForObject("SELECT c20116_0_0 FROM ukb_pheno_0_01 WHERE eid = 5", Long.class));
        assertNull(store.jdbc.queryForObject("SELECT c41270_0_1 FROM ukb_pheno_0_01 WHERE eid = 2", String.class));
        assertEquals(3, count("SELECT COUNT(*) FROM ukb_pheno_1_00"));
    }

    @Test
    @DisplayName("Events merge array columns of a field, one row per distinct code")
    void testLoad_Events() {
        store.loadStandard(dir);

        assertEquals(2, count("SELECT COUNT(*) FROM events WHERE eid = 1"));
        assertEquals(2, count("SELECT COUNT(*) FROM events WHERE field_id = 41270 AND event = 'E11'"));
        assertEquals(0, count("SELECT COUNT(*) FROM events WHERE eid = 4"));
    }

    @Test
    @DisplayName("The preferred order table keeps the sample file order")
    void testLoad_SampleOrder() {
        store.loadStandard(dir);

        assertEquals(List.of(5L, 3L, 1L, 99L),
                store.jdbc.queryForList("SELECT eid FROM bgen_samples ORDER BY sample_index", Long.class));
    }

    @Test
    @DisplayName("Staging files are removed after the run")
    void testLoad_StagingCleaned() throws Exception {
        store.loadStandard(dir);

        try (Stream<Path> left = Files.list(dir.resolve("tmp"))) {
            assertEquals(0, left.count());
        }
    }

    @Test
    @DisplayName("Reloading the first source replaces the registry")
    void testLoad_ReloadStartsFresh() {
        store.loadStandard(dir);
        store.orchestrator(TestStore.settings(dir).build())
                .load(List.of(SourceDataset.of(TestStore.write(dir, "extra.csv", TestStore.EXTRA_CSV), null)));

        assertEquals(List.of("c21003_0_0", "c22001_0_0"), store.registry.fieldNames());
        assertEquals(3, count("SELECT COUNT(*) FROM all_eids"));
    }

    @Test
    @DisplayName("A run whose first source has no data columns still clears the previous registry")
    void testLoad_RegistryClearedWithoutColumns() {
        store.loadStandard(dir);
        Path subjectsOnly = TestStore.write(dir, "subjects.csv", "eid\n1\n2");

        LoadReport report = store.orchestrator(TestStore.settings(dir).build())
                .load(List.of(SourceDataset.of(subjectsOnly, null)));

        assertTrue(store.registry.fieldNames().isEmpty());
        assertEquals(0, report.getSources().get(0).getFieldCount());
        assertEquals(0, report.getAnchorSubjects());
        assertEquals(0, report.getEventRows());
    }

    @Test
    @DisplayName("SQL files run before all_eids is rebuilt and codings are loaded with the derived tables")
    void testLoad_SqlFilesAndCodings() {
        Path script = TestStore.write(dir, "late_subject.sql",
                "INSERT INTO ukb_pheno_0_00 (eid, c21003_0_0) VALUES (8, 70);");
        Path codings = dir.resolve("codings");
        TestStore.write(codings, "coding_9.tsv", "coding\tmeaning\n0\tFemale\n1\tMale");

        LoadReport report = store.orchestrator(TestStore.settings(dir).sqlFiles(List.of(script)).codingsDir(codings).build())
                .load(List.of(SourceDataset.of(TestStore.write(dir, "main.csv", TestStore.MAIN_CSV),
                        TestStore.write(dir, "main_dictionary.csv", TestStore.MAIN_DICTIONARY))));

        assertEquals(1, report.getSqlFiles());
        assertEquals(7, report.getAnchorSubjects());
        assertEquals(2, report.getCodingRows());
        assertEquals(-1, report.getOrderedSamples());
        assertEquals("Male", store.jdbc.queryForObject(
                "SELECT meaning FROM codings WHERE data_coding = 9 AND coding = '1'", String.class));
    }

    @Test
    @DisplayName("Without a codings directory no codings are loaded")
    void testLoad_NoCodings() {
        LoadReport report = store.loadStandard(dir);

        assertEquals(-1, report.getCodingRows());
        assertEquals(0, report.getSqlFiles());
    }

    // ==================== Failures ====================

    @Test
    @DisplayName("A failing SQL file fails the run after the derived tables are rebuilt")
    void testLoad_FailingSqlFile() {
        Path script = TestStore.write(dir, "broken.sql", "INSERT INTO no_such_table VALUES (1);");

        BackendExecutionException ex = assertThrows(BackendExecutionException.class,
                () -> store.orchestrator(TestStore.settings(dir).sqlFiles(List.of(script)).build())
                        .load(List.of(SourceDataset.of(TestStore.write(dir, "main.csv", TestStore.MAIN_CSV), null))));

        assertNotNull(ex.getMessage());
        assertEquals(7, store.registry.fieldNames().size());
        assertEquals(6, count("SELECT COUNT(*) FROM all_eids"));
    }

    @Test
    @DisplayName("A failing source is rolled back; earlier sources stay loaded")
    void testLoad_RollbackOnFailure() {
        Path good = TestStore.write(dir, "main.csv", TestStore.MAIN_CSV);
        Path goodDict = TestStore.write(dir, "main_dictionary.csv", TestStore.MAIN_DICTIONARY);
        Path bad = TestStore.write(dir, "bad.csv", "eid,22001-0.0\n1,0\n2,abc\n7,1");
        Path badDict = TestStore.write(dir, "bad_dictionary.csv", TestStore.EXTRA_DICTIONARY);

        BackendExecutionException ex = assertThrows(BackendExecutionException.class,
                () -> store.orchestrator(TestStore.settings(dir).build())
                        .load(List.of(SourceDataset.of(good, goodDict), SourceDataset.of(bad, badDict))));

        assertTrue(ex.getOutput().contains("ukb_pheno_1_00"));
        assertFalse(tableExists("ukb_pheno_1_00"));
        assertTrue(tableExists("ukb_pheno_0_00"));
        assertFalse(store.registry.fieldNames().contains("c22001_0_0"));
        assertEquals(7, store.registry.fieldNames().size());
        assertEquals(6, count("SELECT COUNT(*) FROM all_eids"));
    }

    @Test
    @DisplayName("A source without a subject id column fails validation")
    void testLoad_NoSubjectColumn() {
        Path csv = TestStore.write(dir, "nosubject.csv", "id,50-0.0\n1,160");

        assertThrows(com.di.phenostore.exception.ValidationException.class,
                () -> store.orchestrator(TestStore.settings(dir).build()).load(List.of(SourceDataset.of(csv, null))));
    }
}
