package com.di.phenostore.query;

import com.di.phenostore.TestStore;
import com.di.phenostore.exception.BackendExecutionException;
import com.di.phenostore.exception.ErrorCategory;
import com.di.phenostore.exception.NoMatchingFieldsException;
import com.di.phenostore.exception.ValidationException;
import com.di.phenostore.registry.FieldEntry;
import com.di.phenostore.stream.QueryResult;
import com.di.phenostore.stream.ResultChunk;
import com.di.phenostore.stream.ResultRow;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PhenotypeQueryService Tests")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PhenotypeQueryServiceTest {

    private static final String DOCUMENT = String.join("\n",
            "samples_filters:",
            "  - c21003_0_0 > 0",
            "",
            "data:",
            "  diabetes:",
            "    case_control:",
            "      41270:",
            "        coding: [E11, J45]",
            "  height: c50_0_0",
            "",
            "simple_basics:",
            "  age: c21003_0_0",
            "  tall: c50_0_0 > 170",
            "");

    private TestStore store;

    @BeforeAll
    void setUp(@TempDir Path dir) {
        store = TestStore.create(2);
        store.loadStandard(dir);
    }

    @AfterAll
    void tearDown() {
        store.close();
    }

    private static List<ResultRow> drain(QueryResult result) {
        try (result) {
            return result.getCursor().stream()
                    .map(ResultChunk::getRows)
                    .flatMap(List::stream)
                    .collect(Collectors.toList());
        }
    }

    // ==================== Fields ====================

    @Test
    @DisplayName("Lists every registered field with its table and type")
    void testListFields() {
        List<FieldEntry> fields = store.service.listFields();

        assertEquals(8, fields.size());
        assertEquals("c20116_0_0", fields.get(0).getFieldName());
        assertEquals("Integer", fields.get(0).getValueType());
        assertEquals("Smoking status Uses data-coding 90", fields.get(0).getDescription());
    }

    // ==================== Direct queries ====================

    @Test
    @DisplayName("A direct query carries columns, the default missing code and no order table")
    void testQuery_Defaults() {
        QueryResult result = store.service.query(QueryRequest.builder().column("c21003_0_0 age").build());

        assertEquals(List.of("age"), result.getColumns());
        assertEquals("NA", result.getMissingCode());
        assertNull(result.getOrderTable());
        assertEquals(6, drain(result).size());
        assertTrue(result.getCursor().isClosed());
    }

    @Test
    @DisplayName("A direct query can be re-ordered and given its own missing code")
    void testQuery_OrderAndMissingCode() {
        QueryResult result = store.service.query(QueryRequest.builder().column("c50_0_0").build(),
                "-999", store.service.preferredOrderTable());

        assertEquals("-999", result.getMissingCode());
        assertEquals("bgen_samples", result.getOrderTable());
        assertEquals(List.of(5L, 3L, 1L, 99L), drain(result).stream().map(ResultRow::subjectId).toList());
    }

    @Test
    @DisplayName("Backend failures surface as execution errors")
    void testQuery_BackendError() {
        BackendExecutionException ex = assertThrows(BackendExecutionException.class,
                () -> store.service.query(QueryRequest.builder().column("no_such_function(c50_0_0) as x").build()));

        assertEquals(ErrorCategory.EXECUTION_ERROR, ex.getCategory());
        assertNotNull(ex.getOutput());
    }

    @Test
    @DisplayName("Validation failures surface as validation errors")
    void testQuery_ValidationError() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> store.service.query(QueryRequest.builder().column("c404_0_0").build()));

        assertEquals(ErrorCategory.VALIDATION_ERROR, ex.getCategory());
    }

    @Test
    @DisplayName("A request whose regular expressions match nothing reports no matching fields")
    void testQuery_NoMatchingFields() {
        NoMatchingFieldsException ex = assertThrows(NoMatchingFieldsException.class,
                () -> store.service.query(QueryRequest.builder().regexColumn("c9999_.*").build()));

        assertEquals(ErrorCategory.VALIDATION_ERROR, ex.getCategory());
        assertEquals(List.of("c9999_.*"), ex.getPatterns());
    }

    // ==================== Query documents ====================

    @Test
    @DisplayName("An outcome section derives one text column per outcome")
    void testQueryDocument_OutcomeSection() {
        QueryResult result = store.service.queryDocument(DOCUMENT, "data");

        assertEquals(List.of("diabetes", "height"), result.getColumns());
        List<ResultRow> rows = drain(result);
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L), rows.stream().map(ResultRow::subjectId).toList());

        Map<Long, Object> diabetes = TestStore.column(rows, 0);
        assertEquals("1", diabetes.get(2L));
        assertEquals("0", diabetes.get(4L));
        assertEquals("180.2", TestStore.column(rows, 1).get(2L));
    }

    @Test
    @DisplayName("A simple section selects expressions directly under the document filters")
    void testQueryDocument_SimpleSection() {
        String document = "samples_filters: c31_0_0 = '1'\nsimple_s:\n  age: c21003_0_0\n";

        List<ResultRow> rows = drain(store.service.queryDocument(document, "simple_s"));

        assertEquals(List.of(2L, 3L, 5L), rows.stream().map(ResultRow::subjectId).toList());
        assertEquals(List.of("55", "61", "38"), rows.stream().map(r -> r.get(0)).toList());
    }

    @Test
    @DisplayName("Simple sections keep the declared column order")
    void testQueryDocument_SimpleColumns() {
        QueryResult result = store.service.queryDocument(DOCUMENT, "simple_basics");

        assertEquals(List.of("age", "tall"), result.getColumns());
        Map<Long, Object> tall = TestStore.column(drain(result), 1);
        assertEquals(Boolean.TRUE, tall.get(2L));
        assertEquals(Boolean.FALSE, tall.get(1L));
    }

    @Test
    @DisplayName("Should reject unknown sections and malformed documents")
    void testQueryDocument_Invalid() {
        assertThrows(ValidationException.class, () -> store.service.queryDocument(DOCUMENT, "nope"));
        assertThrows(ValidationException.class, () -> store.service.queryDocument(DOCUMENT, "simple_nope"));
        assertThrows(ValidationException.class, () -> store.service.queryDocument(DOCUMENT, " "));
        assertThrows(ValidationException.class, () -> store.service.queryDocument("data: [", "data"));
        assertThrows(ValidationException.class,
                () -> store.service.queryDocument("data:\n  a: c50_0_0\n  a: c31_0_0\n", "data"));
    }
}
