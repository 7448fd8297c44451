package com.di.phenostore.registry;

import com.di.phenostore.TestStore;
import com.di.phenostore.exception.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FieldRegistry Tests")
class FieldRegistryTest {

    private TestStore store;
    private FieldRegistry registry;

    @BeforeEach
    void setUp() {
        store = TestStore.create(2);
        registry = store.registry;
        registry.recreate();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static FieldEntry entry(String field, String table) {
        return FieldEntry.builder()
                .fieldName(field)
                .tableName(table)
                .fieldId(field.substring(1, field.indexOf('_')))
                .instance(0)
                .array(0)
                .valueType("Integer")
                .build();
    }

    private static List<FieldEntry> oneFieldPerTable(int tables) {
        List<FieldEntry> entries = new ArrayList<>(tables);
        for (int i = 0; i < tables; i++) {
            entries.add(entry("c" + (1000 + i) + "_0_0", String.format("ukb_pheno_0_%04d", i)));
        }
        return entries;
    }

    // ==================== Writes ====================

    @Test
    @DisplayName("Removing more tables than one IN list holds removes all of them")
    void testRemoveTables_ManyTables() {
        registry.register(oneFieldPerTable(1_200));
        List<String> doomed = new ArrayList<>();
        for (int i = 0; i < 1_100; i++) {
            doomed.add(String.format("ukb_pheno_0_%04d", i));
        }

        int removed = registry.removeTables(doomed);

        assertEquals(1_100, removed);
        assertEquals(100, registry.fieldNames().size());
        assertEquals(100, registry.shardTables().size());
        assertFalse(registry.shardTables().contains("ukb_pheno_0_0000"));
        assertTrue(registry.shardTables().contains("ukb_pheno_0_1100"));
    }

    @Test
    @DisplayName("Removing no tables or unknown tables changes nothing")
    void testRemoveTables_Nothing() {
        registry.register(List.of(entry("c50_0_0", "ukb_pheno_0_00")));

        assertEquals(0, registry.removeTables(List.of()));
        assertEquals(0, registry.removeTables(List.of("ukb_pheno_9_00", "ukb_pheno_9_00")));
        assertEquals(List.of("c50_0_0"), registry.fieldNames());
    }

    @Test
    @DisplayName("Registering a field again moves it to the new table")
    void testRegister_ReplacesField() {
        registry.register(List.of(entry("c50_0_0", "ukb_pheno_0_00"), entry("c31_0_0", "ukb_pheno_0_00")));
        registry.register(List.of(entry("c50_0_0", "ukb_pheno_1_00")));

        assertEquals(List.of("c50_0_0"), registry.fieldNames());
        assertEquals(Set.of("ukb_pheno_1_00"), registry.tablesFor(List.of("c50_0_0")));
    }

    // ==================== Reads ====================

    @Test
    @DisplayName("Unregistered fields fail validation, an empty field set needs no table")
    void testTablesFor() {
        registry.register(List.of(entry("c50_0_0", "ukb_pheno_0_00")));

        ValidationException ex = assertThrows(ValidationException.class,
                () -> registry.tablesFor(List.of("c50_0_0", "c77_0_0")));
        assertTrue(ex.getMessage().contains("c77_0_0"));
        assertTrue(registry.tablesFor(List.of()).isEmpty());
    }
}
