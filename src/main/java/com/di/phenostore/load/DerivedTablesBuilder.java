package com.di.phenostore.load;

import com.di.phenostore.load.source.ColumnNaming;
import com.di.phenostore.registry.FieldEntry;
import com.di.phenostore.registry.FieldRegistry;
import com.di.phenostore.sql.BackendDialect;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rebuilds the tables derived from the shards after every load run: the subject
 * universe ({@code all_eids}), the long-form event table and their indexes.
 */
@Slf4j
@RequiredArgsConstructor
public class DerivedTablesBuilder {

    public static final String ANCHOR_TABLE = "all_eids";
    public static final String EVENTS_TABLE = "events";

    private final JdbcTemplate jdbc;
    private final BackendDialect dialect;

    /**
     * Recreates the anchor table as the union of the subject ids of every shard table.
     *
     * @return number of subjects in the anchor table
     */
    public long rebuildAnchor(List<String> shardTables) {
        jdbc.execute("DROP TABLE IF EXISTS " + ANCHOR_TABLE);
        jdbc.execute("CREATE TABLE " + ANCHOR_TABLE + " (" + ColumnNaming.SUBJECT_ID + " BIGINT NOT NULL PRIMARY KEY)");
        if (!shardTables.isEmpty()) {
            String union = shardTables.stream()
                    .map(t -> "SELECT " + ColumnNaming.SUBJECT_ID + " FROM " + t)
                    .collect(Collectors.joining(" UNION "));
            jdbc.update("INSERT INTO " + ANCHOR_TABLE + " (" + ColumnNaming.SUBJECT_ID + ") " + union);
        }
        long subjects = count(ANCHOR_TABLE);
        log.info("[DERIVED] {} rebuilt from {} shard table(s): {} subjects", ANCHOR_TABLE, shardTables.size(), subjects);
        return subjects;
    }

    /**
     * Recreates the event table from multi-valued categorical fields: one distinct row per
     * subject, field, instance and code. Array columns of the same field and instance may
     * live in different shards and are merged.
     *
     * @return number of event rows
     */
    public long rebuildEvents(List<FieldEntry> categoricalFields) {
        jdbc.execute("DROP TABLE IF EXISTS " + EVENTS_TABLE);
        jdbc.execute("CREATE TABLE " + EVENTS_TABLE + " ("
                + ColumnNaming.SUBJECT_ID + " BIGINT NOT NULL, "
                + "field_id INTEGER NOT NULL, "
                + "instance INTEGER NOT NULL, "
                + "event " + dialect.textType() + " NOT NULL, "
                + "PRIMARY KEY (" + ColumnNaming.SUBJECT_ID + ", field_id, instance, event))");

        Map<String, List<FieldEntry>> byFieldInstance = new LinkedHashMap<>();
        for (FieldEntry e : categoricalFields) {
            if (!e.getFieldId().matches("[0-9]+")) {
                log.warn("[DERIVED] {} has non-numeric field id '{}', not added to {}",
                        e.getFieldName(), e.getFieldId(), EVENTS_TABLE);
                continue;
            }
            int instance = e.getInstance() == null ? 0 : e.getInstance();
            byFieldInstance.computeIfAbsent(e.getFieldId() + "_" + instance, k -> new ArrayList<>()).add(e);
        }

        for (List<FieldEntry> group : byFieldInstance.values()) {
            FieldEntry first = group.get(0);
            int fieldId = Integer.parseInt(first.getFieldId());
            int instance = first.getInstance() == null ? 0 : first.getInstance();
            String columns = group.stream()
                    .map(e -> "SELECT " + ColumnNaming.SUBJECT_ID + ", " + e.getFieldName() + " AS ev FROM "
                            + e.getTableName() + " WHERE " + e.getFieldName() + " IS NOT NULL")
                    .collect(Collectors.joining(" UNION ALL "));
            int rows = jdbc.update("INSERT INTO " + EVENTS_TABLE + " (" + ColumnNaming.SUBJECT_ID + ", field_id, instance, event)"
                    + " SELECT DISTINCT " + ColumnNaming.SUBJECT_ID + ", " + fieldId + ", " + instance + ", ev"
                    + " FROM (" + columns + ") e");
            log.debug("[DERIVED] field {} instance {}: {} event(s)", fieldId, instance, rows);
        }
        long events = count(EVENTS_TABLE);
        log.info("[DERIVED] {} rebuilt from {} field/instance group(s): {} rows",
                EVENTS_TABLE, byFieldInstance.size(), events);
        return events;
    }

    public void createIndexes() {
        jdbc.execute("CREATE INDEX IF NOT EXISTS ix_fields_table_name ON " + FieldRegistry.TABLE + " (table_name)");
        jdbc.execute("CREATE INDEX IF NOT EXISTS ix_events_field_event ON " + EVENTS_TABLE + " (field_id, event)");
    }

    /** Refreshes planner statistics where the backend supports it. */
    public void analyze() {
        String sql = dialect.analyzeStatement();
        if (sql == null) {
            log.info("[DERIVED] {} has no analyze statement, skipped", dialect);
            return;
        }
        jdbc.execute(sql);
        log.info("[DERIVED] {} done", sql);
    }

    private long count(String table) {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return n == null ? 0 : n;
    }
}
