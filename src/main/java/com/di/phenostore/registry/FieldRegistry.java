package com.di.phenostore.registry;

import com.di.phenostore.exception.ValidationException;
import com.di.phenostore.sql.BackendDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * JDBC repository for the {@code fields} table, which maps every logical field to the
 * shard table holding it.
 * <p>
 * Writes are serialized by a lock and run in one transaction each, so concurrent loads
 * never interleave registry rows. Reads are not cached: each query sees the live registry.
 */
@Slf4j
public class FieldRegistry {

    public static final String TABLE = "fields";

    private static final int IN_LIST_BATCH = 500;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final BackendDialect dialect;
    private final ReentrantLock writeLock = new ReentrantLock();

    public FieldRegistry(JdbcTemplate jdbc, TransactionTemplate tx, BackendDialect dialect) {
        this.jdbc = jdbc;
        this.tx = tx;
        this.dialect = dialect;
    }

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<FieldEntry> ROW_MAPPER = (rs, n) -> FieldEntry.builder()
            .fieldName(rs.getString("column_name"))
            .tableName(rs.getString("table_name"))
            .fieldId(rs.getString("field_id"))
            .instance(nullableInt(rs, "inst"))
            .array(nullableInt(rs, "arr"))
            .coding(nullableInt(rs, "coding"))
            .valueType(rs.getString("value_type"))
            .description(rs.getString("description"))
            .build();

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    /** Drops and recreates an empty registry. */
    public void recreate() {
        writeLock.lock();
        try {
            jdbc.execute("DROP TABLE IF EXISTS " + TABLE);
            jdbc.execute(createTableSql(""));
            log.info("[REGISTRY] Recreated table {}", TABLE);
        } finally {
            writeLock.unlock();
        }
    }

    /** Creates the registry if it does not exist yet. */
    public void ensureExists() {
        writeLock.lock();
        try {
            jdbc.execute(createTableSql("IF NOT EXISTS "));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Appends entries in one transaction. Rows of the entries' shard tables and rows of
     * the same field names are replaced, so the last writer wins when a source is reloaded.
     */
    public void register(List<FieldEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        writeLock.lock();
        try {
            tx.executeWithoutResult(status -> {
                List<String> tables = entries.stream().map(FieldEntry::getTableName).distinct().toList();
                for (List<String> batch : batches(tables)) {
                    jdbc.update("DELETE FROM " + TABLE + " WHERE table_name IN (" + placeholders(batch.size()) + ")",
                            batch.toArray());
                }
                for (List<String> batch : batches(entries.stream().map(FieldEntry::getFieldName).toList())) {
                    jdbc.update("DELETE FROM " + TABLE + " WHERE column_name IN (" + placeholders(batch.size()) + ")",
                            batch.toArray());
                }
                jdbc.batchUpdate("""
                        INSERT INTO fields
                          (column_name, table_name, field_id, inst, arr, coding, value_type, description)
                        VALUES (?,?,?,?,?,?,?,?)
                        """,
                        entries, 1_000, (ps, e) -> {
                            ps.setString(1, e.getFieldName());
                            ps.setString(2, e.getTableName());
                            ps.setString(3, e.getFieldId());
                            ps.setObject(4, e.getInstance(), java.sql.Types.INTEGER);
                            ps.setObject(5, e.getArray(), java.sql.Types.INTEGER);
                            ps.setObject(6, e.getCoding(), java.sql.Types.INTEGER);
                            ps.setString(7, e.getValueType());
                            ps.setString(8, e.getDescription());
                        });
            });
            log.info("[REGISTRY] Registered {} field(s)", entries.size());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes the rows of the given shard tables in one transaction, in batches of at
     * most {@value #IN_LIST_BATCH} table names per statement.
     *
     * @return number of registry rows removed
     */
    public int removeTables(Collection<String> tables) {
        if (tables.isEmpty()) {
            return 0;
        }
        List<String> distinct = List.copyOf(new LinkedHashSet<>(tables));
        writeLock.lock();
        try {
            Integer removed = tx.execute(status -> {
                int n = 0;
                for (List<String> batch : batches(distinct)) {
                    n += jdbc.update("DELETE FROM " + TABLE + " WHERE table_name IN (" + placeholders(batch.size()) + ")",
                            batch.toArray());
                }
                return n;
            });
            log.info("[REGISTRY] Removed {} field(s) of {} table(s)", removed, distinct.size());
            return removed == null ? 0 : removed;
        } finally {
            writeLock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    /** Every registry entry, sorted by field name. */
    public List<FieldEntry> entries() {
        return jdbc.query("SELECT * FROM " + TABLE + " ORDER BY column_name", ROW_MAPPER);
    }

    /** All registered field names, sorted. */
    public List<String> fieldNames() {
        return jdbc.queryForList("SELECT column_name FROM " + TABLE + " ORDER BY column_name", String.class);
    }

    /**
     * Registered entries for the given names. Names that are not registered are absent
     * from the result.
     */
    public Map<String, FieldEntry> resolve(Collection<String> fieldNames) {
        Map<String, FieldEntry> resolved = new LinkedHashMap<>();
        for (List<String> batch : batches(new ArrayList<>(new TreeSet<>(fieldNames)))) {
            jdbc.query("SELECT * FROM " + TABLE + " WHERE column_name IN (" + placeholders(batch.size()) + ")",
                            ROW_MAPPER, batch.toArray())
                    .forEach(e -> resolved.put(e.getFieldName(), e));
        }
        return resolved;
    }

    /** Storage kind of one field, if registered. */
    public java.util.Optional<DataKind> lookupKind(String fieldName) {
        return java.util.Optional.ofNullable(resolve(List.of(fieldName)).get(fieldName)).map(FieldEntry::getKind);
    }

    /** Storage kinds of the registered names among {@code fieldNames}. */
    public Map<String, DataKind> kindsFor(Collection<String> fieldNames) {
        Map<String, DataKind> kinds = new LinkedHashMap<>();
        resolve(fieldNames).forEach((name, entry) -> kinds.put(name, entry.getKind()));
        return kinds;
    }

    /**
     * Like {@link #resolve(Collection)}, but every name must be registered.
     *
     * @throws ValidationException naming every unregistered field
     */
    public Map<String, FieldEntry> resolveAll(Collection<String> fieldNames) {
        Map<String, FieldEntry> resolved = resolve(fieldNames);
        List<String> missing = fieldNames.stream()
                .filter(f -> !resolved.containsKey(f))
                .distinct()
                .sorted()
                .toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("Fields not found in registry: " + String.join(", ", missing));
        }
        return resolved;
    }

    /**
     * Shard tables that must be joined to answer the given field set, sorted by name.
     *
     * @throws ValidationException if any field is not registered
     */
    public Set<String> tablesFor(Collection<String> fieldNames) {
        if (fieldNames.isEmpty()) {
            return Collections.emptySet();
        }
        return tablesOf(resolveAll(fieldNames).values());
    }

    /**
     * Distinct shard tables of resolved entries, sorted. A non-empty entry set always maps
     * to at least one table.
     */
    public static Set<String> tablesOf(Collection<FieldEntry> entries) {
        Set<String> tables = entries.stream()
                .map(FieldEntry::getTableName)
                .filter(java.util.Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
        if (!entries.isEmpty() && tables.isEmpty()) {
            throw new IllegalStateException("Registered fields map to no shard table");
        }
        return tables;
    }

    /**
     * Expands regular expressions against registered field names. A name matches when the
     * expression is found anywhere in it.
     *
     * @return matching names, sorted and distinct
     * @throws ValidationException if an expression does not compile
     */
    public List<String> matching(Collection<String> regexes) {
        if (regexes.isEmpty()) {
            return List.of();
        }
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            try {
                patterns.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new ValidationException("Invalid field regular expression '" + regex + "': " + e.getDescription(), e);
            }
        }
        return fieldNames().stream()
                .filter(name -> patterns.stream().anyMatch(p -> p.matcher(name).find()))
                .distinct()
                .sorted()
                .toList();
    }

    /** Every shard table listed in the registry, sorted. */
    public List<String> shardTables() {
        return jdbc.queryForList("SELECT DISTINCT table_name FROM " + TABLE + " ORDER BY table_name", String.class);
    }

    /** Entries whose declared value type equals {@code valueType}, sorted by field name. */
    public List<FieldEntry> fieldsOfType(String valueType) {
        return jdbc.query("SELECT * FROM " + TABLE + " WHERE value_type = ? ORDER BY column_name", ROW_MAPPER, valueType);
    }

    // ------------------------------------------------------------------

    private String createTableSql(String ifNotExists) {
        String text = dialect.textType();
        return "CREATE TABLE " + ifNotExists + TABLE + " ("
                + "column_name " + text + " NOT NULL PRIMARY KEY, "
                + "table_name " + text + ", "
                + "field_id " + text + ", "
                + "inst INTEGER, "
                + "arr INTEGER, "
                + "coding INTEGER, "
                + "value_type " + text + ", "
                + "description " + text + ")";
    }

    private static List<List<String>> batches(List<String> values) {
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < values.size(); i += IN_LIST_BATCH) {
            batches.add(values.subList(i, Math.min(values.size(), i + IN_LIST_BATCH)));
        }
        return batches;
    }

    static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }
}
