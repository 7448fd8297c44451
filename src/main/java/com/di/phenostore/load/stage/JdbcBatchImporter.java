package com.di.phenostore.load.stage;

import com.di.phenostore.load.source.ColumnNaming;
import com.di.phenostore.registry.DataKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * Fallback bulk path for backends without a native CSV loader: batched
 * {@code INSERT}s, values converted according to the column's storage kind.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcBatchImporter implements BulkImporter {

    private final DataSource dataSource;
    private final int batchSize;

    @Override
    public long importExtract(ShardLoadTask task) throws SQLException, IOException {
        List<String> columns = task.shard().getColumns();
        String sql = "INSERT INTO " + task.tableName()
                + " (" + ColumnNaming.SUBJECT_ID + (columns.isEmpty() ? "" : ", " + String.join(", ", columns)) + ")"
                + " VALUES (" + String.join(", ", Collections.nCopies(columns.size() + 1, "?")) + ")";

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .build();

        long rows = 0;
        try (Reader reader = Files.newBufferedReader(task.extract(), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader);
             Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement(sql)) {
            boolean autoCommit = con.getAutoCommit();
            con.setAutoCommit(false);
            try {
                int pending = 0;
                for (CSVRecord record : parser) {
                    ps.setLong(1, Long.parseLong(record.get(0).trim()));
                    for (int i = 0; i < columns.size(); i++) {
                        bind(ps, i + 2, task.kinds().get(i), record.get(i + 1));
                    }
                    ps.addBatch();
                    rows++;
                    if (++pending >= batchSize) {
                        ps.executeBatch();
                        pending = 0;
                    }
                }
                if (pending > 0) {
                    ps.executeBatch();
                }
                con.commit();
            } catch (SQLException | RuntimeException e) {
                con.rollback();
                throw e;
            } finally {
                con.setAutoCommit(autoCommit);
            }
        }
        log.info("[IMPORT] {} <- batch insert {} rows", task.tableName(), rows);
        return rows;
    }

    private static void bind(PreparedStatement ps, int index, DataKind kind, String raw) throws SQLException {
        if (raw == null || raw.isEmpty()) {
            ps.setNull(index, sqlType(kind));
            return;
        }
        String v = raw.trim();
        switch (kind) {
            case INTEGER -> ps.setLong(index, new BigDecimal(v).longValueExact());
            case CONTINUOUS -> ps.setDouble(index, Double.parseDouble(v));
            case TIMESTAMP -> ps.setTimestamp(index, parseTimestamp(v));
            case TEXT -> ps.setString(index, raw);
        }
    }

    private static int sqlType(DataKind kind) {
        return switch (kind) {
            case INTEGER -> Types.BIGINT;
            case CONTINUOUS -> Types.DOUBLE;
            case TIMESTAMP -> Types.TIMESTAMP;
            case TEXT -> Types.VARCHAR;
        };
    }

    static Timestamp parseTimestamp(String v) {
        if (v.length() <= 10) {
            return Timestamp.valueOf(LocalDate.parse(v).atStartOfDay());
        }
        return Timestamp.valueOf(LocalDateTime.parse(v.replace(' ', 'T')));
    }
}
