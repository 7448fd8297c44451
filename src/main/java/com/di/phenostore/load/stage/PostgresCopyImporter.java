package com.di.phenostore.load.stage;

import com.di.phenostore.load.source.ColumnNaming;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * {@code COPY ... FROM STDIN} through the PostgreSQL driver's copy API. Safe to run for
 * several shards at once, each on its own pooled connection.
 */
@Slf4j
@RequiredArgsConstructor
public class PostgresCopyImporter implements BulkImporter {

    private final DataSource dataSource;

    @Override
    public long importExtract(ShardLoadTask task) throws SQLException, IOException {
        String sql = "COPY " + task.tableName()
                + " (" + ColumnNaming.SUBJECT_ID + ", " + String.join(", ", task.shard().getColumns()) + ")"
                + " FROM STDIN WITH (FORMAT csv, HEADER true)";

        try (Connection con = dataSource.getConnection();
             Reader in = Files.newBufferedReader(task.extract(), StandardCharsets.UTF_8)) {
            boolean autoCommit = con.getAutoCommit();
            con.setAutoCommit(true);
            try {
                long rows = con.unwrap(PGConnection.class).getCopyAPI().copyIn(sql, in);
                log.info("[IMPORT] {} <- COPY {} rows", task.tableName(), rows);
                return rows;
            } finally {
                con.setAutoCommit(autoCommit);
            }
        }
    }
}
