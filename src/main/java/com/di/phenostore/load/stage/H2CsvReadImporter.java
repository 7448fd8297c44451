package com.di.phenostore.load.stage;

import com.di.phenostore.load.source.ColumnNaming;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * H2 bulk path: {@code INSERT ... SELECT} from the {@code CSVREAD} table function.
 * H2 is a single-writer store, so the orchestrator runs these imports one at a time.
 */
@Slf4j
@RequiredArgsConstructor
public class H2CsvReadImporter implements BulkImporter {

    private final DataSource dataSource;

    @Override
    public long importExtract(ShardLoadTask task) throws SQLException {
        List<String> columns = new ArrayList<>();
        columns.add(ColumnNaming.SUBJECT_ID);
        columns.addAll(task.shard().getColumns());

        List<String> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add("NULLIF(" + column + ", '')");
        }
        String path = task.extract().toAbsolutePath().toString().replace("'", "''");
        String sql = "INSERT INTO " + task.tableName() + " (" + String.join(", ", columns) + ")"
                + " SELECT " + String.join(", ", values)
                + " FROM CSVREAD('" + path + "', NULL, 'charset=UTF-8')";

        try (Connection con = dataSource.getConnection();
             Statement st = con.createStatement()) {
            long rows = st.executeUpdate(sql);
            if (!con.getAutoCommit()) {
                con.commit();
            }
            log.info("[IMPORT] {} <- CSVREAD {} rows", task.tableName(), rows);
            return rows;
        }
    }
}
