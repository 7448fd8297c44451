package com.di.phenostore.load.stage;

import com.di.phenostore.load.plan.ShardSpec;
import com.di.phenostore.load.source.ColumnNaming;
import com.di.phenostore.registry.DataKind;
import com.di.phenostore.sql.BackendDialect;
import com.di.phenostore.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * DDL for shard tables. A shard table is always replaced as a whole, never altered.
 */
@Slf4j
@RequiredArgsConstructor
public class ShardTableManager {

    private final JdbcTemplate jdbc;
    private final BackendDialect dialect;

    /** Drops any previous table of the same name and creates the shard schema. */
    public void recreate(ShardSpec shard, List<DataKind> kinds) {
        String table = InputValidator.validateIdentifier(shard.getTableName(), "table name");
        StringBuilder ddl = new StringBuilder("CREATE TABLE ").append(table).append(" (")
                .append(ColumnNaming.SUBJECT_ID).append(" BIGINT NOT NULL");
        List<String> columns = shard.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            ddl.append(", ").append(InputValidator.validateIdentifier(columns.get(i), "column name"))
               .append(' ').append(dialect.columnType(kinds.get(i)));
        }
        ddl.append(", PRIMARY KEY (").append(ColumnNaming.SUBJECT_ID).append("))");

        drop(table);
        jdbc.execute(ddl.toString());
        log.debug("[SHARD] Created {} with {} column(s)", table, columns.size());
    }

    public void drop(String table) {
        jdbc.execute("DROP TABLE IF EXISTS " + InputValidator.validateIdentifier(table, "table name"));
    }
}
