package com.di.phenostore.load.stage;

import com.di.phenostore.sql.BackendDialect;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.SQLException;

/**
 * Loads one staging extract into its (already created) shard table through the
 * backend's native bulk path.
 */
public interface BulkImporter {

    /**
     * @return number of rows imported
     */
    long importExtract(ShardLoadTask task) throws SQLException, IOException;

    static BulkImporter forDialect(BackendDialect dialect, DataSource dataSource) {
        return switch (dialect) {
            case POSTGRESQL -> new PostgresCopyImporter(dataSource);
            case H2 -> new H2CsvReadImporter(dataSource);
            case GENERIC -> new JdbcBatchImporter(dataSource, 5_000);
        };
    }
}
