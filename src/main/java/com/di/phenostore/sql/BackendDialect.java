package com.di.phenostore.sql;

import com.di.phenostore.registry.DataKind;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * The storage backends the store distinguishes. PostgreSQL accepts concurrent bulk
 * imports into different tables; every other backend is treated as single-writer and
 * gets its shard imports serialized.
 */
@Slf4j
public enum BackendDialect {

    POSTGRESQL(true, "TEXT", "DOUBLE PRECISION"),
    H2(false, "VARCHAR", "DOUBLE PRECISION"),
    GENERIC(false, "VARCHAR(4000)", "DOUBLE PRECISION");

    private final boolean concurrentBulkImport;
    private final String textType;
    private final String floatType;

    BackendDialect(boolean concurrentBulkImport, String textType, String floatType) {
        this.concurrentBulkImport = concurrentBulkImport;
        this.textType = textType;
        this.floatType = floatType;
    }

    public boolean supportsConcurrentBulkImport() {
        return concurrentBulkImport;
    }

    public String textType() {
        return textType;
    }

    /** Column type used for a shard column of the given kind. */
    public String columnType(DataKind kind) {
        return switch (kind) {
            case INTEGER -> "BIGINT";
            case CONTINUOUS -> floatType;
            case TIMESTAMP -> "TIMESTAMP";
            case TEXT -> textType;
        };
    }

    /** Statement refreshing planner statistics after a load, or {@code null} when unsupported. */
    public String analyzeStatement() {
        return switch (this) {
            case POSTGRESQL -> "VACUUM ANALYZE";
            case H2 -> "ANALYZE";
            case GENERIC -> null;
        };
    }

    /**
     * Detects the backend from the JDBC metadata product name.
     */
    public static BackendDialect detect(DataSource dataSource) {
        try (Connection con = dataSource.getConnection()) {
            String product = con.getMetaData().getDatabaseProductName();
            BackendDialect dialect = fromProductName(product);
            log.info("[DIALECT] Backend '{}' -> {} (concurrent bulk import: {})",
                    product, dialect, dialect.supportsConcurrentBulkImport());
            return dialect;
        } catch (SQLException e) {
            throw new org.springframework.jdbc.CannotGetJdbcConnectionException("Could not detect backend", e);
        }
    }

    static BackendDialect fromProductName(String product) {
        String p = product == null ? "" : product.toLowerCase(Locale.ROOT);
        if (p.contains("postgres")) {
            return POSTGRESQL;
        }
        if (p.equals("h2")) {
            return H2;
        }
        return GENERIC;
    }
}
