package com.di.phenostore.util;

import com.di.phenostore.config.DbConfigSnapshot;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe registry of HikariCP pools, one per JDBC URL + username.
 * <p>
 * The pool is the only resource shared between concurrent queries and loader workers;
 * Hikari serializes acquisition, execution runs on the borrowed connection.
 */
@Slf4j
public enum PooledDataSources {

    INSTANCE;

    private final ConcurrentMap<String, HikariDataSource> dataSourceCache = new ConcurrentHashMap<>();

    /** Stable, positive pool ids for monitoring. */
    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    /**
     * Gets or creates the pool for the given configuration.
     *
     * @param snapshot database configuration snapshot
     * @return pooled DataSource for that URL and user
     */
    public DataSource getOrInit(DbConfigSnapshot snapshot) {
        String connectionKey = snapshot.jdbcUrl() + "|" + snapshot.username();

        return dataSourceCache.computeIfAbsent(connectionKey, key -> {
            int effectiveMinIdle = Math.min(snapshot.minimumIdle(), snapshot.maximumPoolSize());

            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
            hikariConfig.setUsername(snapshot.username());
            hikariConfig.setPassword(snapshot.password());
            if (snapshot.driverClassName() != null && !snapshot.driverClassName().isBlank()) {
                hikariConfig.setDriverClassName(snapshot.driverClassName());
            }
            hikariConfig.setMaximumPoolSize(snapshot.maximumPoolSize());
            hikariConfig.setMinimumIdle(effectiveMinIdle);
            hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
            hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
            hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());

            // Loader DDL and registry writes rely on auto-commit; the result cursor
            // switches it off on its own connection.
            hikariConfig.setAutoCommit(true);

            if (snapshot.jdbcUrl() != null && snapshot.jdbcUrl().contains("postgresql")) {
                hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
            }
            hikariConfig.setPoolName("PhenoPool-" + poolIdCounter.incrementAndGet());

            log.info("[POOL] Creating | url={} | user={} | maxPoolSize={}, minIdle={}",
                    InputValidator.sanitizeForLogging(snapshot.jdbcUrl()), snapshot.username(),
                    snapshot.maximumPoolSize(), effectiveMinIdle);
            return new HikariDataSource(hikariConfig);
        });
    }

    /**
     * Closes and forgets the pool for the given configuration, if any.
     */
    public void close(DbConfigSnapshot snapshot) {
        HikariDataSource dataSource = dataSourceCache.remove(snapshot.jdbcUrl() + "|" + snapshot.username());
        if (dataSource != null) {
            dataSource.close();
            log.info("[POOL] Closed {}", dataSource.getPoolName());
        }
    }

    public void closeAll() {
        log.info("[POOL] Closing all pools (count: {})", dataSourceCache.size());
        dataSourceCache.values().forEach(HikariDataSource::close);
        dataSourceCache.clear();
    }
}
