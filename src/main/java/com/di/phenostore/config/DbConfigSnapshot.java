package com.di.phenostore.config;

import java.io.Serializable;

public record DbConfigSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                               int maximumPoolSize, int minimumIdle, long idleTimeoutMs, long connectionTimeoutMs,
                               long maxLifetimeMs) implements Serializable {

    /** Small pool with default timeouts, for embedded databases and tests. */
    public static DbConfigSnapshot of(String jdbcUrl, String username, String password) {
        return new DbConfigSnapshot(jdbcUrl, username, password, null, 4, 1, 600_000L, 30_000L, 1_800_000L);
    }
}
