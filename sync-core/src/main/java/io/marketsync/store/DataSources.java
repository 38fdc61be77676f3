package io.marketsync.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public final class DataSources {
    private DataSources() {}

    public static HikariDataSource pooled(DbSettings settings) {
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("marketsync-" + settings.name());
        cfg.setJdbcUrl(settings.jdbcUrl());
        if (settings.user() != null) cfg.setUsername(settings.user());
        if (settings.password() != null) cfg.setPassword(settings.password());
        cfg.setMaximumPoolSize(settings.maxPoolSize());
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        // TiDB/MySQL drop idle connections; recycle before the server does.
        cfg.setMaxLifetime(600_000);
        cfg.setKeepaliveTime(120_000);
        if (settings.jdbcUrl().startsWith("jdbc:mysql:")) {
            cfg.addDataSourceProperty("rewriteBatchedStatements", "true");
            cfg.addDataSourceProperty("cachePrepStmts", "true");
        }
        return new HikariDataSource(cfg);
    }
}
