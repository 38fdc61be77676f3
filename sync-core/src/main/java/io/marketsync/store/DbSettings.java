package io.marketsync.store;

/** Connection settings for one logical database (the master store or one shard). */
public record DbSettings(String name, String jdbcUrl, String user, String password, int maxPoolSize) {
    public DbSettings {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("missing JDBC url for " + name);
        }
        if (maxPoolSize <= 0) maxPoolSize = 4;
    }

    @Override
    public String toString() {
        return "DbSettings[" + name + " " + jdbcUrl + " user=" + user + "]";
    }
}
