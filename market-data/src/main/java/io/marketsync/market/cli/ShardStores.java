package io.marketsync.market.cli;

import io.marketsync.cursor.JdbcCursorStore;
import io.marketsync.market.config.SyncConfig;
import io.marketsync.market.minute.ShardStore;
import io.marketsync.store.DataSources;
import io.marketsync.store.DbSettings;
import io.marketsync.store.JdbcRelationalStore;
import io.marketsync.store.SqlDialect;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/** Opens a shard's pool on first use only, so commands that touch one shard need only that shard configured. */
public class ShardStores implements Function<String, ShardStore> {
    private final SyncConfig config;
    private final Lifecycle lifecycle;
    private final Map<String, ShardStore> open = new ConcurrentHashMap<>();

    public ShardStores(SyncConfig config, Lifecycle lifecycle) {
        this.config = config;
        this.lifecycle = lifecycle;
    }

    @Override
    public ShardStore apply(String shard) {
        return open.computeIfAbsent(shard, this::connect);
    }

    private ShardStore connect(String shard) {
        DbSettings db = config.db(shard);
        JdbcRelationalStore store = new JdbcRelationalStore(lifecycle.register(DataSources.pooled(db)), SqlDialect.forUrl(db.jdbcUrl()));
        return new ShardStore(shard, store, new JdbcCursorStore(store));
    }
}
