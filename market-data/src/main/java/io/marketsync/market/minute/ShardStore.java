package io.marketsync.market.minute;

import io.marketsync.cursor.CursorStore;
import io.marketsync.store.RelationalStore;

/** One shard's database: its bar table lives in {@code store}, its day cursor and chunk progress in {@code cursors}. */
public record ShardStore(String name, RelationalStore store, CursorStore cursors) {}
