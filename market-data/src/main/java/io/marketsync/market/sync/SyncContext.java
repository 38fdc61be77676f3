package io.marketsync.market.sync;

import io.marketsync.cursor.CursorAdvancer;
import io.marketsync.market.calendar.TradingCalendar;
import io.marketsync.metrics.Metrics;
import io.marketsync.store.RelationalStore;

import java.time.Clock;

/** Everything a sync run touches, passed explicitly. */
public record SyncContext(
        String scope,
        RelationalStore store,
        CursorAdvancer cursors,
        TradingCalendar calendar,
        Metrics metrics,
        Clock clock,
        SyncSettings settings
) {
    public static final String MASTER_SCOPE = "AS_MASTER";
}
