package io.marketsync.market.sync;

import java.time.LocalDate;

public record SyncResult(
        String resource,
        LocalDate start,
        LocalDate end,
        long rowsFetched,
        long rowsAffected,
        String cursorColumn,
        String cursorValue,
        LocalDate retentionCutoff,
        long rowsDeleted
) {}
