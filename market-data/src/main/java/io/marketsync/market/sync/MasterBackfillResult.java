package io.marketsync.market.sync;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * @param cutoff  first open day of the backfilled window
 * @param runs    one result per (month, table) run, in execution order
 * @param deleted rows removed per table by the closing retention pass
 */
public record MasterBackfillResult(LocalDate cutoff, List<SyncResult> runs, Map<String, Long> deleted) {}
