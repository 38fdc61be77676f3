package io.marketsync.market.minute;

import java.time.LocalDate;
import java.util.Map;

/**
 * @param affected rows affected per shard, for every shard that finished
 * @param failures error message per shard that aborted
 */
public record BackfillResult(String table, LocalDate end, LocalDate cutoff, Map<String, Long> affected, Map<String, String> failures) {
    public boolean failed() { return !failures.isEmpty(); }
}
