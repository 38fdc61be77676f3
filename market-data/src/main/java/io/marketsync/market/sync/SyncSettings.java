package io.marketsync.market.sync;

/**
 * Engine tunables.
 *
 * @param flushRows       day-granular jobs buffer fetched rows and write once this many accumulate
 * @param deleteChunkRows rows per retention delete statement
 * @param deleteMaxLoops  upper bound on retention delete statements per table
 * @param historyYears    first-run lookback for resources without retention
 */
public record SyncSettings(int flushRows, int deleteChunkRows, int deleteMaxLoops, int historyYears) {
    public static SyncSettings defaults() {
        return new SyncSettings(50_000, 20_000, 5_000, 20);
    }
}
