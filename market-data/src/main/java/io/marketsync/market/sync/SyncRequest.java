package io.marketsync.market.sync;

import io.marketsync.core.WriteMode;

import java.time.LocalDate;
import java.util.List;

/**
 * Per-invocation overrides. Null dates mean "derive": the end defaults to today and the start
 * to the cursor, the retention cutoff or the history horizon.
 *
 * @param lookbackDays re-fetch at least this many recent open days even when the cursor is newer; 0 disables
 */
public record SyncRequest(
        LocalDate start,
        LocalDate end,
        int lookbackDays,
        List<String> entityKeys,
        WriteMode mode,
        boolean skipRetention
) {
    public SyncRequest {
        entityKeys = entityKeys == null ? List.of() : List.copyOf(entityKeys);
        if (mode == null) mode = WriteMode.UPSERT;
        if (lookbackDays < 0) throw new IllegalArgumentException("lookbackDays must be >= 0");
    }

    public static SyncRequest defaults() {
        return new SyncRequest(null, null, 0, List.of(), WriteMode.UPSERT, false);
    }

    public SyncRequest withStart(LocalDate d) { return new SyncRequest(d, end, lookbackDays, entityKeys, mode, skipRetention); }
    public SyncRequest withEnd(LocalDate d) { return new SyncRequest(start, d, lookbackDays, entityKeys, mode, skipRetention); }
    public SyncRequest withLookbackDays(int n) { return new SyncRequest(start, end, n, entityKeys, mode, skipRetention); }
    public SyncRequest withEntityKeys(List<String> keys) { return new SyncRequest(start, end, lookbackDays, keys, mode, skipRetention); }
    public SyncRequest withMode(WriteMode m) { return new SyncRequest(start, end, lookbackDays, entityKeys, m, skipRetention); }
    public SyncRequest withSkipRetention(boolean skip) { return new SyncRequest(start, end, lookbackDays, entityKeys, mode, skip); }
}
