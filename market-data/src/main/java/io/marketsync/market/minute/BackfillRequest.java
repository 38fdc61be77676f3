package io.marketsync.market.minute;

import io.marketsync.core.WriteMode;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Options of one minute-bar run.
 *
 * @param end          last day to cover; null means the last fully settled open day
 * @param resume       continue from the shard cursors and chunk progress; when false the whole window is
 *                     redone after probing for the first day with data
 * @param maxCodes     cap on the key list, 0 = no cap
 * @param maxDays      cap on days processed per shard, 0 = no cap
 * @param resetCursor  move every shard cursor to the day before the window (the only backwards move)
 * @param codes        explicit keys; empty = every listed instrument in the master store
 * @param since        earliest day to (re)process, overrides the cursor
 * @param lookbackDays always reprocess at least this many recent open days
 */
public record BackfillRequest(
        LocalDate end,
        int keepOpenDays,
        int chunkSize,
        WriteMode mode,
        boolean skipRetention,
        Duration sleepBetweenChunks,
        int maxCodes,
        boolean resume,
        int maxDays,
        boolean resetCursor,
        List<String> codes,
        LocalDate since,
        int lookbackDays
) {
    public BackfillRequest {
        if (keepOpenDays <= 0) throw new IllegalArgumentException("keepOpenDays must be positive");
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be positive");
        if (mode == null) mode = WriteMode.IGNORE;
        if (sleepBetweenChunks == null) sleepBetweenChunks = Duration.ZERO;
        codes = codes == null ? List.of() : List.copyOf(codes);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private LocalDate end;
        private int keepOpenDays = 250;
        private int chunkSize = 400;
        private WriteMode mode = WriteMode.IGNORE;
        private boolean skipRetention;
        private Duration sleepBetweenChunks = Duration.ZERO;
        private int maxCodes;
        private boolean resume;
        private int maxDays;
        private boolean resetCursor;
        private List<String> codes = List.of();
        private LocalDate since;
        private int lookbackDays;

        public Builder end(LocalDate d) { this.end = d; return this; }
        public Builder keepOpenDays(int n) { this.keepOpenDays = n; return this; }
        public Builder chunkSize(int n) { this.chunkSize = n; return this; }
        public Builder mode(WriteMode m) { this.mode = m; return this; }
        public Builder skipRetention(boolean b) { this.skipRetention = b; return this; }
        public Builder sleepBetweenChunks(Duration d) { this.sleepBetweenChunks = d; return this; }
        public Builder maxCodes(int n) { this.maxCodes = n; return this; }
        public Builder resume(boolean b) { this.resume = b; return this; }
        public Builder maxDays(int n) { this.maxDays = n; return this; }
        public Builder resetCursor(boolean b) { this.resetCursor = b; return this; }
        public Builder codes(List<String> c) { this.codes = c; return this; }
        public Builder since(LocalDate d) { this.since = d; return this; }
        public Builder lookbackDays(int n) { this.lookbackDays = n; return this; }

        public BackfillRequest build() {
            return new BackfillRequest(end, keepOpenDays, chunkSize, mode, skipRetention, sleepBetweenChunks,
                    maxCodes, resume, maxDays, resetCursor, codes, since, lookbackDays);
        }
    }
}
