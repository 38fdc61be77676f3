package io.marketsync.market.jobs;

import java.util.List;
import java.util.Objects;

/**
 * Static description of one synchronized resource.
 *
 * @param cursorColumn              column whose max value is the resume point; null for snapshot tables
 * @param retentionOpenDays         rows older than the last N open days are deleted; 0 keeps everything
 * @param retentionColumn           date column retention deletes compare against
 * @param advanceToEndWithoutCursor range jobs only: move the cursor to the window end when rows were
 *                                  written but none carried a cursor value
 */
public record JobSpec(
        String resource,
        List<String> primaryKeys,
        String cursorColumn,
        int retentionOpenDays,
        FetchStrategy strategy,
        String exchange,
        String retentionColumn,
        boolean advanceToEndWithoutCursor
) {
    public static final String DEFAULT_EXCHANGE = "SSE";

    public JobSpec {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(strategy, "strategy");
        if (primaryKeys == null || primaryKeys.isEmpty()) {
            throw new IllegalArgumentException(resource + ": primary key required");
        }
        primaryKeys = List.copyOf(primaryKeys);
        if (exchange == null) exchange = DEFAULT_EXCHANGE;
        if (retentionColumn == null) retentionColumn = cursorColumn != null ? cursorColumn : "trade_date";
    }

    public boolean hasCursor() { return cursorColumn != null; }
    public boolean hasRetention() { return retentionOpenDays > 0; }

    public static Builder day(String resource) { return new Builder(resource, FetchStrategy.DAY_GRANULAR); }
    public static Builder range(String resource) { return new Builder(resource, FetchStrategy.RANGE_GRANULAR); }

    public static final class Builder {
        private final String resource;
        private final FetchStrategy strategy;
        private List<String> keys = List.of();
        private String cursor;
        private int retention;
        private String exchange = DEFAULT_EXCHANGE;
        private String retentionColumn;
        private boolean advanceToEnd;

        private Builder(String resource, FetchStrategy strategy) {
            this.resource = resource;
            this.strategy = strategy;
        }

        public Builder keys(String... keys) { this.keys = List.of(keys); return this; }
        public Builder cursor(String column) { this.cursor = column; return this; }
        public Builder retainOpenDays(int n) { this.retention = n; return this; }
        public Builder exchange(String exchange) { this.exchange = exchange; return this; }
        public Builder retentionColumn(String column) { this.retentionColumn = column; return this; }
        public Builder advanceToEndWithoutCursor() { this.advanceToEnd = true; return this; }

        public JobSpec build() {
            return new JobSpec(resource, keys, cursor, retention, strategy, exchange, retentionColumn, advanceToEnd);
        }
    }
}
