package io.marketsync.market.worker;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * One unit of delegated work: bars for {@code keys} between {@code start} and {@code end}, written
 * to {@code output} as a gzip CSV (see {@link BarFiles}).
 */
public record WorkOrder(List<String> keys, LocalDateTime start, LocalDateTime end, String period, Path output) {
    public static final String PERIOD_5M = "5m";

    public WorkOrder {
        if (keys == null || keys.isEmpty()) throw new IllegalArgumentException("work order needs at least one key");
        keys = List.copyOf(keys);
        if (period == null) period = PERIOD_5M;
    }
}
