package io.marketsync.market.jobs;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Inclusive date range handed to a job, plus an optional entity-key filter (empty = all entities).
 */
public record FetchWindow(LocalDate start, LocalDate end, List<String> entityKeys) {
    public FetchWindow {
        if (start.isAfter(end)) throw new IllegalArgumentException("start " + start + " after end " + end);
        entityKeys = entityKeys == null ? List.of() : List.copyOf(entityKeys);
    }

    public static FetchWindow day(LocalDate day, List<String> entityKeys) {
        return new FetchWindow(day, day, entityKeys);
    }

    public boolean singleDay() { return start.equals(end); }

    /** yyyyMMdd, the upstream's date parameter format. */
    public static String compact(LocalDate d) { return d.format(DateTimeFormatter.BASIC_ISO_DATE); }
}
