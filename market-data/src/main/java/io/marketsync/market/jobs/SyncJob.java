package io.marketsync.market.jobs;

import io.marketsync.core.Row;
import io.marketsync.cursor.CursorValues;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * One synchronizable resource: its static spec plus how to fetch a window of it.
 */
public interface SyncJob {
    JobSpec spec();

    /** Fetches and post-processes the rows of {@code window}. Day-granular jobs expect single-day windows. */
    List<Row> fetch(FetchWindow window);

    /** Max date found in the cursor column, ISO formatted; empty when no row carries one. */
    default Optional<String> extractCursor(List<Row> rows) {
        String column = spec().cursorColumn();
        if (column == null) return Optional.empty();
        LocalDate max = null;
        for (Row r : rows) {
            Object v = r.get(column);
            LocalDate d = v instanceof LocalDate ? (LocalDate) v
                    : v == null ? null : CursorValues.parseDate(v.toString()).orElse(null);
            if (d != null && (max == null || d.isAfter(max))) max = d;
        }
        return Optional.ofNullable(max).map(CursorValues::format);
    }
}
