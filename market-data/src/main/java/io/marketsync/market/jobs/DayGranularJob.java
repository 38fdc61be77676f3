package io.marketsync.market.jobs;

import io.marketsync.core.Row;

import java.time.LocalDate;
import java.util.List;

public final class DayGranularJob implements SyncJob {
    @FunctionalInterface
    public interface DayFetch {
        List<Row> fetch(LocalDate day, List<String> entityKeys);
    }

    private final JobSpec spec;
    private final DayFetch fetch;
    private final RowTransform post;

    public DayGranularJob(JobSpec spec, DayFetch fetch, RowTransform post) {
        if (spec.strategy() != FetchStrategy.DAY_GRANULAR) {
            throw new IllegalArgumentException(spec.resource() + " is not day-granular");
        }
        this.spec = spec;
        this.fetch = fetch;
        this.post = post == null ? RowTransform.identity() : post;
    }

    @Override
    public JobSpec spec() { return spec; }

    @Override
    public List<Row> fetch(FetchWindow window) {
        if (!window.singleDay()) {
            throw new IllegalArgumentException(spec.resource() + " fetches one day at a time, got " + window);
        }
        List<Row> rows = fetch.fetch(window.start(), window.entityKeys());
        return rows == null || rows.isEmpty() ? List.of() : post.apply(rows);
    }
}
