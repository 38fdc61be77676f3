package io.marketsync.market.jobs;

import io.marketsync.core.Row;

import java.time.LocalDate;
import java.util.List;

public final class RangeGranularJob implements SyncJob {
    @FunctionalInterface
    public interface RangeFetch {
        List<Row> fetch(LocalDate start, LocalDate end, List<String> entityKeys);
    }

    private final JobSpec spec;
    private final RangeFetch fetch;
    private final RowTransform post;

    public RangeGranularJob(JobSpec spec, RangeFetch fetch, RowTransform post) {
        if (spec.strategy() != FetchStrategy.RANGE_GRANULAR) {
            throw new IllegalArgumentException(spec.resource() + " is not range-granular");
        }
        this.spec = spec;
        this.fetch = fetch;
        this.post = post == null ? RowTransform.identity() : post;
    }

    @Override
    public JobSpec spec() { return spec; }

    @Override
    public List<Row> fetch(FetchWindow window) {
        List<Row> rows = fetch.fetch(window.start(), window.end(), window.entityKeys());
        return rows == null || rows.isEmpty() ? List.of() : post.apply(rows);
    }
}
