package io.marketsync.market.sync;

import io.marketsync.core.Row;
import io.marketsync.cursor.CursorKey;
import io.marketsync.cursor.CursorValues;
import io.marketsync.market.calendar.TradingCalendar;
import io.marketsync.market.jobs.FetchStrategy;
import io.marketsync.market.jobs.FetchWindow;
import io.marketsync.market.jobs.JobSpec;
import io.marketsync.market.jobs.SyncJob;
import io.marketsync.metrics.Metrics;
import io.marketsync.store.RelationalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one job incrementally: derive the window from cursor and retention, fetch, write, advance
 * the cursor, then trim rows that fell out of the retention window.
 */
public class SyncEngine {
    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final SyncContext ctx;

    public SyncEngine(SyncContext ctx) {
        this.ctx = ctx;
    }

    public SyncContext context() { return ctx; }

    public SyncResult run(SyncJob job, SyncRequest req) {
        JobSpec spec = job.spec();
        TradingCalendar calendar = ctx.calendar();
        LocalDate end = req.end() != null ? req.end() : LocalDate.now(ctx.clock());

        LocalDate cutoff = null;
        if (spec.hasRetention() && !req.skipRetention()) {
            cutoff = calendar.requireCutoff(spec.exchange(), end, spec.retentionOpenDays());
        }

        CursorKey key = spec.hasCursor() ? new CursorKey(ctx.scope(), spec.resource(), spec.cursorColumn()) : null;
        Optional<String> stored = key == null ? Optional.empty() : ctx.cursors().store().get(key);
        LocalDate start = resolveStart(spec, req, end, cutoff, stored);
        log.info("{}: window {}..{} cutoff={} cursor={}", spec.resource(), start, end, cutoff, stored.orElse(null));

        Outcome outcome = start.isAfter(end)
                ? new Outcome(0, 0, null)
                : spec.strategy() == FetchStrategy.DAY_GRANULAR
                ? runDays(job, req, start, end)
                : runRange(job, req, start, end);

        String cursorValue = stored.orElse(null);
        if (key != null && outcome.cursorCandidate != null) {
            cursorValue = ctx.cursors().advance(key, outcome.cursorCandidate).orElse(null);
        }

        long deleted = 0;
        if (cutoff != null) {
            deleted = enforceRetention(spec, cutoff);
        }

        SyncResult result = new SyncResult(spec.resource(), start, end, outcome.fetched, outcome.affected,
                spec.cursorColumn(), cursorValue, cutoff, deleted);
        log.info("{}: fetched={} affected={} cursor={} deleted={}",
                spec.resource(), outcome.fetched, outcome.affected, cursorValue, deleted);
        return result;
    }

    LocalDate resolveStart(JobSpec spec, SyncRequest req, LocalDate end, LocalDate cutoff, Optional<String> stored) {
        LocalDate start;
        Optional<LocalDate> cursorDate = stored.flatMap(CursorValues::parseDate);
        if (req.start() != null) {
            start = req.start();
        } else if (cursorDate.isPresent()) {
            start = cursorDate.get().plusDays(1);
        } else if (cutoff != null) {
            start = cutoff;
        } else {
            start = end.minusYears(ctx.settings().historyYears());
        }
        if (cutoff != null && start.isBefore(cutoff)) start = cutoff;

        if (req.lookbackDays() > 0) {
            int k = req.lookbackDays();
            LocalDate lookback = ctx.calendar().cutoffByLastOpenDays(spec.exchange(), end, k)
                    .orElse(end.minusDays(2L * k));
            if (lookback.isBefore(start)) start = lookback;
            if (cutoff != null && start.isBefore(cutoff)) start = cutoff;
        }
        return start;
    }

    private Outcome runDays(SyncJob job, SyncRequest req, LocalDate start, LocalDate end) {
        JobSpec spec = job.spec();
        List<LocalDate> days = ctx.calendar().openDates(spec.exchange(), start, end);
        int flushRows = ctx.settings().flushRows();
        List<Row> buffer = new ArrayList<>();
        long fetched = 0;
        long affected = 0;
        LocalDate maxDayWithData = null;
        for (LocalDate day : days) {
            List<Row> rows = job.fetch(FetchWindow.day(day, req.entityKeys()));
            if (rows.isEmpty()) {
                log.debug("{}: no rows for {}", spec.resource(), day);
                continue;
            }
            buffer.addAll(rows);
            fetched += rows.size();
            maxDayWithData = day;
            if (buffer.size() >= flushRows) {
                affected += write(spec, buffer, req);
                buffer = new ArrayList<>();
            }
        }
        if (!buffer.isEmpty()) affected += write(spec, buffer, req);
        ctx.metrics().counter(Metrics.ROWS_FETCHED).inc(fetched);
        return new Outcome(fetched, affected, maxDayWithData == null ? null : CursorValues.format(maxDayWithData));
    }

    private Outcome runRange(SyncJob job, SyncRequest req, LocalDate start, LocalDate end) {
        JobSpec spec = job.spec();
        List<Row> rows = job.fetch(new FetchWindow(start, end, req.entityKeys()));
        ctx.metrics().counter(Metrics.ROWS_FETCHED).inc(rows.size());
        long affected = rows.isEmpty() ? 0 : write(spec, rows, req);
        String candidate = job.extractCursor(rows).orElse(null);
        if (candidate == null && !rows.isEmpty() && spec.advanceToEndWithoutCursor()) {
            candidate = CursorValues.format(end);
        }
        return new Outcome(rows.size(), affected, candidate);
    }

    private long write(JobSpec spec, List<Row> rows, SyncRequest req) {
        long n = ctx.store().write(spec.resource(), rows, spec.primaryKeys(), req.mode());
        ctx.metrics().counter(Metrics.ROWS_WRITTEN).inc(n);
        return n;
    }

    /**
     * Deletes rows older than {@code cutoff}. Skipped when the table was never created; index and
     * delete failures are logged and reported as zero rows deleted.
     */
    public long enforceRetention(JobSpec spec, LocalDate cutoff) {
        RelationalStore store = ctx.store();
        String table = spec.resource();
        if (!store.tableExists(table)) return 0;
        String column = spec.retentionColumn();
        try {
            store.ensureIndex(table, "idx_" + table + "_" + column, List.of(column));
        } catch (RuntimeException e) {
            log.warn("{}: could not ensure index on {}", table, column, e);
        }
        try {
            SyncSettings s = ctx.settings();
            long deleted = store.deleteOlderThan(table, column, cutoff, s.deleteChunkRows(), s.deleteMaxLoops());
            ctx.metrics().counter(Metrics.ROWS_DELETED).inc(deleted);
            return deleted;
        } catch (RuntimeException e) {
            log.warn("{}: retention delete before {} failed", table, cutoff, e);
            return 0;
        }
    }

    private static final class Outcome {
        final long fetched;
        final long affected;
        final String cursorCandidate;

        Outcome(long fetched, long affected, String cursorCandidate) {
            this.fetched = fetched;
            this.affected = affected;
            this.cursorCandidate = cursorCandidate;
        }
    }
}
