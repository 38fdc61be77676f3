package io.marketsync.market.sync;

import io.marketsync.core.WriteMode;
import io.marketsync.market.calendar.TradingCalendar;
import io.marketsync.market.jobs.JobRegistry;
import io.marketsync.market.jobs.JobSpec;
import io.marketsync.market.jobs.SyncJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Multi-table runs against the master store. The calendar is always refreshed first because every
 * other job derives its window from it.
 */
public class MasterSync {
    private static final Logger log = LoggerFactory.getLogger(MasterSync.class);

    public static final String TRADE_CAL = "trade_cal";
    public static final String STOCK_BASIC = "stock_basic";
    static final List<String> BACKFILL_ORDER = List.of(
            "daily_raw", "adj_factor", "moneyflow_ind", "moneyflow_sector", "moneyflow_mkt",
            "moneyflow_hsgt", "suspend_d", "st_list", "index_daily");
    static final int MIN_CALENDAR_YEARS = 5;

    private final JobRegistry registry;
    private final SyncEngine engine;

    public MasterSync(JobRegistry registry, SyncEngine engine) {
        this.registry = registry;
        this.engine = engine;
    }

    /**
     * Runs {@code tables} (all registered jobs when empty) in order: calendar, instrument list, then the
     * rest as given. The calendar window is widened so it covers the longest retention of any selected job.
     */
    public List<SyncResult> update(List<String> tables, SyncRequest req) {
        List<String> ordered = order(tables == null || tables.isEmpty() ? registry.names() : tables);
        int maxKeep = registry.maxRetentionOpenDays(ordered);
        LocalDate end = req.end() != null ? req.end() : LocalDate.now(engine.context().clock());

        List<SyncResult> out = new ArrayList<>();
        for (String name : ordered) {
            SyncJob job = registry.get(name);
            SyncRequest r = req;
            if (TRADE_CAL.equals(name)) {
                LocalDate minStart = end.minusDays(365L * calendarYears(maxKeep));
                if (req.start() == null || req.start().isAfter(minStart)) r = req.withStart(minStart);
            }
            out.add(engine.run(job, r));
        }
        return out;
    }

    List<String> order(List<String> tables) {
        for (String t : tables) registry.get(t);
        List<String> ordered = new ArrayList<>();
        ordered.add(TRADE_CAL);
        if (tables.contains(STOCK_BASIC)) ordered.add(STOCK_BASIC);
        for (String t : tables) {
            if (!ordered.contains(t)) ordered.add(t);
        }
        return ordered;
    }

    static int calendarYears(int maxKeepOpenDays) {
        return maxKeepOpenDays > 0 ? Math.max(MIN_CALENDAR_YEARS, maxKeepOpenDays / 200 + 2) : MIN_CALENDAR_YEARS;
    }

    /**
     * Rebuilds the last {@code keepOpenDays} open days of every selected table month by month, with
     * retention deferred to a single pass at the end.
     */
    public MasterBackfillResult backfill(int keepOpenDays, LocalDate end, WriteMode mode, List<String> tables) {
        LocalDate e = end != null ? end : LocalDate.now(engine.context().clock());
        SyncRequest base = SyncRequest.defaults().withEnd(e).withMode(mode).withSkipRetention(true);

        log.info("ensuring {}/{} before backfill", TRADE_CAL, STOCK_BASIC);
        engine.run(registry.get(TRADE_CAL), base.withStart(e.minusDays(365L * calendarYears(keepOpenDays))));
        engine.run(registry.get(STOCK_BASIC), base);

        TradingCalendar calendar = engine.context().calendar();
        LocalDate cutoff = calendar.requireCutoff(JobSpec.DEFAULT_EXCHANGE, e, keepOpenDays);
        log.info("backfill cutoff {} for last {} open days ending {}", cutoff, keepOpenDays, e);

        List<String> selected = new ArrayList<>();
        for (String t : tables == null || tables.isEmpty() ? registry.names() : tables) {
            registry.get(t);
            if (!TRADE_CAL.equals(t) && !STOCK_BASIC.equals(t) && !selected.contains(t)) selected.add(t);
        }
        List<String> ordered = new ArrayList<>();
        for (String t : BACKFILL_ORDER) if (selected.contains(t)) ordered.add(t);
        for (String t : selected) if (!ordered.contains(t)) ordered.add(t);

        List<SyncResult> runs = new ArrayList<>();
        for (LocalDate month = cutoff.withDayOfMonth(1); !month.isAfter(e); month = month.plusMonths(1)) {
            LocalDate from = month.isBefore(cutoff) ? cutoff : month;
            LocalDate monthEnd = month.plusMonths(1).minusDays(1);
            LocalDate to = monthEnd.isAfter(e) ? e : monthEnd;
            log.info("backfill month {} -> {}", from, to);
            for (String t : ordered) {
                SyncResult r = engine.run(registry.get(t), base.withStart(from).withEnd(to));
                log.info("  {} fetched={} affected={} cursor={}", t, r.rowsFetched(), r.rowsAffected(), r.cursorValue());
                runs.add(r);
            }
        }

        Map<String, Long> deleted = new LinkedHashMap<>();
        for (String t : ordered) {
            JobSpec spec = registry.get(t).spec();
            if (!spec.hasRetention()) continue;
            Optional<LocalDate> tableCutoff = calendar.cutoffByLastOpenDays(spec.exchange(), e, spec.retentionOpenDays());
            if (tableCutoff.isEmpty()) {
                log.warn("{}: calendar too short for {} open days, retention skipped", t, spec.retentionOpenDays());
                continue;
            }
            long n = engine.enforceRetention(spec, tableCutoff.get());
            log.info("  retention {} before {} deleted={}", t, tableCutoff.get(), n);
            deleted.put(t, n);
        }
        return new MasterBackfillResult(cutoff, runs, deleted);
    }
}
