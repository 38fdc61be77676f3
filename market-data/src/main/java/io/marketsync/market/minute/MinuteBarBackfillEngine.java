package io.marketsync.market.minute;

import io.marketsync.core.Row;
import io.marketsync.cursor.CursorAdvancer;
import io.marketsync.cursor.CursorKey;
import io.marketsync.cursor.CursorStore;
import io.marketsync.cursor.CursorValues;
import io.marketsync.error.SyncException;
import io.marketsync.market.calendar.TradingCalendar;
import io.marketsync.market.calendar.TradingSession;
import io.marketsync.market.jobs.RowTransform;
import io.marketsync.market.jobs.RowTransforms;
import io.marketsync.market.shard.ShardRouter;
import io.marketsync.market.sync.SyncSettings;
import io.marketsync.market.worker.BarFiles;
import io.marketsync.market.worker.WorkOrder;
import io.marketsync.market.worker.WorkerBridge;
import io.marketsync.market.worker.WorkerBridgeException;
import io.marketsync.metrics.Metrics;
import io.marketsync.retry.RetryingFetcher;
import io.marketsync.store.ColumnType;
import io.marketsync.store.RelationalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Resumable 5-minute bar backfill. Work is split day by shard by chunk; each chunk is delegated to the
 * worker bridge, written, and recorded as {@code day@nextChunk} so a crash resumes at the first unwritten
 * chunk. The day cursor moves only once every chunk of the day is written.
 */
public class MinuteBarBackfillEngine {
    private static final Logger log = LoggerFactory.getLogger(MinuteBarBackfillEngine.class);

    public static final String TABLE = "minute_5m";
    public static final String DAY_COLUMN = "trade_date";
    public static final String PROGRESS_COLUMN = "trade_date_next_i";
    public static final List<String> PRIMARY_KEYS = List.of("ts_code", "trade_time");
    static final String EXCHANGE = "SSE";
    static final String PROBE_KEY = "000001.SZ";
    static final int PROBE_RECENT_DAYS = 10;

    private static final RowTransform BAR_TRANSFORM =
            RowTransforms.compactTimestamp("trade_time").andThen(RowTransforms.lotsToShares("volume"));

    private final TradingCalendar calendar;
    private final RelationalStore masterStore;
    private final ShardRouter router;
    private final Function<String, ShardStore> shards;
    private final WorkerBridge bridge;
    private final Metrics metrics;
    private final Clock clock;
    private final TradingSession session;
    private final Path workDir;
    private final boolean keepFiles;
    private final SyncSettings settings;
    private final int parallelism;
    private final RetryingFetcher storeRetrying;

    MinuteBarBackfillEngine(TradingCalendar calendar, RelationalStore masterStore, ShardRouter router,
                            Function<String, ShardStore> shards, WorkerBridge bridge, Metrics metrics, Clock clock,
                            TradingSession session, Path workDir, boolean keepFiles, SyncSettings settings, int parallelism,
                            RetryingFetcher storeRetrying) {
        this.calendar = calendar;
        this.masterStore = masterStore;
        this.router = router;
        this.shards = shards;
        this.bridge = bridge;
        this.metrics = metrics;
        this.clock = clock;
        this.session = session;
        this.workDir = workDir;
        this.keepFiles = keepFiles;
        this.settings = settings;
        this.parallelism = parallelism;
        this.storeRetrying = storeRetrying;
    }

    public static MinuteBarBackfillEngineBuilder builder() { return new MinuteBarBackfillEngineBuilder(); }

    static Map<String, ColumnType> tableSchema() {
        Map<String, ColumnType> cols = new LinkedHashMap<>();
        cols.put("ts_code", ColumnType.VARCHAR_32);
        cols.put("trade_time", ColumnType.TIMESTAMP);
        for (String c : List.of("open", "high", "low", "close", "amount", "vol_share")) cols.put(c, ColumnType.DOUBLE);
        return cols;
    }

    public BackfillResult run(BackfillRequest req) {
        LocalDate end = req.end() != null
                ? req.end()
                : calendar.lastCompletedOpenDay(EXCHANGE, LocalDateTime.now(clock), session);
        LocalDate cutoff = req.skipRetention()
                ? calendar.cutoffByLastOpenDays(EXCHANGE, end, req.keepOpenDays()).orElseGet(() -> shortCalendarStart(end, req))
                : calendar.requireCutoff(EXCHANGE, end, req.keepOpenDays());
        List<LocalDate> days = calendar.openDates(EXCHANGE, cutoff, end);
        if (days.size() > req.keepOpenDays()) days = days.subList(days.size() - req.keepOpenDays(), days.size());
        if (days.isEmpty()) return new BackfillResult(TABLE, end, cutoff, Map.of(), Map.of());

        List<String> codes = codes(req);
        if (!req.resume() && req.since() == null) {
            days = availableDays(days, codes);
            if (days.isEmpty()) return new BackfillResult(TABLE, end, cutoff, Map.of(), Map.of());
        }

        Map<String, List<String>> byShard = router.partition(codes);
        for (String shard : byShard.keySet()) prepareShard(shard, days.get(0), req.resetCursor());
        log.info("{}: end={} keep={} cutoff={} days={} codes={} shards={} chunk={} mode={} resume={}",
                TABLE, end, req.keepOpenDays(), cutoff, days.size(), codes.size(), sizes(byShard),
                req.chunkSize(), req.mode(), req.resume());

        Window window = new Window(end, cutoff, days);
        Map<String, Long> affected = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        if (parallelism <= 1) {
            for (Map.Entry<String, List<String>> e : byShard.entrySet()) {
                try {
                    affected.put(e.getKey(), runShard(e.getKey(), e.getValue(), window, req));
                } catch (RuntimeException ex) {
                    log.error("{} {}: shard run aborted", TABLE, e.getKey(), ex);
                    failures.put(e.getKey(), String.valueOf(ex.getMessage()));
                }
            }
        } else {
            runParallel(byShard, window, req, affected, failures);
        }
        return new BackfillResult(TABLE, end, cutoff, affected, failures);
    }

    /** With retention off a short calendar only narrows the window to the open days it does know. */
    private LocalDate shortCalendarStart(LocalDate end, BackfillRequest req) {
        List<LocalDate> known = calendar.openDates(EXCHANGE, LocalDate.EPOCH, end);
        LocalDate start = known.isEmpty() ? end : known.get(0);
        log.warn("{}: trade_cal has fewer than {} open days up to {}, using {}..{} with retention off",
                TABLE, req.keepOpenDays(), end, start, end);
        return start;
    }

    private void runParallel(Map<String, List<String>> byShard, Window window, BackfillRequest req,
                             Map<String, Long> affected, Map<String, String> failures) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, byShard.size()));
        try {
            Map<String, Future<Long>> futures = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> e : byShard.entrySet()) {
                futures.put(e.getKey(), pool.submit(() -> runShard(e.getKey(), e.getValue(), window, req)));
            }
            for (Map.Entry<String, Future<Long>> f : futures.entrySet()) {
                try {
                    affected.put(f.getKey(), f.getValue().get());
                } catch (ExecutionException ex) {
                    log.error("{} {}: shard run aborted", TABLE, f.getKey(), ex.getCause());
                    failures.put(f.getKey(), String.valueOf(ex.getCause().getMessage()));
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SyncException("interrupted waiting for shard runs", ex);
        } finally {
            pool.shutdownNow();
        }
    }

    List<String> codes(BackfillRequest req) {
        List<String> codes;
        if (!req.codes().isEmpty()) {
            codes = new ArrayList<>(new LinkedHashSet<>(req.codes()));
        } else if (masterStore.tableExists("stock_basic")) {
            codes = new ArrayList<>(new TreeSet<>(masterStore.distinctValues("stock_basic", "ts_code")));
        } else {
            codes = new ArrayList<>();
        }
        if (req.maxCodes() > 0 && codes.size() > req.maxCodes()) codes = codes.subList(0, req.maxCodes());
        if (codes.isEmpty()) {
            throw new SyncException("no ts_code found in stock_basic; run `update --tables stock_basic` first");
        }
        return codes;
    }

    /**
     * Drops days the provider has no bars for: trailing days after the newest day with data and leading
     * days before the first. Availability is assumed to be monotonic in time.
     */
    List<LocalDate> availableDays(List<LocalDate> days, List<String> codes) {
        String probe = codes.contains(PROBE_KEY) ? PROBE_KEY : codes.get(0);
        int hi = -1;
        for (int i = 0; i < Math.min(PROBE_RECENT_DAYS, days.size()); i++) {
            int idx = days.size() - 1 - i;
            if (probe(probe, days.get(idx))) {
                hi = idx;
                break;
            }
        }
        if (hi < 0) {
            log.warn("{}: no bars for probe {} in {}..{}", TABLE, probe, days.get(0), days.get(days.size() - 1));
            return List.of();
        }
        List<LocalDate> out = days.subList(0, hi + 1);
        int lo = 0;
        int top = out.size() - 1;
        if (!probe(probe, out.get(0))) {
            while (lo < top) {
                int mid = (lo + top) / 2;
                if (probe(probe, out.get(mid))) top = mid;
                else lo = mid + 1;
            }
        }
        if (lo > 0) {
            log.info("{}: bars start at {} (probe {}), skipping {} earlier open days", TABLE, out.get(lo), probe, lo);
        }
        return out.subList(lo, out.size());
    }

    private boolean probe(String key, LocalDate day) {
        Path out = workDir.resolve(TABLE + "_probe_" + day + ".csv.gz");
        try {
            Files.deleteIfExists(out);
            bridge.run(new WorkOrder(List.of(key), session.start(day), session.end(day), WorkOrder.PERIOD_5M, out));
            return BarFiles.hasBars(out);
        } catch (IOException e) {
            throw new WorkerBridgeException("cannot read probe output " + out, e);
        } finally {
            discard(out);
        }
    }

    private void prepareShard(String shard, LocalDate firstDay, boolean resetCursor) {
        ShardStore s = shards.apply(shard);
        s.cursors().ensureTable();
        s.store().ensureTable(TABLE, tableSchema(), PRIMARY_KEYS);
        if (resetCursor) {
            String value = CursorValues.format(firstDay.minusDays(1));
            s.cursors().set(dayKey(shard), value);
            s.cursors().set(progressKey(shard), null);
            log.info("{} {}: cursor reset to {}", TABLE, shard, value);
        }
    }

    private long runShard(String shard, List<String> codes, Window window, BackfillRequest req) {
        if (codes.isEmpty()) return 0;
        ShardStore s = shards.apply(shard);
        CursorStore cursors = s.cursors();
        CursorAdvancer advancer = new CursorAdvancer(cursors);
        CursorKey dayKey = dayKey(shard);
        CursorKey progressKey = progressKey(shard);

        Optional<LocalDate> cursor = cursors.get(dayKey).flatMap(CursorValues::parseDate);
        Progress progress = Progress.parse(cursors.get(progressKey).orElse(null));
        if (req.resume() && !req.resetCursor()) {
            cursor = fastForward(s, cursor, progress, window);
        }

        LocalDate from = null;
        if (req.since() != null) from = req.since();
        else if (req.resume() && cursor.isPresent()) from = cursor.get().plusDays(1);
        if (req.lookbackDays() > 0) {
            LocalDate lookback = calendar.cutoffByLastOpenDays(EXCHANGE, window.end, req.lookbackDays())
                    .orElse(window.end.minusDays(2L * req.lookbackDays()));
            if (from == null || lookback.isBefore(from)) from = lookback;
        }
        List<LocalDate> shardDays = new ArrayList<>();
        for (LocalDate d : window.days) {
            if (d.isBefore(window.cutoff) || (from != null && d.isBefore(from))) continue;
            shardDays.add(d);
        }
        if (req.maxDays() > 0 && shardDays.size() > req.maxDays()) shardDays = shardDays.subList(0, req.maxDays());

        long total = 0;
        int chunks = (codes.size() + req.chunkSize() - 1) / req.chunkSize();
        for (LocalDate day : shardDays) {
            log.info("{} {}: day={} codes={}", TABLE, shard, day, codes.size());
            int startChunk = 0;
            if (req.resume() && progress != null && progress.day.equals(day)) {
                startChunk = Math.min(progress.nextChunk, chunks);
                if (startChunk > 0) log.info("{} {}: day={} resuming at chunk {}/{}", TABLE, shard, day, startChunk + 1, chunks);
            }
            cursors.set(progressKey, day + "@" + startChunk);
            for (int c = startChunk; c < chunks; c++) {
                List<String> chunk = codes.subList(c * req.chunkSize(), Math.min(codes.size(), (c + 1) * req.chunkSize()));
                long n = runChunk(s, day, chunk, c + 1, chunks, req);
                total += n;
                cursors.set(progressKey, day + "@" + (c + 1));
                pause(req);
            }
            advancer.advance(dayKey, CursorValues.format(day));
            cursors.set(progressKey, null);
            progress = null;
        }

        if (!shardDays.isEmpty() && !req.skipRetention()) {
            retention(s.store(), window.cutoff, shard);
        }
        return total;
    }

    /**
     * Moves the day cursor up to the open day before the newest day in the shard table. That newest day may
     * have been cut short between a chunk write and its progress marker, so it is always run again. A day
     * with recorded chunk progress is partially written, so rows on it never move the cursor.
     */
    private Optional<LocalDate> fastForward(ShardStore s, Optional<LocalDate> cursor, Progress progress, Window window) {
        try {
            s.store().ensureIndex(TABLE, "idx_" + TABLE + "_trade_time", List.of("trade_time"));
        } catch (RuntimeException e) {
            log.warn("{} {}: could not ensure trade_time index", TABLE, s.name(), e);
        }
        Optional<LocalDate> maxDay = storeRetrying
                .fetch(s.name() + " max(trade_time)", () -> s.store().maxTimestamp(TABLE, "trade_time"))
                .map(LocalDateTime::toLocalDate);
        if (maxDay.isEmpty()) return cursor;
        LocalDate d = maxDay.get();
        if (cursor.isPresent() && !d.isAfter(cursor.get())) return cursor;
        if (d.isAfter(window.end) || d.isBefore(window.cutoff)) return cursor;
        if (progress != null && !progress.day.isAfter(d)) {
            log.info("{} {}: {} holds chunk progress {}@{}, not fast-forwarding", TABLE, s.name(), d, progress.day, progress.nextChunk);
            return cursor;
        }
        LocalDate done = null;
        for (LocalDate day : window.days) {
            if (day.isBefore(d)) done = day;
        }
        if (done == null || (cursor.isPresent() && !done.isAfter(cursor.get()))) return cursor;
        new CursorAdvancer(s.cursors()).advance(dayKey(s.name()), CursorValues.format(done));
        log.info("{} {}: fast-forward cursor to {}, rows present up to {}", TABLE, s.name(), done, d);
        return Optional.of(done);
    }

    private long runChunk(ShardStore s, LocalDate day, List<String> chunk, int chunkNo, int chunks, BackfillRequest req) {
        Path out = workDir.resolve(String.format("%s_%s_%s_%dof%d.csv.gz", TABLE, s.name(), day, chunkNo, chunks));
        long t0 = System.nanoTime();
        bridge.run(new WorkOrder(chunk, session.start(day), session.end(day), WorkOrder.PERIOD_5M, out));
        long workerMs = (System.nanoTime() - t0) / 1_000_000;

        List<Row> rows;
        try {
            rows = BarFiles.read(out);
        } catch (IOException e) {
            throw new WorkerBridgeException("cannot read worker output " + out, e);
        } finally {
            discard(out);
        }
        metrics.counter(Metrics.MINUTE_CHUNKS).inc();

        long affected = 0;
        int fetched = rows.size();
        if (!rows.isEmpty()) {
            rows = BAR_TRANSFORM.apply(rows);
            rows.removeIf(r -> r.get("ts_code") == null || r.get("trade_time") == null);
            affected = s.store().write(TABLE, rows, PRIMARY_KEYS, req.mode());
            metrics.counter(Metrics.MINUTE_ROWS_WRITTEN).inc(affected);
        }
        if (chunkNo == 1 || chunkNo == chunks || chunkNo % 10 == 0) {
            log.info("{} {}: day={} chunk={}/{} rows={} affected={} worker={}ms",
                    TABLE, s.name(), day, chunkNo, chunks, fetched, affected, workerMs);
        }
        return affected;
    }

    private void retention(RelationalStore store, LocalDate cutoff, String shard) {
        try {
            store.ensureIndex(TABLE, "idx_" + TABLE + "_trade_time", List.of("trade_time"));
        } catch (RuntimeException e) {
            log.warn("{} {}: could not ensure trade_time index", TABLE, shard, e);
        }
        try {
            long deleted = store.deleteOlderThan(TABLE, "trade_time", cutoff.atStartOfDay(),
                    settings.deleteChunkRows(), settings.deleteMaxLoops());
            metrics.counter(Metrics.ROWS_DELETED).inc(deleted);
            log.info("{} {}: retention before {} deleted={}", TABLE, shard, cutoff, deleted);
        } catch (RuntimeException e) {
            log.warn("{} {}: retention delete before {} failed", TABLE, shard, cutoff, e);
        }
    }

    private void discard(Path out) {
        if (keepFiles) return;
        try {
            Files.deleteIfExists(out);
        } catch (IOException e) {
            log.warn("could not remove {}", out, e);
        }
    }

    private static void pause(BackfillRequest req) {
        if (req.sleepBetweenChunks().isZero() || req.sleepBetweenChunks().isNegative()) return;
        try {
            Thread.sleep(req.sleepBetweenChunks().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException("interrupted between chunks", e);
        }
    }

    static CursorKey dayKey(String shard) { return new CursorKey(shard, TABLE, DAY_COLUMN); }
    static CursorKey progressKey(String shard) { return new CursorKey(shard, TABLE, PROGRESS_COLUMN); }

    private static Map<String, Integer> sizes(Map<String, List<String>> byShard) {
        Map<String, Integer> out = new LinkedHashMap<>();
        byShard.forEach((k, v) -> out.put(k, v.size()));
        return out;
    }

    private static final class Window {
        final LocalDate end;
        final LocalDate cutoff;
        final List<LocalDate> days;

        Window(LocalDate end, LocalDate cutoff, List<LocalDate> days) {
            this.end = end;
            this.cutoff = cutoff;
            this.days = days;
        }
    }

    /** {@code YYYY-MM-DD@<nextChunk>}; anything unparseable reads as no progress. */
    static final class Progress {
        final LocalDate day;
        final int nextChunk;

        Progress(LocalDate day, int nextChunk) {
            this.day = day;
            this.nextChunk = nextChunk;
        }

        static Progress parse(String raw) {
            if (raw == null) return null;
            int at = raw.indexOf('@');
            if (at < 0) return null;
            Optional<LocalDate> day = CursorValues.parseDate(raw.substring(0, at));
            if (day.isEmpty()) return null;
            try {
                return new Progress(day.get(), Math.max(0, Integer.parseInt(raw.substring(at + 1).trim())));
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
