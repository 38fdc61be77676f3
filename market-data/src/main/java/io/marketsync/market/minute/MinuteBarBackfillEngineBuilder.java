package io.marketsync.market.minute;

import io.marketsync.market.calendar.TradingCalendar;
import io.marketsync.market.calendar.TradingSession;
import io.marketsync.market.shard.ShardRouter;
import io.marketsync.market.sync.SyncSettings;
import io.marketsync.market.worker.WorkerBridge;
import io.marketsync.metrics.Metrics;
import io.marketsync.retry.ExponentialBackoffRetryPolicy;
import io.marketsync.retry.RetryingFetcher;
import io.marketsync.store.RelationalStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

public class MinuteBarBackfillEngineBuilder {
    private TradingCalendar calendar;
    private RelationalStore masterStore;
    private ShardRouter router = new ShardRouter(ShardRouter.DEFAULT_SHARDS);
    private Function<String, ShardStore> shards;
    private WorkerBridge bridge;
    private Metrics metrics = Metrics.detached();
    private Clock clock = Clock.systemDefaultZone();
    private TradingSession session = TradingSession.cnEquities();
    private Path workDir = Path.of(System.getProperty("java.io.tmpdir"));
    private boolean keepFiles;
    private SyncSettings settings = SyncSettings.defaults();
    private int parallelism = 1;
    private RetryingFetcher storeRetrying;

    public MinuteBarBackfillEngineBuilder calendar(TradingCalendar c) { this.calendar = c; return this; }
    public MinuteBarBackfillEngineBuilder masterStore(RelationalStore s) { this.masterStore = s; return this; }
    public MinuteBarBackfillEngineBuilder router(ShardRouter r) { this.router = r; return this; }
    public MinuteBarBackfillEngineBuilder shards(Function<String, ShardStore> s) { this.shards = s; return this; }
    public MinuteBarBackfillEngineBuilder bridge(WorkerBridge b) { this.bridge = b; return this; }
    public MinuteBarBackfillEngineBuilder metrics(Metrics m) { this.metrics = m; return this; }
    public MinuteBarBackfillEngineBuilder clock(Clock c) { this.clock = c; return this; }
    public MinuteBarBackfillEngineBuilder session(TradingSession s) { this.session = s; return this; }
    public MinuteBarBackfillEngineBuilder workDir(Path p) { this.workDir = p; return this; }
    public MinuteBarBackfillEngineBuilder keepFiles(boolean k) { this.keepFiles = k; return this; }
    public MinuteBarBackfillEngineBuilder settings(SyncSettings s) { this.settings = s; return this; }
    public MinuteBarBackfillEngineBuilder parallelism(int n) { this.parallelism = Math.max(1, n); return this; }

    public MinuteBarBackfillEngineBuilder storeRetrying(RetryingFetcher r) { this.storeRetrying = r; return this; }

    public MinuteBarBackfillEngine build() {
        Objects.requireNonNull(calendar, "calendar");
        Objects.requireNonNull(masterStore, "masterStore");
        Objects.requireNonNull(shards, "shards");
        Objects.requireNonNull(bridge, "bridge");
        return new MinuteBarBackfillEngine(calendar, masterStore, router, shards, bridge, metrics, clock, session,
                workDir, keepFiles, settings, parallelism,
                storeRetrying != null ? storeRetrying
                        : RetryingFetcher.forDatabase(ExponentialBackoffRetryPolicy.transientOnly(5, 1_000, 20_000), metrics));
    }
}
