package io.marketsync.market.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.marketsync.budget.RateLimiter;
import io.marketsync.budget.SlidingWindowRateLimiter;
import io.marketsync.cursor.CursorAdvancer;
import io.marketsync.cursor.JdbcCursorStore;
import io.marketsync.market.calendar.JdbcTradingCalendar;
import io.marketsync.market.calendar.TradingCalendar;
import io.marketsync.market.calendar.TradingSession;
import io.marketsync.market.config.SyncConfig;
import io.marketsync.market.jobs.JobRegistry;
import io.marketsync.market.jobs.MasterJobs;
import io.marketsync.market.minute.MinuteBarBackfillEngine;
import io.marketsync.market.shard.ShardRouter;
import io.marketsync.market.sync.MasterSync;
import io.marketsync.market.sync.SyncContext;
import io.marketsync.market.sync.SyncEngine;
import io.marketsync.market.sync.SyncSettings;
import io.marketsync.market.tushare.HttpTushareClient;
import io.marketsync.market.tushare.TushareApi;
import io.marketsync.market.tushare.TushareClient;
import io.marketsync.market.worker.ProcessWorkerBridge;
import io.marketsync.market.worker.WorkerBridge;
import io.marketsync.market.worker.WorkerSettings;
import io.marketsync.metrics.Metrics;
import io.marketsync.retry.ExponentialBackoffRetryPolicy;
import io.marketsync.retry.RetryPolicy;
import io.marketsync.retry.RetryingFetcher;
import io.marketsync.store.DataSources;
import io.marketsync.store.DbSettings;
import io.marketsync.store.JdbcRelationalStore;
import io.marketsync.store.SqlDialect;

import java.time.Clock;
import java.time.Duration;

public class SyncModule extends AbstractModule {
    private final SyncConfig config;
    private final Lifecycle lifecycle;

    public SyncModule(SyncConfig config, Lifecycle lifecycle) {
        this.config = config;
        this.lifecycle = lifecycle;
    }

    @Override
    protected void configure() {
        bind(SyncConfig.class).toInstance(config);
        bind(Lifecycle.class).toInstance(lifecycle);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Clock clock() { return Clock.systemDefaultZone(); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return ExponentialBackoffRetryPolicy.transientOnly(config.retryAttempts(), config.retryBaseMillis(), config.retryMaxMillis());
    }

    @Provides @Singleton RateLimiter rateLimiter(Metrics metrics) { return new SlidingWindowRateLimiter(config.callsPerMinute(), Duration.ofMinutes(1), metrics); }

    @Provides @Singleton RetryingFetcher upstreamFetcher(RateLimiter limiter, RetryPolicy policy, Metrics metrics) {
        return lifecycle.register(new RetryingFetcher(limiter, policy, config.fetchTimeout(), metrics));
    }

    @Provides @Singleton TushareClient tushareClient() { return new HttpTushareClient(config.tushareUrl(), config.tushareToken(), config.fetchTimeout()); }

    @Provides @Singleton TushareApi tushareApi(TushareClient client, RetryingFetcher fetcher) { return new TushareApi(client, fetcher); }

    @Provides @Singleton JdbcRelationalStore masterStore() {
        DbSettings db = config.db(SyncContext.MASTER_SCOPE);
        return new JdbcRelationalStore(lifecycle.register(DataSources.pooled(db)), SqlDialect.forUrl(db.jdbcUrl()));
    }

    @Provides @Singleton CursorAdvancer cursors(JdbcRelationalStore store) {
        JdbcCursorStore cursors = new JdbcCursorStore(store);
        cursors.ensureTable();
        return new CursorAdvancer(cursors);
    }

    @Provides @Singleton TradingCalendar calendar(JdbcRelationalStore store, RetryPolicy policy, Metrics metrics) {
        return new JdbcTradingCalendar(store, RetryingFetcher.forDatabase(policy, metrics));
    }

    @Provides @Singleton JobRegistry registry(TushareApi api) { return MasterJobs.registry(api, config.indexWeightCodes()); }

    @Provides @Singleton SyncContext context(JdbcRelationalStore store, CursorAdvancer cursors, TradingCalendar calendar, Metrics metrics, Clock clock) {
        return new SyncContext(SyncContext.MASTER_SCOPE, store, cursors, calendar, metrics, clock, SyncSettings.defaults());
    }

    @Provides @Singleton SyncEngine engine(SyncContext ctx) { return new SyncEngine(ctx); }

    @Provides @Singleton MasterSync masterSync(JobRegistry registry, SyncEngine engine) { return new MasterSync(registry, engine); }

    @Provides @Singleton ShardRouter router() { return new ShardRouter(config.shardNames()); }

    @Provides @Singleton ShardStores shardStores() { return new ShardStores(config, lifecycle); }

    @Provides @Singleton WorkerBridge workerBridge(Metrics metrics) {
        WorkerSettings settings = new WorkerSettings(config.workerCommand(), config.workerSitePackages(),
                config.workerExitTimeout(), config.workerDeadline(), null);
        return new ProcessWorkerBridge(settings, metrics);
    }

    @Provides @Singleton MinuteBarBackfillEngine minuteEngine(TradingCalendar calendar, JdbcRelationalStore master, ShardRouter router,
                                                              ShardStores shards, WorkerBridge bridge, Metrics metrics, Clock clock,
                                                              RetryPolicy policy) {
        return MinuteBarBackfillEngine.builder()
                .calendar(calendar)
                .masterStore(master)
                .router(router)
                .shards(shards)
                .bridge(bridge)
                .metrics(metrics)
                .clock(clock)
                .session(TradingSession.cnEquities())
                .workDir(config.workDir())
                .keepFiles(config.keepFiles())
                .parallelism(config.shardParallelism())
                .storeRetrying(RetryingFetcher.forDatabase(policy, metrics))
                .build();
    }
}
