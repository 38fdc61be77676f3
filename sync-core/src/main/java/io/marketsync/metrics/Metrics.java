package io.marketsync.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin wrapper over a Dropwizard {@link MetricRegistry} holding the names every sync component reports under.
 */
public class Metrics {
    public static final String FETCH_CALLS = "fetch.calls";
    public static final String FETCH_RETRIES = "fetch.retries";
    public static final String FETCH_TIMEOUTS = "fetch.timeouts";
    public static final String FETCH_FATAL = "fetch.fatal";
    public static final String FETCH_TIME = "fetch.time";
    public static final String RATELIMIT_WAITS = "ratelimit.waits";
    public static final String ROWS_FETCHED = "sync.rows.fetched";
    public static final String ROWS_WRITTEN = "sync.rows.written";
    public static final String ROWS_DELETED = "sync.rows.deleted";
    public static final String MINUTE_CHUNKS = "minute.chunks";
    public static final String MINUTE_ROWS_WRITTEN = "minute.rows.written";
    public static final String WORKER_RUNS = "worker.runs";
    public static final String WORKER_FAILURES = "worker.failures";
    public static final String WORKER_TIME = "worker.time";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    /** A registry nobody reports; for tests and one-off tools. */
    public static Metrics detached() { return new Metrics(new MetricRegistry()); }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }
}
