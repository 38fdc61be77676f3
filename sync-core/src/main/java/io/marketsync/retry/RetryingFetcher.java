package io.marketsync.retry;

import com.codahale.metrics.Timer;
import io.marketsync.budget.RateLimiter;
import io.marketsync.error.FetchTimeoutException;
import io.marketsync.error.SyncException;
import io.marketsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a single upstream call: take a rate-limiter slot, run the call under a watchdog,
 * classify a failure, and retry transient ones with backoff. Fatal failures propagate at once.
 * Checked failures surface as {@link SyncException} with the original as cause.
 */
public class RetryingFetcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetryingFetcher.class);

    private final RateLimiter limiter;
    private final RetryPolicy policy;
    private final Duration timeout;
    private final Metrics metrics;
    private final ExecutorService watchdog;

    public RetryingFetcher(RateLimiter limiter, RetryPolicy policy, Duration timeout, Metrics metrics) {
        this.limiter = limiter;
        this.policy = policy;
        this.timeout = timeout == null ? Duration.ZERO : timeout;
        this.metrics = metrics;
        this.watchdog = this.timeout.isZero() ? null : Executors.newCachedThreadPool(new WatchdogThreads());
    }

    /** A fetcher for store queries: no rate limit, no watchdog, same transient classification. */
    public static RetryingFetcher forDatabase(RetryPolicy policy, Metrics metrics) {
        return new RetryingFetcher(RateLimiter.unlimited(), policy, Duration.ZERO, metrics);
    }

    public Duration timeout() { return timeout; }

    public <T> T fetch(String label, Callable<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                limiter.acquire();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new SyncException("interrupted waiting for rate limit: " + label, ie);
            }
            metrics.counter(Metrics.FETCH_CALLS).inc();
            try (Timer.Context ignored = metrics.timer(Metrics.FETCH_TIME).time()) {
                return runGuarded(label, call);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new SyncException("interrupted: " + label, ie);
            } catch (Exception e) {
                if (!policy.shouldRetry(attempt, e)) {
                    if (TransientErrors.isTransient(e)) {
                        log.warn("{} failed after {} attempts: {}", label, attempt, e.toString());
                    } else {
                        metrics.counter(Metrics.FETCH_FATAL).inc();
                    }
                    throw propagate(label, e);
                }
                long backoff = policy.backoffMillis(attempt);
                metrics.counter(Metrics.FETCH_RETRIES).inc();
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        label, attempt, policy.maxAttempts(), backoff, e.toString());
                sleep(label, backoff);
            }
        }
    }

    private <T> T runGuarded(String label, Callable<T> call) throws Exception {
        if (watchdog == null) return call.call();
        Future<T> f = watchdog.submit(call);
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            metrics.counter(Metrics.FETCH_TIMEOUTS).inc();
            throw new FetchTimeoutException(label, timeout);
        } catch (InterruptedException ie) {
            f.cancel(true);
            throw ie;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw ee;
        }
    }

    private static RuntimeException propagate(String label, Exception e) {
        if (e instanceof RuntimeException) return (RuntimeException) e;
        return new SyncException(label + " failed: " + e.getMessage(), e);
    }

    private static void sleep(String label, long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SyncException("interrupted during backoff: " + label, ie);
        }
    }

    @Override
    public void close() {
        if (watchdog != null) watchdog.shutdownNow();
    }

    private static final class WatchdogThreads implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "fetch-watchdog-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
