package io.marketsync.retry;

import io.marketsync.budget.RateLimiter;
import io.marketsync.error.FetchTimeoutException;
import io.marketsync.error.SyncException;
import io.marketsync.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryingFetcherTest {
    private final Metrics metrics = Metrics.detached();

    private RetryingFetcher fetcher(RateLimiter limiter, Duration timeout) {
        return new RetryingFetcher(limiter, ExponentialBackoffRetryPolicy.transientOnly(5, 1, 5), timeout, metrics);
    }

    @Test
    void retries_transient_failures_then_succeeds() {
        AtomicInteger calls = new AtomicInteger();
        try (RetryingFetcher f = fetcher(RateLimiter.unlimited(), Duration.ofSeconds(5))) {
            String out = f.fetch("daily", () -> {
                if (calls.incrementAndGet() < 3) throw new IOException("Lost connection to server");
                return "ok";
            });
            assertEquals("ok", out);
        }
        assertEquals(3, calls.get());
        assertEquals(2, metrics.counter(Metrics.FETCH_RETRIES).getCount());
    }

    @Test
    void fatal_errors_propagate_without_retry() {
        AtomicInteger calls = new AtomicInteger();
        try (RetryingFetcher f = fetcher(RateLimiter.unlimited(), Duration.ZERO)) {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> f.fetch("daily", () -> {
                calls.incrementAndGet();
                throw new IllegalArgumentException("bad token");
            }));
            assertEquals("bad token", e.getMessage());
        }
        assertEquals(1, calls.get());
        assertEquals(1, metrics.counter(Metrics.FETCH_FATAL).getCount());
    }

    @Test
    void checked_fatal_errors_are_wrapped_with_cause() {
        try (RetryingFetcher f = fetcher(RateLimiter.unlimited(), Duration.ZERO)) {
            SQLException cause = new SQLException("Table 'x' doesn't exist", "42S02", 1146);
            SyncException e = assertThrows(SyncException.class, () -> f.fetch("calendar", () -> { throw cause; }));
            assertSame(cause, e.getCause());
        }
    }

    @Test
    void gives_up_after_retry_budget() {
        AtomicInteger calls = new AtomicInteger();
        try (RetryingFetcher f = fetcher(RateLimiter.unlimited(), Duration.ZERO)) {
            assertThrows(SyncException.class, () -> f.fetch("daily", () -> {
                calls.incrementAndGet();
                throw new SQLException("gone away", "HY000", 2006);
            }));
        }
        assertEquals(5, calls.get());
    }

    @Test
    void watchdog_turns_hangs_into_timeouts_and_retries() {
        AtomicInteger calls = new AtomicInteger();
        try (RetryingFetcher f = fetcher(RateLimiter.unlimited(), Duration.ofMillis(100))) {
            String out = f.fetch("index_daily", () -> {
                if (calls.incrementAndGet() == 1) Thread.sleep(5_000);
                return "late but fine";
            });
            assertEquals("late but fine", out);
        }
        assertEquals(2, calls.get());
        assertEquals(1, metrics.counter(Metrics.FETCH_TIMEOUTS).getCount());
    }

    @Test
    void persistent_hang_surfaces_as_fetch_timeout() {
        RetryingFetcher f = new RetryingFetcher(RateLimiter.unlimited(),
                ExponentialBackoffRetryPolicy.transientOnly(2, 1, 1), Duration.ofMillis(50), metrics);
        try {
            assertThrows(FetchTimeoutException.class, () -> f.fetch("stuck", () -> {
                Thread.sleep(5_000);
                return null;
            }));
        } finally {
            f.close();
        }
    }

    @Test
    void every_attempt_takes_a_rate_limit_slot() {
        AtomicInteger slots = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        try (RetryingFetcher f = fetcher(slots::incrementAndGet, Duration.ZERO)) {
            f.fetch("daily", () -> {
                if (calls.incrementAndGet() < 2) throw new IOException("connection reset");
                return 1;
            });
        }
        assertEquals(2, slots.get());
        assertEquals(2, metrics.counter(Metrics.FETCH_CALLS).getCount());
    }
}
