package io.marketsync.budget;

import io.marketsync.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class SlidingWindowRateLimiterTest {
    @Test
    void grants_up_to_capacity_without_waiting() throws Exception {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(5, Duration.ofSeconds(10), null);
        long t0 = System.nanoTime();
        for (int i = 0; i < 5; i++) limiter.acquire();
        long ms = (System.nanoTime() - t0) / 1_000_000;
        assertTrue(ms < 1000, "expected immediate grants but took " + ms + "ms");
        assertEquals(5, limiter.inWindow());
    }

    @Test
    void blocks_until_oldest_grant_leaves_window() throws Exception {
        Metrics metrics = Metrics.detached();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2, Duration.ofMillis(300), metrics);
        limiter.acquire();
        limiter.acquire();
        long t0 = System.nanoTime();
        limiter.acquire();
        long ms = (System.nanoTime() - t0) / 1_000_000;
        // Allow some slack in CI; expect roughly one window of waiting
        assertTrue(ms >= 200, "expected to wait for the window but waited " + ms + "ms");
        assertEquals(1, metrics.counter(Metrics.RATELIMIT_WAITS).getCount());
    }

    @Test
    void never_exceeds_capacity_in_any_trailing_window_under_contention() throws Exception {
        int capacity = 4;
        long windowMs = 300;
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(capacity, Duration.ofMillis(windowMs), null);
        List<Long> grants = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch done = new CountDownLatch(12);
        for (int i = 0; i < 12; i++) {
            pool.submit(() -> {
                try {
                    limiter.acquire();
                    grants.add(System.nanoTime());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdownNow();

        List<Long> sorted = new ArrayList<>(grants);
        Collections.sort(sorted);
        assertEquals(12, sorted.size());
        // any capacity+1 consecutive grants must span at least one window (minus timer slack)
        long slackNanos = TimeUnit.MILLISECONDS.toNanos(60);
        for (int i = capacity; i < sorted.size(); i++) {
            long span = sorted.get(i) - sorted.get(i - capacity);
            assertTrue(span >= TimeUnit.MILLISECONDS.toNanos(windowMs) - slackNanos,
                    "grants " + (i - capacity) + ".." + i + " within " + span / 1_000_000 + "ms");
        }
    }

    @Test
    void non_positive_capacity_means_unlimited() throws Exception {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(0, Duration.ofMinutes(1), null);
        for (int i = 0; i < 1000; i++) limiter.acquire();
        assertEquals(0, limiter.inWindow());
    }
}
