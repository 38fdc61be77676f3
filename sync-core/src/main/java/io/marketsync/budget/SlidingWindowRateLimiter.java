package io.marketsync.budget;

import io.marketsync.metrics.Metrics;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window limiter: at most {@code capacity} acquisitions complete inside any trailing window.
 * Grant times are kept in a deque; a caller finding the window full waits until the oldest grant
 * ages out. The fair lock hands freed slots out roughly in arrival order.
 */
public class SlidingWindowRateLimiter implements RateLimiter {
    private static final long SLACK_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

    private final int capacity;
    private final long windowNanos;
    private final ArrayDeque<Long> grants = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition windowMoved = lock.newCondition();
    private final Metrics metrics;

    public SlidingWindowRateLimiter(int callsPerMinute) {
        this(callsPerMinute, Duration.ofMinutes(1), null);
    }

    public SlidingWindowRateLimiter(int capacity, Duration window, Metrics metrics) {
        this.capacity = capacity;
        this.windowNanos = window.toNanos();
        this.metrics = metrics;
    }

    public int capacity() { return capacity; }

    @Override
    public void acquire() throws InterruptedException {
        if (capacity <= 0) return;
        lock.lockInterruptibly();
        try {
            boolean counted = false;
            while (true) {
                long now = System.nanoTime();
                while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
                    grants.pollFirst();
                }
                if (grants.size() < capacity) {
                    grants.addLast(now);
                    return;
                }
                if (!counted && metrics != null) {
                    metrics.counter(Metrics.RATELIMIT_WAITS).inc();
                    counted = true;
                }
                long waitNanos = grants.peekFirst() + windowNanos - now + SLACK_NANOS;
                windowMoved.awaitNanos(waitNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Grants still inside the current window. */
    public int inWindow() {
        lock.lock();
        try {
            long now = System.nanoTime();
            int n = 0;
            for (Long g : grants) {
                if (now - g < windowNanos) n++;
            }
            return n;
        } finally {
            lock.unlock();
        }
    }
}
