package io.marketsync.budget;

/**
 * Caps outbound calls per rolling time window. Shared by every fetcher in a process.
 */
public interface RateLimiter {
    /** Block until a call slot is available, then take it. */
    void acquire() throws InterruptedException;

    static RateLimiter unlimited() {
        return () -> {};
    }
}
