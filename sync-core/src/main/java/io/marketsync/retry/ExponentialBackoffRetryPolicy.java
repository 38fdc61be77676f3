package io.marketsync.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Retries failures accepted by {@code retryable} up to {@code maxAttempts} total attempts.
 * Backoff doubles from {@code baseMillis} up to {@code maxMillis}; with jitter the pause is drawn
 * from the upper half of that bound so concurrent callers spread out but still back off.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final boolean jitter;
    private final Predicate<Throwable> retryable;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, false, e -> true);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis,
                                         boolean jitter, Predicate<Throwable> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.jitter = jitter;
        this.retryable = retryable;
    }

    /** Retries only what {@link TransientErrors} recognizes as a dropped connection or timeout. */
    public static ExponentialBackoffRetryPolicy transientOnly(int maxAttempts, long baseMillis, long maxMillis) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseMillis, maxMillis, true, TransientErrors::isTransient);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts && retryable.test(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = Math.min(baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1))), maxMillis);
        if (!jitter || delay < 2) return delay;
        long half = delay / 2;
        return half + ThreadLocalRandom.current().nextLong(delay - half + 1);
    }

    @Override
    public int maxAttempts() { return maxAttempts; }
}
