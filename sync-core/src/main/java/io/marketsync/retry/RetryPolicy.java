package io.marketsync.retry;

public interface RetryPolicy {
    /** Whether the call that failed on {@code attempt} (1-based) should run again. */
    boolean shouldRetry(int attempt, Exception e);

    /** Pause before the attempt following {@code attempt}. */
    long backoffMillis(int attempt);

    int maxAttempts();
}
