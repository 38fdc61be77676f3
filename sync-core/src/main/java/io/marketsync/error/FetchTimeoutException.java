package io.marketsync.error;

import java.time.Duration;

/** An upstream call did not return before the watchdog deadline. Always transient. */
public class FetchTimeoutException extends SyncException {
    private final Duration timeout;

    public FetchTimeoutException(String label, Duration timeout) {
        super(label + " timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration timeout() { return timeout; }
}
