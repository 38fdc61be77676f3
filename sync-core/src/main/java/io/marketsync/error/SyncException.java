package io.marketsync.error;

/** Base class of the unchecked failures raised by a sync run. */
public class SyncException extends RuntimeException {
    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
