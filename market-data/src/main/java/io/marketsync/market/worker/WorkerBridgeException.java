package io.marketsync.market.worker;

import io.marketsync.error.SyncException;

public class WorkerBridgeException extends SyncException {
    public WorkerBridgeException(String message) {
        super(message);
    }

    public WorkerBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
