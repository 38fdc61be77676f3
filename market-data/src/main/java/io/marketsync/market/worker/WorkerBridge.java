package io.marketsync.market.worker;

/** Runs a {@link WorkOrder} somewhere the high-frequency provider is reachable. */
public interface WorkerBridge {
    /** Returns once the order's output file exists and is non-empty; throws {@link WorkerBridgeException} otherwise. */
    void run(WorkOrder order);
}
