package io.marketsync.market.minute;

import io.marketsync.core.Row;
import io.marketsync.market.worker.BarFiles;
import io.marketsync.market.worker.WorkOrder;
import io.marketsync.market.worker.WorkerBridge;
import io.marketsync.market.worker.WorkerBridgeException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/** Writes one bar per key at 5 minutes past the session start for every day inside the available range. */
class FakeWorkerBridge implements WorkerBridge {
    final List<WorkOrder> orders = Collections.synchronizedList(new ArrayList<>());
    LocalDate availableFrom = LocalDate.MIN;
    LocalDate availableTo = LocalDate.MAX;
    private Predicate<WorkOrder> failWhen = o -> false;
    private boolean failOnce;

    FakeWorkerBridge available(LocalDate from, LocalDate to) {
        this.availableFrom = from;
        this.availableTo = to;
        return this;
    }

    FakeWorkerBridge failWhen(Predicate<WorkOrder> p, boolean once) {
        this.failWhen = p;
        this.failOnce = once;
        return this;
    }

    @Override
    public void run(WorkOrder order) {
        orders.add(order);
        if (failWhen.test(order)) {
            if (failOnce) failWhen = o -> false;
            throw new WorkerBridgeException("simulated worker failure for " + order.keys());
        }
        LocalDate day = order.start().toLocalDate();
        List<Row> rows = new ArrayList<>();
        if (!day.isBefore(availableFrom) && !day.isAfter(availableTo)) {
            for (String k : order.keys()) {
                rows.add(Row.of("ts_code", k, "trade_time", order.start().plusMinutes(5).format(BarFiles.COMPACT_TIMESTAMP),
                        "open", 10.0, "high", 10.5, "low", 9.5, "close", 10.2, "volume", 12.0, "amount", 12240.0));
            }
        }
        try {
            BarFiles.write(order.output(), rows);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static LocalDate day(WorkOrder o) { return o.start().toLocalDate(); }

    static boolean isProbe(WorkOrder o) { return o.output().getFileName().toString().contains("_probe_"); }

    List<WorkOrder> chunkOrders() {
        synchronized (orders) {
            return orders.stream().filter(o -> !isProbe(o)).collect(Collectors.toList());
        }
    }

    List<WorkOrder> probeOrders() {
        synchronized (orders) {
            return orders.stream().filter(FakeWorkerBridge::isProbe).collect(Collectors.toList());
        }
    }

    List<LocalDate> chunkDays() {
        return chunkOrders().stream().map(FakeWorkerBridge::day).distinct().collect(Collectors.toList());
    }
}
