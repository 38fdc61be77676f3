package io.marketsync.market.worker;

import com.codahale.metrics.Timer;
import io.marketsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Launches the configured worker command once per order. Keys travel in a temp file to stay clear of
 * command-line length limits; failures are reported through the {@code <out>.err.txt} side file.
 */
public class ProcessWorkerBridge implements WorkerBridge {
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerBridge.class);

    private final WorkerSettings settings;
    private final Metrics metrics;

    public ProcessWorkerBridge(WorkerSettings settings, Metrics metrics) {
        this.settings = settings;
        this.metrics = metrics;
    }

    @Override
    public void run(WorkOrder order) {
        metrics.counter(Metrics.WORKER_RUNS).inc();
        try (Timer.Context ignored = metrics.timer(Metrics.WORKER_TIME).time()) {
            runProcess(order);
            awaitOutput(order.output());
        } catch (WorkerBridgeException e) {
            metrics.counter(Metrics.WORKER_FAILURES).inc();
            throw e;
        }
    }

    List<String> command(WorkOrder order, Path codesFile) {
        List<String> cmd = new ArrayList<>(settings.command());
        cmd.add("--codes-file");
        cmd.add(codesFile.toString());
        cmd.add("--start");
        cmd.add(order.start().format(BarFiles.COMPACT_TIMESTAMP));
        cmd.add("--end");
        cmd.add(order.end().format(BarFiles.COMPACT_TIMESTAMP));
        cmd.add("--out");
        cmd.add(order.output().toString());
        cmd.add("--period");
        cmd.add(order.period());
        if (settings.sitePackages() != null && !settings.sitePackages().isBlank()) {
            cmd.add("--site-packages");
            cmd.add(settings.sitePackages());
        }
        return cmd;
    }

    private void runProcess(WorkOrder order) {
        Path codesFile = null;
        Path errFile = BarFiles.errorReportPath(order.output());
        try {
            codesFile = Files.createTempFile("marketsync-codes-", ".txt");
            Files.write(codesFile, order.keys(), StandardCharsets.UTF_8);
            Files.deleteIfExists(errFile);
            Files.deleteIfExists(order.output());
            Path parent = order.output().toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            List<String> cmd = command(order, codesFile);
            log.debug("worker: {} keys {}..{} -> {}", order.keys().size(), order.start(), order.end(), order.output());
            Process p = new ProcessBuilder(cmd).inheritIO().start();
            if (!p.waitFor(settings.exitTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new WorkerBridgeException("worker did not exit within " + settings.exitTimeout() + " for " + order.output());
            }
            int code = p.exitValue();
            if (code != 0) {
                StringBuilder msg = new StringBuilder("worker failed with code ").append(code);
                if (Files.exists(errFile)) {
                    msg.append('\n').append(Files.readString(errFile, StandardCharsets.UTF_8));
                }
                throw new WorkerBridgeException(msg.toString());
            }
        } catch (IOException e) {
            throw new WorkerBridgeException("cannot run worker for " + order.output(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerBridgeException("interrupted waiting for worker", e);
        } finally {
            if (codesFile != null) {
                try {
                    Files.deleteIfExists(codesFile);
                } catch (IOException e) {
                    log.warn("could not remove {}", codesFile, e);
                }
            }
        }
    }

    // some launchers return before the file is flushed
    private void awaitOutput(Path out) {
        long deadline = System.nanoTime() + settings.outputDeadline().toNanos();
        while (true) {
            try {
                if (Files.exists(out) && Files.size(out) > 0) return;
            } catch (IOException e) {
                log.debug("stat {} failed, retrying", out, e);
            }
            if (System.nanoTime() >= deadline) break;
            try {
                Thread.sleep(settings.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkerBridgeException("interrupted waiting for " + out, e);
            }
        }
        throw new WorkerBridgeException("worker did not produce output in time: " + out);
    }
}
