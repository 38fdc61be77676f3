package io.marketsync.market.worker;

import java.time.Duration;
import java.util.List;

/**
 * @param command        executable plus leading arguments; order arguments are appended
 * @param sitePackages   forwarded as {@code --site-packages} when set
 * @param exitTimeout    how long to wait for the worker process to exit
 * @param outputDeadline how long to wait for the output file after a clean exit
 */
public record WorkerSettings(
        List<String> command,
        String sitePackages,
        Duration exitTimeout,
        Duration outputDeadline,
        Duration pollInterval
) {
    public WorkerSettings {
        if (command == null || command.isEmpty()) throw new IllegalArgumentException("worker command is required");
        command = List.copyOf(command);
        if (exitTimeout == null) exitTimeout = Duration.ofMinutes(30);
        if (outputDeadline == null) outputDeadline = Duration.ofSeconds(120);
        if (pollInterval == null) pollInterval = Duration.ofMillis(500);
    }
}
