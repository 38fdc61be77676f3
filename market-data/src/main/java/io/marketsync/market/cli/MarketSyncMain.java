package io.marketsync.market.cli;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.marketsync.core.WriteMode;
import io.marketsync.market.config.SyncConfig;
import io.marketsync.market.minute.BackfillRequest;
import io.marketsync.market.minute.BackfillResult;
import io.marketsync.market.minute.MinuteBarBackfillEngine;
import io.marketsync.market.sync.MasterSync;
import io.marketsync.market.sync.SyncRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command line entry point: incremental and backfill runs for the end-of-day tables and the 5-minute bars.
 */
@CommandLine.Command(name = "market-sync", mixinStandardHelpOptions = true,
        description = "Synchronize market data into relational stores",
        subcommands = {
                MarketSyncMain.Update.class,
                MarketSyncMain.Update5m.class,
                MarketSyncMain.Backfill5m.class,
                MarketSyncMain.BackfillMaster.class
        })
public final class MarketSyncMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(MarketSyncMain.class);

    static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new MarketSyncMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(System.err);
        return 2;
    }

    /** Builds the object graph, runs {@code body}, prints its result as JSON and returns the exit code. */
    static int run(String command, Function<Injector, Object> body) {
        try (Lifecycle lifecycle = new Lifecycle()) {
            Injector injector = Guice.createInjector(new SyncModule(SyncConfig.fromEnv(), lifecycle));
            try {
                Object result = body.apply(injector);
                System.out.println(JSON.writeValueAsString(result));
                return result instanceof BackfillResult && ((BackfillResult) result).failed() ? 1 : 0;
            } catch (Exception e) {
                log.error("{} failed", command, e);
                return 1;
            } finally {
                report(injector.getInstance(MetricRegistry.class));
            }
        }
    }

    private static void report(MetricRegistry registry) {
        Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("io.marketsync.metrics"))
                .build()
                .report();
    }

    static List<String> tables(List<String> raw) {
        List<String> out = new ArrayList<>();
        for (String t : raw) {
            if (t.isBlank() || "all".equalsIgnoreCase(t.trim())) continue;
            out.add(t.trim());
        }
        return out;
    }

    @CommandLine.Command(name = "update", mixinStandardHelpOptions = true, description = "Incremental update of end-of-day tables")
    static final class Update implements Callable<Integer> {
        @CommandLine.Option(names = "--tables", split = ",", defaultValue = "all", description = "Tables (comma-separated) or 'all'")
        List<String> tables = new ArrayList<>();

        @CommandLine.Option(names = "--since", converter = DateConverter.class, description = "Start date, overrides the cursor")
        LocalDate since;

        @CommandLine.Option(names = "--end", converter = DateConverter.class, description = "End date; default today")
        LocalDate end;

        @CommandLine.Option(names = "--lookback-days", defaultValue = "0", description = "Re-fetch at least this many recent open days")
        int lookbackDays;

        @CommandLine.Option(names = "--ts-codes", split = ",", description = "Restrict daily_raw to these codes")
        List<String> tsCodes = new ArrayList<>();

        @CommandLine.Option(names = "--write-mode", defaultValue = "upsert", description = "upsert or ignore")
        String writeMode;

        @CommandLine.Option(names = "--no-delete", description = "Skip retention deletes")
        boolean noDelete;

        SyncRequest request() {
            return new SyncRequest(since, end, lookbackDays, tsCodes, WriteMode.parse(writeMode), noDelete);
        }

        @Override
        public Integer call() {
            return run("update", i -> i.getInstance(MasterSync.class).update(MarketSyncMain.tables(tables), request()));
        }
    }

    @CommandLine.Command(name = "update-5m", mixinStandardHelpOptions = true, description = "Incremental 5-minute bars for given codes")
    static final class Update5m implements Callable<Integer> {
        @CommandLine.Option(names = "--ts-codes", split = ",", required = true, description = "Codes (comma-separated)")
        List<String> tsCodes = new ArrayList<>();

        @CommandLine.Option(names = "--since", converter = DateConverter.class)
        LocalDate since;

        @CommandLine.Option(names = "--end", converter = DateConverter.class, description = "End date; default the last settled open day")
        LocalDate end;

        @CommandLine.Option(names = "--lookback-days", defaultValue = "0")
        int lookbackDays;

        @CommandLine.Option(names = "--keep-open-days", defaultValue = "250")
        int keepOpenDays;

        @CommandLine.Option(names = "--chunk-size", defaultValue = "400")
        int chunkSize;

        @CommandLine.Option(names = "--write-mode", defaultValue = "upsert")
        String writeMode;

        @CommandLine.Option(names = "--no-delete")
        boolean noDelete;

        BackfillRequest request() {
            return BackfillRequest.builder()
                    .codes(tsCodes)
                    .since(since)
                    .end(end)
                    .lookbackDays(lookbackDays)
                    .keepOpenDays(keepOpenDays)
                    .chunkSize(chunkSize)
                    .mode(WriteMode.parse(writeMode))
                    .skipRetention(noDelete)
                    .resume(true)
                    .build();
        }

        @Override
        public Integer call() {
            return run("update-5m", i -> i.getInstance(MinuteBarBackfillEngine.class).run(request()));
        }
    }

    @CommandLine.Command(name = "backfill-5m", mixinStandardHelpOptions = true, description = "Backfill 5-minute bars for the whole market")
    static final class Backfill5m implements Callable<Integer> {
        @CommandLine.Option(names = "--end", converter = DateConverter.class)
        LocalDate end;

        @CommandLine.Option(names = "--keep-open-days", defaultValue = "250")
        int keepOpenDays;

        @CommandLine.Option(names = "--chunk-size", defaultValue = "400")
        int chunkSize;

        @CommandLine.Option(names = "--write-mode", defaultValue = "ignore")
        String writeMode;

        @CommandLine.Option(names = "--no-delete")
        boolean noDelete;

        @CommandLine.Option(names = "--sleep-ms", defaultValue = "0", description = "Pause between chunks")
        long sleepMs;

        @CommandLine.Option(names = "--max-codes", defaultValue = "0")
        int maxCodes;

        @CommandLine.Option(names = "--resume", description = "Continue from shard cursors instead of probing and redoing the window")
        boolean resume;

        @CommandLine.Option(names = "--max-days", defaultValue = "0")
        int maxDays;

        @CommandLine.Option(names = "--reset-cursor")
        boolean resetCursor;

        BackfillRequest request() {
            return BackfillRequest.builder()
                    .end(end)
                    .keepOpenDays(keepOpenDays)
                    .chunkSize(chunkSize)
                    .mode(WriteMode.parse(writeMode))
                    .skipRetention(noDelete)
                    .sleepBetweenChunks(Duration.ofMillis(sleepMs))
                    .maxCodes(maxCodes)
                    .resume(resume)
                    .maxDays(maxDays)
                    .resetCursor(resetCursor)
                    .build();
        }

        @Override
        public Integer call() {
            return run("backfill-5m", i -> i.getInstance(MinuteBarBackfillEngine.class).run(request()));
        }
    }

    @CommandLine.Command(name = "backfill-master", mixinStandardHelpOptions = true, description = "Rebuild the rolling window of end-of-day tables")
    static final class BackfillMaster implements Callable<Integer> {
        @CommandLine.Option(names = "--keep-open-days", defaultValue = "500")
        int keepOpenDays;

        @CommandLine.Option(names = "--end", converter = DateConverter.class)
        LocalDate end;

        @CommandLine.Option(names = "--write-mode", defaultValue = "upsert")
        String writeMode;

        @CommandLine.Option(names = "--tables", split = ",", defaultValue = "all")
        List<String> tables = new ArrayList<>();

        @Override
        public Integer call() {
            return run("backfill-master", i -> i.getInstance(MasterSync.class)
                    .backfill(keepOpenDays, end, WriteMode.parse(writeMode), MarketSyncMain.tables(tables)));
        }
    }
}
