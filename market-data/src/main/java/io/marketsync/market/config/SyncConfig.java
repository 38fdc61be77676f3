package io.marketsync.market.config;

import io.marketsync.market.shard.ShardRouter;
import io.marketsync.market.sync.SyncContext;
import io.marketsync.store.DbSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Runtime settings. Each key is read from a system property first, then an environment variable,
 * then falls back to a default. Databases are configured per scope: {@code <SCOPE>_JDBC_URL},
 * {@code <SCOPE>_USER}, {@code <SCOPE>_PWD} (or {@code marketsync.db.<scope>.url|user|password}).
 */
public record SyncConfig(
        Map<String, DbSettings> databases,
        String tushareToken,
        String tushareUrl,
        int callsPerMinute,
        Duration fetchTimeout,
        int retryAttempts,
        long retryBaseMillis,
        long retryMaxMillis,
        List<String> workerCommand,
        String workerSitePackages,
        Duration workerDeadline,
        Duration workerExitTimeout,
        boolean keepFiles,
        Path workDir,
        List<String> shardNames,
        int shardParallelism,
        List<String> indexWeightCodes
) {
    public static SyncConfig fromEnv() {
        return from(System.getProperties(), System.getenv());
    }

    public static SyncConfig from(Properties props, Map<String, String> env) {
        Lookup l = new Lookup(props, env);
        List<String> shards = csv(l.get("marketsync.shards", "MARKETSYNC_SHARDS", String.join(",", ShardRouter.DEFAULT_SHARDS)));
        int pool = Integer.parseInt(l.get("marketsync.db.pool", "MARKETSYNC_DB_POOL", "4"));

        Map<String, DbSettings> dbs = new LinkedHashMap<>();
        List<String> scopes = new ArrayList<>();
        scopes.add(SyncContext.MASTER_SCOPE);
        scopes.addAll(shards);
        for (String scope : scopes) {
            String url = l.get("marketsync.db." + scope + ".url", scope + "_JDBC_URL", "");
            if (url.isBlank()) continue;
            dbs.put(scope, new DbSettings(scope, url,
                    l.get("marketsync.db." + scope + ".user", scope + "_USER", null),
                    l.get("marketsync.db." + scope + ".password", scope + "_PWD", null),
                    pool));
        }

        String token = l.get("marketsync.tushare.token", "TUSHARE_API_KEY", env.getOrDefault("tushare_API_KEY", ""));
        String cmd = l.get("marketsync.worker.cmd", "MARKETSYNC_WORKER_CMD", "");
        return new SyncConfig(
                dbs,
                token,
                l.get("marketsync.tushare.url", "TUSHARE_URL", "http://api.tushare.pro"),
                Integer.parseInt(l.get("marketsync.tushare.calls.per.min", "TUSHARE_MAX_CALLS_PER_MIN", "300")),
                Duration.ofSeconds(Long.parseLong(l.get("marketsync.fetch.timeout.sec", "MARKETSYNC_FETCH_TIMEOUT_SEC", "45"))),
                Integer.parseInt(l.get("marketsync.retry.attempts", "MARKETSYNC_RETRY_ATTEMPTS", "5")),
                Long.parseLong(l.get("marketsync.retry.base.ms", "MARKETSYNC_RETRY_BASE_MS", "1000")),
                Long.parseLong(l.get("marketsync.retry.max.ms", "MARKETSYNC_RETRY_MAX_MS", "20000")),
                cmd.isBlank() ? List.of() : Arrays.asList(cmd.trim().split("\\s+")),
                l.get("marketsync.worker.site.packages", "MARKETSYNC_WORKER_SITE_PACKAGES", null),
                Duration.ofSeconds(Long.parseLong(l.get("marketsync.worker.deadline.sec", "MARKETSYNC_WORKER_DEADLINE_SEC", "120"))),
                Duration.ofSeconds(Long.parseLong(l.get("marketsync.worker.exit.timeout.sec", "MARKETSYNC_WORKER_EXIT_TIMEOUT_SEC", "1800"))),
                Boolean.parseBoolean(l.get("marketsync.worker.keep.files", "MARKETSYNC_KEEP_WORKER_FILES", "false")),
                Path.of(l.get("marketsync.worker.dir", "MARKETSYNC_WORKER_DIR", System.getProperty("java.io.tmpdir"))),
                shards,
                Integer.parseInt(l.get("marketsync.shard.parallelism", "MARKETSYNC_SHARD_PARALLELISM", "1")),
                csv(l.get("marketsync.index.weight.codes", "INDEX_WEIGHT_CODES", "")));
    }

    public DbSettings db(String scope) {
        DbSettings s = databases.get(scope);
        if (s == null) {
            throw new IllegalStateException("no database configured for " + scope + "; set " + scope + "_JDBC_URL");
        }
        return s;
    }

    public boolean hasWorkerCommand() { return !workerCommand.isEmpty(); }

    static List<String> csv(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        for (String s : raw.split(",")) {
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }

    private static final class Lookup {
        private final Properties props;
        private final Map<String, String> env;

        Lookup(Properties props, Map<String, String> env) {
            this.props = props;
            this.env = env;
        }

        String get(String property, String variable, String def) {
            return props.getProperty(property, env.getOrDefault(variable, def));
        }
    }
}
