package io.marketsync.market.tushare;

import io.marketsync.core.Row;
import io.marketsync.retry.Pager;
import io.marketsync.retry.RetryingFetcher;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Paced, retried, time-bounded access to the upstream. Every call goes through one shared
 * {@link RetryingFetcher} so the per-minute call budget holds across jobs.
 */
public class TushareApi {
    private final TushareClient client;
    private final RetryingFetcher fetcher;

    public TushareApi(TushareClient client, RetryingFetcher fetcher) {
        this.client = client;
        this.fetcher = fetcher;
    }

    public List<Row> query(String api, Map<String, Object> params) {
        return fetcher.fetch(api + params, () -> client.query(api, params, ""));
    }

    /** Offset paging for APIs that cap rows per call. */
    public List<Row> queryPaged(String api, int limit, Map<String, Object> params) {
        return Pager.fetchAll(limit, (l, offset) -> {
            Map<String, Object> p = new LinkedHashMap<>(params);
            p.put("limit", l);
            p.put("offset", offset);
            return query(api, p);
        });
    }

    /** Ordered parameter map; {@code keysAndValues} alternates name, value. */
    public static Map<String, Object> params(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) throw new IllegalArgumentException("odd number of arguments");
        Map<String, Object> p = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            p.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return p;
    }
}
