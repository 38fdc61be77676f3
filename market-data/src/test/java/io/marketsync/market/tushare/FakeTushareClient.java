package io.marketsync.market.tushare;

import io.marketsync.core.Row;
import io.marketsync.metrics.Metrics;
import io.marketsync.retry.ExponentialBackoffRetryPolicy;
import io.marketsync.retry.RetryingFetcher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/** Records every call and answers from a handler; unknown APIs return nothing. */
public class FakeTushareClient implements TushareClient {
    public static final class Call {
        public final String api;
        public final Map<String, Object> params;

        Call(String api, Map<String, Object> params) {
            this.api = api;
            this.params = params;
        }

        public Object param(String name) { return params.get(name); }
    }

    private final List<Call> calls = new ArrayList<>();
    private BiFunction<String, Map<String, Object>, List<Row>> handler = (api, params) -> List.of();

    public FakeTushareClient answer(BiFunction<String, Map<String, Object>, List<Row>> handler) {
        this.handler = handler;
        return this;
    }

    @Override
    public synchronized List<Row> query(String api, Map<String, Object> params, String fields) {
        calls.add(new Call(api, new LinkedHashMap<>(params)));
        List<Row> rows = handler.apply(api, params);
        return rows == null ? new ArrayList<>() : new ArrayList<>(rows);
    }

    public List<Call> calls() { return calls; }

    public List<Call> calls(String api) {
        return calls.stream().filter(c -> c.api.equals(api)).collect(Collectors.toList());
    }

    public TushareApi api() {
        return new TushareApi(this, RetryingFetcher.forDatabase(new ExponentialBackoffRetryPolicy(1, 1, 1), Metrics.detached()));
    }
}
