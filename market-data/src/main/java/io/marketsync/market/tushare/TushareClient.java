package io.marketsync.market.tushare;

import io.marketsync.core.Row;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** One raw upstream call. No retries, no pacing. */
public interface TushareClient {
    List<Row> query(String api, Map<String, Object> params, String fields) throws IOException, InterruptedException;
}
