package io.marketsync.retry;

import java.util.ArrayList;
import java.util.List;

/**
 * (limit, offset) paging for APIs with a server-side row cap. Stops at the first short page;
 * an empty first page means no data.
 */
public final class Pager {
    @FunctionalInterface
    public interface PageFetcher<T> {
        List<T> page(int limit, int offset);
    }

    private Pager() {}

    public static <T> List<T> fetchAll(int limit, PageFetcher<T> fetcher) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);
        List<T> out = new ArrayList<>();
        int offset = 0;
        while (true) {
            List<T> page = fetcher.page(limit, offset);
            if (page == null || page.isEmpty()) break;
            out.addAll(page);
            if (page.size() < limit) break;
            offset += limit;
        }
        return out;
    }
}
