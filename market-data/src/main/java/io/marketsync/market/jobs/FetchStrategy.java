package io.marketsync.market.jobs;

public enum FetchStrategy {
    /** One upstream call (or call group) per open trading day in the window. */
    DAY_GRANULAR,
    /** One fetch for the whole window; the job decides how to slice it. */
    RANGE_GRANULAR
}
