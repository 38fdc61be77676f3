package io.marketsync.market.jobs;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Jobs by resource name, in declaration order. */
public class JobRegistry {
    private final Map<String, SyncJob> jobs = new LinkedHashMap<>();

    public JobRegistry(List<? extends SyncJob> jobs) {
        for (SyncJob j : jobs) {
            if (this.jobs.putIfAbsent(j.spec().resource(), j) != null) {
                throw new IllegalArgumentException("duplicate job " + j.spec().resource());
            }
        }
    }

    public SyncJob get(String name) {
        SyncJob j = jobs.get(name);
        if (j == null) throw new IllegalArgumentException("Unknown table: " + name + " (known: " + jobs.keySet() + ")");
        return j;
    }

    public boolean contains(String name) { return jobs.containsKey(name); }

    public List<String> names() { return new ArrayList<>(jobs.keySet()); }

    /** Longest retention among the named jobs; 0 when none retains. */
    public int maxRetentionOpenDays(Collection<String> names) {
        int max = 0;
        for (String n : names) {
            SyncJob j = jobs.get(n);
            if (j != null) max = Math.max(max, j.spec().retentionOpenDays());
        }
        return max;
    }
}
