package io.marketsync.core;

import java.util.Locale;

/** How rows colliding with an existing primary key are handled. */
public enum WriteMode {
    /** Replace the non-key columns of the existing row. */
    UPSERT,
    /** Keep the existing row and drop the incoming one. */
    IGNORE;

    public static WriteMode parse(String s) {
        if (s == null || s.isBlank()) return UPSERT;
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "upsert": return UPSERT;
            case "ignore": return IGNORE;
            default: throw new IllegalArgumentException("unknown write mode: " + s + " (expected upsert|ignore)");
        }
    }
}
