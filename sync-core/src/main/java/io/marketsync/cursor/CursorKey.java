package io.marketsync.cursor;

import java.util.Objects;

/**
 * Identifies one progress marker: the storage scope (master store or a shard), the resource
 * (table) and the column the marker tracks.
 */
public record CursorKey(String scope, String resource, String column) {
    public CursorKey {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(column, "column");
    }

    @Override
    public String toString() { return scope + "/" + resource + "." + column; }
}
