package io.marketsync.cursor;

import java.util.Optional;

/**
 * Durable progress markers. The store upserts whatever it is given; keeping values from moving
 * backward is the caller's job (see {@link CursorAdvancer}).
 */
public interface CursorStore {
    void ensureTable();

    Optional<String> get(CursorKey key);

    /** Upserts the value; {@code null} clears the marker but keeps its row. */
    void set(CursorKey key, String value);
}
