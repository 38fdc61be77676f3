package io.marketsync.cursor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The only path by which sync engines move a cursor forward. A candidate earlier than the stored
 * value is clamped to the stored value, so for any sequence of advances the stored value is their max.
 */
public class CursorAdvancer {
    private static final Logger log = LoggerFactory.getLogger(CursorAdvancer.class);

    private final CursorStore store;

    public CursorAdvancer(CursorStore store) {
        this.store = store;
    }

    public CursorStore store() { return store; }

    /** Persists {@code max(stored, candidate)} and returns it. A null candidate leaves the cursor untouched. */
    public Optional<String> advance(CursorKey key, String candidate) {
        Optional<String> current = store.get(key);
        if (candidate == null || candidate.isBlank()) return current;
        if (current.isPresent() && CursorValues.compare(candidate, current.get()) <= 0) {
            if (CursorValues.compare(candidate, current.get()) < 0) {
                log.debug("{}: keeping {} over earlier {}", key, current.get(), candidate);
            }
            return current;
        }
        store.set(key, candidate);
        return Optional.of(candidate);
    }
}
