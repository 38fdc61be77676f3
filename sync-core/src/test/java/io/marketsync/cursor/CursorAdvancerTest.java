package io.marketsync.cursor;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CursorAdvancerTest {
    static class MapCursorStore implements CursorStore {
        final Map<CursorKey, String> values = new HashMap<>();
        int writes;
        @Override public void ensureTable() {}
        @Override public Optional<String> get(CursorKey key) { return Optional.ofNullable(values.get(key)); }
        @Override public void set(CursorKey key, String value) { writes++; values.put(key, value); }
    }

    private final CursorKey key = new CursorKey("AS_MASTER", "daily_raw", "trade_date");

    @Test
    void stored_value_is_max_of_all_advances_regardless_of_order() {
        List<String> values = new ArrayList<>(List.of(
                "2024-01-02", "2024-01-09", "2023-12-29", "2024-01-05", "2024-01-08", "2024-01-03"));
        Random rnd = new Random(7);
        for (int round = 0; round < 20; round++) {
            Collections.shuffle(values, rnd);
            MapCursorStore store = new MapCursorStore();
            CursorAdvancer advancer = new CursorAdvancer(store);
            for (String v : values) advancer.advance(key, v);
            assertEquals("2024-01-09", store.values.get(key), "order " + values);
        }
    }

    @Test
    void earlier_candidate_is_clamped_without_writing() {
        MapCursorStore store = new MapCursorStore();
        CursorAdvancer advancer = new CursorAdvancer(store);
        advancer.advance(key, "2024-03-04");
        assertEquals(Optional.of("2024-03-04"), advancer.advance(key, "2024-02-01"));
        assertEquals(1, store.writes);
    }

    @Test
    void compact_and_iso_dates_compare_as_dates() {
        MapCursorStore store = new MapCursorStore();
        store.values.put(key, "20240304");
        CursorAdvancer advancer = new CursorAdvancer(store);
        assertEquals(Optional.of("20240304"), advancer.advance(key, "2024-03-01"));
        assertEquals(Optional.of("2024-03-05"), advancer.advance(key, "2024-03-05"));
    }

    @Test
    void null_candidate_leaves_cursor_untouched() {
        MapCursorStore store = new MapCursorStore();
        CursorAdvancer advancer = new CursorAdvancer(store);
        assertEquals(Optional.empty(), advancer.advance(key, null));
        assertEquals(0, store.writes);
    }

    @Test
    void parses_both_date_shapes() {
        assertEquals("2024-03-04", CursorValues.parseDate("20240304").orElseThrow().toString());
        assertEquals("2024-03-04", CursorValues.parseDate(" 2024-03-04 ").orElseThrow().toString());
        assertTrue(CursorValues.parseDate("not-a-date").isEmpty());
    }
}
