package io.marketsync.retry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PagerTest {
    private static List<Integer> serve(List<Integer> all, int limit, int offset, List<Integer> offsets) {
        offsets.add(offset);
        return all.subList(Math.min(offset, all.size()), Math.min(offset + limit, all.size()));
    }

    @Test
    void pages_until_short_page() {
        List<Integer> all = IntStream.range(0, 12).boxed().collect(Collectors.toList());
        List<Integer> offsets = new ArrayList<>();
        List<Integer> out = Pager.fetchAll(5, (limit, offset) -> serve(all, limit, offset, offsets));
        assertEquals(all, out);
        assertEquals(List.of(0, 5, 10), offsets);
    }

    @Test
    void exact_multiple_needs_one_empty_page() {
        List<Integer> all = IntStream.range(0, 10).boxed().collect(Collectors.toList());
        List<Integer> offsets = new ArrayList<>();
        assertEquals(10, Pager.fetchAll(5, (limit, offset) -> serve(all, limit, offset, offsets)).size());
        assertEquals(List.of(0, 5, 10), offsets);
    }

    @Test
    void empty_first_page_is_no_data() {
        List<Integer> offsets = new ArrayList<>();
        assertTrue(Pager.fetchAll(2500, (limit, offset) -> serve(List.of(), limit, offset, offsets)).isEmpty());
        assertEquals(List.of(0), offsets);
    }

    @Test
    void rejects_non_positive_limit() {
        assertThrows(IllegalArgumentException.class, () -> Pager.fetchAll(0, (l, o) -> List.of()));
    }
}
