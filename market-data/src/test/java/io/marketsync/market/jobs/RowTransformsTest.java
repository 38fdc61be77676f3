package io.marketsync.market.jobs;

import io.marketsync.core.Row;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RowTransformsTest {
    private static final LocalDate JAN2 = LocalDate.of(2024, 1, 2);

    private static List<Row> rows(Row... rows) {
        return new ArrayList<>(List.of(rows));
    }

    @Test
    void dates_accept_the_shapes_the_upstream_sends() {
        assertEquals(JAN2, RowTransforms.toDate("20240102"));
        assertEquals(JAN2, RowTransforms.toDate(20240102L));
        assertEquals(JAN2, RowTransforms.toDate(20240102.0));
        assertEquals(JAN2, RowTransforms.toDate("20240102.0"));
        assertEquals(JAN2, RowTransforms.toDate("2024-01-02"));
        assertEquals(JAN2, RowTransforms.toDate(LocalDateTime.of(2024, 1, 2, 9, 30)));
        assertNull(RowTransforms.toDate(""));
        assertNull(RowTransforms.toDate("not a date"));
        assertNull(RowTransforms.toDate(null));
    }

    @Test
    void compact_timestamps() {
        LocalDateTime t = LocalDateTime.of(2024, 1, 2, 9, 35);
        assertEquals(t, RowTransforms.toTimestamp("20240102093500"));
        assertEquals(t, RowTransforms.toTimestamp("20240102093500.000"));
        assertEquals(t, RowTransforms.toTimestamp("2024-01-02 09:35:00"));
        assertNull(RowTransforms.toTimestamp("garbage"));

        List<Row> out = RowTransforms.compactTimestamp("trade_time").apply(rows(Row.of("trade_time", "20240102093500")));
        assertEquals(t, out.get(0).get("trade_time"));
    }

    @Test
    void dates_leave_missing_columns_alone() {
        List<Row> out = RowTransforms.dates("trade_date", "ann_date").apply(rows(Row.of("trade_date", "20240102")));
        assertEquals(JAN2, out.get(0).get("trade_date"));
        assertFalse(out.get(0).has("ann_date"));
    }

    @Test
    void unit_conversions() {
        List<Row> out = RowTransforms.scale("amount", 1000.0)
                .andThen(RowTransforms.lotsToShares("vol"))
                .apply(rows(Row.of("amount", "2.5", "vol", 3L), Row.of("amount", null)));
        assertEquals(2500.0, out.get(0).get("amount"));
        assertEquals(300.0, out.get(0).get("vol_share"));
        assertFalse(out.get(0).has("vol"));
        assertNull(out.get(1).get("amount"));
        assertFalse(out.get(1).has("vol_share"));
    }

    @Test
    void flags_default_to_zero() {
        List<Row> out = RowTransforms.flag("is_open").apply(rows(Row.of("is_open", "1"), Row.of("is_open", null), Row.of("is_open", 0.0)));
        assertEquals(1L, out.get(0).get("is_open"));
        assertEquals(0L, out.get(1).get("is_open"));
        assertEquals(0L, out.get(2).get("is_open"));
    }

    @Test
    void decimals_keep_exact_values() {
        List<Row> out = RowTransforms.decimals("north_money").apply(rows(Row.of("north_money", "0.10"), Row.of("north_money", "n/a")));
        assertEquals(new BigDecimal("0.10"), out.get(0).get("north_money"));
        assertNull(out.get(1).get("north_money"));
    }

    @Test
    void outer_merge_prefers_left_values_and_keeps_unmatched_rows() {
        List<String> keys = List.of("ts_code", "trade_date");
        List<Row> left = rows(Row.of("ts_code", "A", "trade_date", JAN2, "close", 1.0));
        List<Row> right = rows(
                Row.of("ts_code", "A", "trade_date", JAN2, "close", 9.0, "pe", 3.0),
                Row.of("ts_code", "B", "trade_date", JAN2, "pe", 4.0));

        List<Row> merged = RowTransforms.mergeOuter(left, right, keys);

        assertEquals(2, merged.size());
        assertEquals(Row.of("ts_code", "A", "trade_date", JAN2, "close", 1.0, "pe", 3.0), merged.get(0));
        assertEquals(Row.of("ts_code", "B", "trade_date", JAN2, "pe", 4.0), merged.get(1));
        assertSame(right, RowTransforms.mergeOuter(List.of(), right, keys));
        assertSame(left, RowTransforms.mergeOuter(left, List.of(), keys));
    }
}
