package io.marketsync.store;

import io.marketsync.core.Row;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Infers a column type from its name and the values observed in a batch. Name rules win
 * so that a column keeps the same type whether or not the first batch happened to carry values.
 */
public final class ColumnTypes {
    private static final Set<String> DECIMAL_COLUMNS = Set.of("ggt_ss", "ggt_sz", "hgt", "sgt", "north_money", "south_money");
    private static final Set<String> SHORT_TEXT_COLUMNS = Set.of("ts_code", "symbol", "exchange", "market", "content_type");
    private static final Set<String> TIMESTAMP_COLUMNS = Set.of("time", "trade_time");

    private ColumnTypes() {}

    public static LinkedHashMap<String, ColumnType> infer(List<Row> rows, List<String> columns) {
        LinkedHashMap<String, ColumnType> out = new LinkedHashMap<>();
        for (String c : columns) out.put(c, infer(c, rows));
        return out;
    }

    static ColumnType infer(String column, List<Row> rows) {
        String c = column.toLowerCase(Locale.ROOT);
        if (DECIMAL_COLUMNS.contains(c)) return ColumnType.DECIMAL;
        if (SHORT_TEXT_COLUMNS.contains(c)) return ColumnType.VARCHAR_32;
        if (c.endsWith("_date")) return ColumnType.DATE;
        if (TIMESTAMP_COLUMNS.contains(c)) return ColumnType.TIMESTAMP;

        boolean allLong = true, allNumber = true, allDate = true, allTimestamp = true, any = false;
        int maxLen = 0;
        for (Row r : rows) {
            Object v = r.get(column);
            if (v == null) continue;
            any = true;
            allLong &= v instanceof Long || v instanceof Integer || v instanceof Short;
            allNumber &= v instanceof Number;
            allDate &= v instanceof LocalDate;
            allTimestamp &= v instanceof LocalDateTime;
            maxLen = Math.max(maxLen, v.toString().length());
        }
        if (!any) return ColumnType.VARCHAR_64;
        if (allLong) return ColumnType.BIGINT;
        if (allNumber) return hasBigDecimal(rows, column) ? ColumnType.DECIMAL : ColumnType.DOUBLE;
        if (allDate) return ColumnType.DATE;
        if (allTimestamp) return ColumnType.TIMESTAMP;
        if (maxLen <= 64) return ColumnType.VARCHAR_64;
        if (maxLen <= 255) return ColumnType.VARCHAR_255;
        return ColumnType.TEXT;
    }

    private static boolean hasBigDecimal(List<Row> rows, String column) {
        for (Row r : rows) {
            if (r.get(column) instanceof BigDecimal) return true;
        }
        return false;
    }
}
