package io.marketsync.market.jobs;

import io.marketsync.core.Row;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column-level transforms shared by the job catalogue. Unparseable values become null; missing columns are left alone.
 */
public final class RowTransforms {
    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final DateTimeFormatter COMPACT_TS = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private RowTransforms() {}

    /** yyyyMMdd (string or number) to {@link LocalDate}. */
    public static RowTransform dates(String... columns) {
        return rows -> {
            for (Row r : rows) {
                for (String c : columns) {
                    if (r.has(c)) r.put(c, toDate(r.get(c)));
                }
            }
            return rows;
        };
    }

    /** yyyyMMddHHmmss with optional fractional seconds to {@link LocalDateTime}. */
    public static RowTransform compactTimestamp(String column) {
        return rows -> {
            for (Row r : rows) {
                if (r.has(column)) r.put(column, toTimestamp(r.get(column)));
            }
            return rows;
        };
    }

    public static RowTransform scale(String column, double factor) {
        return rows -> {
            for (Row r : rows) {
                if (!r.has(column)) continue;
                Double d = toDouble(r.get(column));
                r.put(column, d == null ? null : d * factor);
            }
            return rows;
        };
    }

    /** Replaces a lot-denominated volume column with {@code vol_share} (1 lot = 100 shares). */
    public static RowTransform lotsToShares(String column) {
        return rows -> {
            for (Row r : rows) {
                if (!r.has(column)) continue;
                Double d = toDouble(r.remove(column));
                r.put("vol_share", d == null ? null : d * 100.0);
            }
            return rows;
        };
    }

    /** Exact decimal coercion for money columns the upstream sometimes sends as strings. */
    public static RowTransform decimals(String... columns) {
        return rows -> {
            for (Row r : rows) {
                for (String c : columns) {
                    if (r.has(c)) r.put(c, toDecimal(r.get(c)));
                }
            }
            return rows;
        };
    }

    /** Integer flag; missing or unparseable becomes 0. */
    public static RowTransform flag(String column) {
        return rows -> {
            for (Row r : rows) {
                if (!r.has(column)) continue;
                Double d = toDouble(r.get(column));
                r.put(column, d == null ? 0L : d.longValue());
            }
            return rows;
        };
    }

    /**
     * Full outer join on {@code keys}. Columns of {@code right} that {@code left} already has are dropped from
     * {@code right} before joining, so left-hand values win.
     */
    public static List<Row> mergeOuter(List<Row> left, List<Row> right, List<String> keys) {
        if (left.isEmpty()) return right;
        if (right.isEmpty()) return left;
        Set<String> leftColumns = new HashSet<>();
        for (Row r : left) leftColumns.addAll(r.columns());

        Map<List<Object>, Row> byKey = new LinkedHashMap<>();
        for (Row r : left) byKey.put(key(r, keys), new Row(r.asMap()));
        for (Row r : right) {
            List<Object> k = key(r, keys);
            Row target = byKey.get(k);
            if (target == null) {
                target = new Row();
                for (String key : keys) target.put(key, r.get(key));
                byKey.put(k, target);
            }
            for (String c : r.columns()) {
                if (keys.contains(c) || leftColumns.contains(c)) continue;
                target.put(c, r.get(c));
            }
        }
        return new ArrayList<>(byKey.values());
    }

    static LocalDate toDate(Object v) {
        if (v == null || v instanceof LocalDate) return (LocalDate) v;
        if (v instanceof LocalDateTime) return ((LocalDateTime) v).toLocalDate();
        String s = stripFraction(plain(v));
        if (s.isEmpty()) return null;
        if (s.contains("-")) {
            try {
                return LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        try {
            return LocalDate.parse(zeroPad(s, 8), COMPACT_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static LocalDateTime toTimestamp(Object v) {
        if (v == null || v instanceof LocalDateTime) return (LocalDateTime) v;
        String s = stripFraction(plain(v)).replaceAll("\\s+", "");
        if (s.isEmpty()) return null;
        try {
            return LocalDateTime.parse(zeroPad(s, 14), COMPACT_TS);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(v.toString().trim().replace(' ', 'T'));
            } catch (DateTimeParseException again) {
                return null;
            }
        }
    }

    static Double toDouble(Object v) {
        if (v == null) return null;
        if (v instanceof Number) return ((Number) v).doubleValue();
        String s = v.toString().trim();
        if (s.isEmpty()) return null;
        try {
            double d = Double.parseDouble(s);
            return Double.isNaN(d) ? null : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static BigDecimal toDecimal(Object v) {
        if (v == null || v instanceof BigDecimal) return (BigDecimal) v;
        if (v instanceof Long || v instanceof Integer) return BigDecimal.valueOf(((Number) v).longValue());
        String s = v.toString().trim();
        if (s.isEmpty()) return null;
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Object> key(Row r, List<String> keys) {
        List<Object> k = new ArrayList<>(keys.size());
        for (String c : keys) k.add(r.get(c));
        return k;
    }

    // doubles would otherwise print as 2.0240102E7
    private static String plain(Object v) {
        if (v instanceof Double || v instanceof Float) return Long.toString(((Number) v).longValue());
        return v.toString().trim();
    }

    // "20240102.0" comes back from float-typed upstream columns
    private static String stripFraction(String s) {
        int dot = s.indexOf('.');
        return dot < 0 ? s : s.substring(0, dot);
    }

    private static String zeroPad(String s, int width) {
        if (s.length() >= width) return s;
        return "0".repeat(width - s.length()) + s;
    }
}
