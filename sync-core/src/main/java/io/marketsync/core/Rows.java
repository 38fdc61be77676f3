package io.marketsync.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

public final class Rows {
    private Rows() {}

    /** Union of the columns of all rows, in first-seen order. */
    public static List<String> columns(List<Row> rows) {
        LinkedHashSet<String> cols = new LinkedHashSet<>();
        for (Row r : rows) cols.addAll(r.columns());
        return new ArrayList<>(cols);
    }

    /** Non-null values of one column, in row order. */
    public static List<Object> values(List<Row> rows, String column) {
        List<Object> out = new ArrayList<>();
        for (Row r : rows) {
            Object v = r.get(column);
            if (v != null) out.add(v);
        }
        return out;
    }

    public static List<Row> concat(List<List<Row>> parts) {
        List<Row> out = new ArrayList<>();
        for (List<Row> p : parts) {
            if (p != null) out.addAll(p);
        }
        return out;
    }

    public static boolean isEmpty(List<Row> rows) {
        return rows == null || rows.isEmpty();
    }
}
