package io.marketsync.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One record returned by an upstream fetch: an ordered column to value map.
 * Values are LocalDate, LocalDateTime, Long, Double, BigDecimal, String or null.
 */
public final class Row {
    private final LinkedHashMap<String, Object> values;

    public Row() {
        this.values = new LinkedHashMap<>();
    }

    public Row(Map<String, ?> values) {
        this.values = new LinkedHashMap<>(values);
    }

    /** Builds a row from alternating column names and values. */
    public static Row of(Object... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected column/value pairs");
        }
        Row row = new Row();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            row.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return row;
    }

    public Object get(String column) { return values.get(column); }
    public boolean has(String column) { return values.containsKey(column); }
    public Set<String> columns() { return Collections.unmodifiableSet(values.keySet()); }
    public Map<String, Object> asMap() { return Collections.unmodifiableMap(values); }
    public int size() { return values.size(); }

    public Row put(String column, Object value) {
        values.put(Objects.requireNonNull(column, "column"), value);
        return this;
    }

    public Object remove(String column) { return values.remove(column); }

    /** Returns the value as a trimmed string, or null when absent. */
    public String string(String column) {
        Object v = values.get(column);
        return v == null ? null : v.toString().trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "Row" + values; }
}
