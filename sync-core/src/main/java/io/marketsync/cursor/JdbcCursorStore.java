package io.marketsync.cursor;

import io.marketsync.core.Row;
import io.marketsync.core.WriteMode;
import io.marketsync.error.SyncException;
import io.marketsync.store.ColumnType;
import io.marketsync.store.JdbcRelationalStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/** Cursor rows in {@code etl_state(cluster, table_name, cursor_col, cursor_value, updated_at)}. */
public class JdbcCursorStore implements CursorStore {
    public static final String TABLE = "etl_state";
    private static final List<String> KEY = List.of("cluster", "table_name", "cursor_col");

    private final JdbcRelationalStore store;
    private final Clock clock;
    private volatile boolean ensured;

    public JdbcCursorStore(JdbcRelationalStore store) {
        this(store, Clock.systemDefaultZone());
    }

    public JdbcCursorStore(JdbcRelationalStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public void ensureTable() {
        if (ensured) return;
        LinkedHashMap<String, ColumnType> schema = new LinkedHashMap<>();
        schema.put("cluster", ColumnType.VARCHAR_32);
        schema.put("table_name", ColumnType.VARCHAR_64);
        schema.put("cursor_col", ColumnType.VARCHAR_64);
        schema.put("cursor_value", ColumnType.VARCHAR_64);
        schema.put("updated_at", ColumnType.TIMESTAMP);
        store.ensureTable(TABLE, schema, KEY);
        ensured = true;
    }

    @Override
    public Optional<String> get(CursorKey key) {
        ensureTable();
        var d = store.dialect();
        String sql = "SELECT " + d.quote("cursor_value") + " FROM " + d.quote(TABLE)
                + " WHERE " + d.quote("cluster") + " = ? AND " + d.quote("table_name") + " = ? AND " + d.quote("cursor_col") + " = ?";
        try (Connection c = store.dataSource().getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key.scope());
            ps.setString(2, key.resource());
            ps.setString(3, key.column());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                String v = rs.getString(1);
                return v == null || v.isBlank() ? Optional.empty() : Optional.of(v.trim());
            }
        } catch (SQLException e) {
            throw new SyncException("cannot read cursor " + key, e);
        }
    }

    @Override
    public void set(CursorKey key, String value) {
        ensureTable();
        Row row = Row.of(
                "cluster", key.scope(),
                "table_name", key.resource(),
                "cursor_col", key.column(),
                "cursor_value", value,
                "updated_at", LocalDateTime.now(clock));
        store.write(TABLE, List.of(row), KEY, WriteMode.UPSERT);
    }
}
