package io.marketsync.cursor;

import io.marketsync.store.H2Stores;
import io.marketsync.store.JdbcRelationalStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCursorStoreTest {
    private DataSource ds;
    private JdbcCursorStore cursors;

    @BeforeEach
    void setUp() {
        ds = H2Stores.memory();
        JdbcRelationalStore store = H2Stores.store(ds);
        cursors = new JdbcCursorStore(store);
    }

    @Test
    void missing_cursor_is_empty() {
        assertEquals(Optional.empty(), cursors.get(new CursorKey("AS_MASTER", "daily_raw", "trade_date")));
    }

    @Test
    void set_upserts_per_key() throws Exception {
        CursorKey daily = new CursorKey("AS_MASTER", "daily_raw", "trade_date");
        CursorKey shard = new CursorKey("AS_5MIN_P1", "minute_5m", "trade_date");
        cursors.set(daily, "2024-03-01");
        cursors.set(daily, "2024-03-04");
        cursors.set(shard, "2024-02-28");

        assertEquals(Optional.of("2024-03-04"), cursors.get(daily));
        assertEquals(Optional.of("2024-02-28"), cursors.get(shard));
        assertEquals(2, H2Stores.count(ds, "etl_state"));
    }

    @Test
    void null_clears_value_but_keeps_row() throws Exception {
        CursorKey progress = new CursorKey("AS_5MIN_P2", "minute_5m", "trade_date_next_i");
        cursors.set(progress, "2024-03-05@3");
        cursors.set(progress, null);
        assertEquals(Optional.empty(), cursors.get(progress));
        assertEquals(1, H2Stores.count(ds, "etl_state"));
    }
}
