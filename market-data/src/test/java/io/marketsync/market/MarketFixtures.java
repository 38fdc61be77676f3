package io.marketsync.market;

import io.marketsync.core.Row;
import io.marketsync.core.WriteMode;
import io.marketsync.market.calendar.JdbcTradingCalendar;
import io.marketsync.metrics.Metrics;
import io.marketsync.retry.ExponentialBackoffRetryPolicy;
import io.marketsync.retry.RetryingFetcher;
import io.marketsync.store.H2Dialect;
import io.marketsync.store.JdbcRelationalStore;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.Statement;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** H2 databases in MySQL mode plus a weekday trading calendar. */
public final class MarketFixtures {
    private MarketFixtures() {}

    public static DataSource memory() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        return ds;
    }

    public static JdbcRelationalStore store(DataSource ds) {
        return new JdbcRelationalStore(ds, new H2Dialect());
    }

    public static JdbcTradingCalendar calendar(JdbcRelationalStore store) {
        return new JdbcTradingCalendar(store, RetryingFetcher.forDatabase(new ExponentialBackoffRetryPolicy(1, 1, 1), Metrics.detached()));
    }

    public static List<LocalDate> weekdays(LocalDate from, LocalDate to) {
        List<LocalDate> out = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (d.getDayOfWeek() != DayOfWeek.SATURDAY && d.getDayOfWeek() != DayOfWeek.SUNDAY) out.add(d);
        }
        return out;
    }

    /** Seeds trade_cal with every calendar day in range, open on weekdays. */
    public static void seedCalendar(JdbcRelationalStore store, LocalDate from, LocalDate to) {
        List<Row> rows = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            boolean open = d.getDayOfWeek() != DayOfWeek.SATURDAY && d.getDayOfWeek() != DayOfWeek.SUNDAY;
            rows.add(Row.of("exchange", "SSE", "cal_date", d, "is_open", open ? 1L : 0L));
        }
        store.write("trade_cal", rows, List.of("exchange", "cal_date"), WriteMode.UPSERT);
    }

    public static List<Map<String, String>> query(DataSource ds, String sql) throws Exception {
        List<Map<String, String>> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            ResultSetMetaData md = rs.getMetaData();
            while (rs.next()) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 1; i <= md.getColumnCount(); i++) row.put(md.getColumnLabel(i).toLowerCase(), rs.getString(i));
                out.add(row);
            }
        }
        return out;
    }

    public static long count(DataSource ds, String table) throws Exception {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
