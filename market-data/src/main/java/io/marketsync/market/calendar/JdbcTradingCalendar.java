package io.marketsync.market.calendar;

import io.marketsync.retry.RetryingFetcher;
import io.marketsync.store.JdbcRelationalStore;
import io.marketsync.store.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code trade_cal(exchange, cal_date, is_open, pretrade_date)} from the master store.
 * Queries retry on dropped connections; anything else propagates.
 */
public class JdbcTradingCalendar implements TradingCalendar {
    private static final Logger log = LoggerFactory.getLogger(JdbcTradingCalendar.class);

    public static final String TABLE = "trade_cal";

    private final JdbcRelationalStore store;
    private final RetryingFetcher retrying;

    public JdbcTradingCalendar(JdbcRelationalStore store, RetryingFetcher retrying) {
        this.store = store;
        this.retrying = retrying;
    }

    @Override
    public List<LocalDate> openDates(String exchange, LocalDate start, LocalDate end) {
        if (start.isAfter(end)) return List.of();
        SqlDialect d = store.dialect();
        String sql = "SELECT " + d.quote("cal_date") + " FROM " + d.quote(TABLE)
                + " WHERE " + d.quote("exchange") + " = ? AND " + d.quote("is_open") + " = 1"
                + " AND " + d.quote("cal_date") + " BETWEEN ? AND ? ORDER BY " + d.quote("cal_date");
        return retrying.fetch("trade_cal open dates " + start + ".." + end, () -> {
            if (!store.tableExists(TABLE)) {
                log.warn("{} does not exist yet; no open dates", TABLE);
                return List.of();
            }
            return dates(sql, exchange, start, end);
        });
    }

    @Override
    public Optional<LocalDate> cutoffByLastOpenDays(String exchange, LocalDate end, int n) {
        if (n <= 0) return Optional.empty();
        SqlDialect d = store.dialect();
        // LIMIT is inlined; not every driver binds it
        String sql = "SELECT " + d.quote("cal_date") + " FROM " + d.quote(TABLE)
                + " WHERE " + d.quote("exchange") + " = ? AND " + d.quote("is_open") + " = 1"
                + " AND " + d.quote("cal_date") + " <= ? ORDER BY " + d.quote("cal_date") + " DESC LIMIT " + n;
        List<LocalDate> recent = retrying.fetch("trade_cal last " + n + " open days to " + end, () -> {
            if (!store.tableExists(TABLE)) return List.of();
            return dates(sql, exchange, end);
        });
        if (recent.size() < n) return Optional.empty();
        return recent.stream().min(LocalDate::compareTo);
    }

    private List<LocalDate> dates(String sql, Object... params) throws SQLException {
        List<LocalDate> out = new ArrayList<>();
        try (Connection c = store.dataSource().getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) ps.setObject(i + 1, params[i]);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getObject(1, LocalDate.class));
            }
        }
        return out;
    }
}
