package io.marketsync.market.sync;

import io.marketsync.core.Row;
import io.marketsync.core.WriteMode;
import io.marketsync.cursor.CursorAdvancer;
import io.marketsync.cursor.JdbcCursorStore;
import io.marketsync.market.MarketFixtures;
import io.marketsync.market.jobs.DayGranularJob;
import io.marketsync.market.jobs.JobRegistry;
import io.marketsync.market.jobs.JobSpec;
import io.marketsync.market.jobs.RangeGranularJob;
import io.marketsync.metrics.Metrics;
import io.marketsync.store.JdbcRelationalStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static io.marketsync.market.MarketFixtures.count;
import static org.junit.jupiter.api.Assertions.*;

public class MasterSyncTest {
    private static final LocalDate FIRST = LocalDate.of(2024, 1, 2);
    private static final LocalDate END = LocalDate.of(2024, 2, 29);

    private DataSource ds;
    private MasterSync master;
    private final List<String> calls = new ArrayList<>();
    private final List<LocalDate> calendarStarts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ds = MarketFixtures.memory();
        JdbcRelationalStore store = MarketFixtures.store(ds);
        JdbcCursorStore cursors = new JdbcCursorStore(store);
        cursors.ensureTable();
        Clock clock = Clock.fixed(END.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        SyncContext ctx = new SyncContext(SyncContext.MASTER_SCOPE, store, new CursorAdvancer(cursors),
                MarketFixtures.calendar(store), Metrics.detached(), clock, SyncSettings.defaults());
        master = new MasterSync(registry(), new SyncEngine(ctx));
    }

    private JobRegistry registry() {
        RangeGranularJob tradeCal = new RangeGranularJob(
                JobSpec.range("trade_cal").keys("exchange", "cal_date").cursor("cal_date").build(),
                (start, end, keys) -> {
                    calls.add("trade_cal");
                    calendarStarts.add(start);
                    List<Row> rows = new ArrayList<>();
                    LocalDate from = start.isBefore(FIRST) ? FIRST : start;
                    LocalDate to = end.isAfter(END) ? END : end;
                    for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
                        boolean open = MarketFixtures.weekdays(d, d).size() == 1;
                        rows.add(Row.of("exchange", "SSE", "cal_date", d, "is_open", open ? 1L : 0L));
                    }
                    return rows;
                }, null);
        RangeGranularJob stockBasic = new RangeGranularJob(
                JobSpec.range("stock_basic").keys("ts_code").build(),
                (start, end, keys) -> {
                    calls.add("stock_basic");
                    return new ArrayList<>(List.of(Row.of("ts_code", "000001.SZ", "name", "PingAn")));
                }, null);
        return new JobRegistry(List.of(tradeCal, stockBasic,
                daily("daily_raw", 5), daily("adj_factor", 5), daily("limit_list_d", 0)));
    }

    private DayGranularJob daily(String name, int keep) {
        return new DayGranularJob(
                JobSpec.day(name).keys("ts_code", "trade_date").cursor("trade_date").retainOpenDays(keep).build(),
                (day, keys) -> {
                    calls.add(name + ":" + day);
                    return new ArrayList<>(List.of(Row.of("ts_code", "000001.SZ", "trade_date", day, "v", 1.0)));
                }, null);
    }

    private List<String> tablesCalled() {
        return calls.stream().map(c -> c.split(":")[0]).distinct().collect(Collectors.toList());
    }

    @Test
    void update_runs_calendar_then_instruments_then_requested_order() {
        List<SyncResult> results = master.update(List.of("adj_factor", "stock_basic"), SyncRequest.defaults().withEnd(END));

        assertEquals(List.of("trade_cal", "stock_basic", "adj_factor"),
                results.stream().map(SyncResult::resource).collect(Collectors.toList()));
        assertEquals(List.of("trade_cal", "stock_basic", "adj_factor"), tablesCalled());
        SyncResult adj = results.get(2);
        assertEquals(LocalDate.of(2024, 2, 23), adj.retentionCutoff());
        assertEquals(5, adj.rowsFetched());
    }

    @Test
    void update_widens_calendar_window_to_cover_retention() {
        master.update(List.of("daily_raw"), SyncRequest.defaults().withEnd(END).withStart(LocalDate.of(2024, 2, 1)));
        assertEquals(List.of(END.minusDays(365L * 5)), calendarStarts);
    }

    @Test
    void update_without_tables_runs_every_job() {
        master.update(List.of(), SyncRequest.defaults().withEnd(END));
        assertEquals(List.of("trade_cal", "stock_basic", "daily_raw", "adj_factor", "limit_list_d"), tablesCalled());
    }

    @Test
    void unknown_table_fails_before_anything_runs() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> master.update(List.of("daily_raw", "nope"), SyncRequest.defaults().withEnd(END)));
        assertTrue(e.getMessage().contains("Unknown table: nope"));
        assertTrue(calls.isEmpty());
    }

    @Test
    void calendar_years_grow_with_retention() {
        assertEquals(5, MasterSync.calendarYears(0));
        assertEquals(5, MasterSync.calendarYears(500));
        assertEquals(12, MasterSync.calendarYears(2000));
    }

    @Test
    void backfill_walks_months_in_order_and_trims_once_at_the_end() throws Exception {
        MasterBackfillResult result = master.backfill(30, END, WriteMode.IGNORE, List.of("adj_factor", "daily_raw"));

        assertEquals(LocalDate.of(2024, 1, 19), result.cutoff());
        assertEquals("trade_cal", calls.get(0));
        assertEquals("stock_basic", calls.get(1));
        assertEquals("daily_raw:2024-01-19", calls.get(2));

        // January for both tables before any February fetch, daily_raw ahead of adj_factor each month
        int lastJanAdj = calls.indexOf("adj_factor:2024-01-31");
        int firstFebDaily = calls.indexOf("daily_raw:2024-02-01");
        int lastJanDaily = calls.indexOf("daily_raw:2024-01-31");
        int firstJanAdj = calls.indexOf("adj_factor:2024-01-19");
        assertTrue(lastJanDaily < firstJanAdj);
        assertTrue(lastJanAdj < firstFebDaily);

        assertEquals(4, result.runs().size());
        assertEquals(30, result.runs().stream().filter(r -> r.resource().equals("daily_raw")).mapToLong(SyncResult::rowsFetched).sum());
        assertTrue(result.runs().stream().allMatch(r -> r.retentionCutoff() == null));

        assertEquals(25L, result.deleted().get("daily_raw"));
        assertEquals(25L, result.deleted().get("adj_factor"));
        assertEquals(5, count(ds, "daily_raw"));
        assertEquals(5, count(ds, "adj_factor"));
    }

    @Test
    void backfill_refuses_a_window_longer_than_the_calendar() {
        assertThrows(io.marketsync.market.calendar.InsufficientHistoryException.class,
                () -> master.backfill(100, END, WriteMode.IGNORE, List.of("daily_raw")));
        assertFalse(calls.stream().anyMatch(c -> c.startsWith("daily_raw")));
    }
}
