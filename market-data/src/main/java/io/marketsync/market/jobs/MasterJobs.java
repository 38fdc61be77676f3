package io.marketsync.market.jobs;

import io.marketsync.core.Row;
import io.marketsync.market.tushare.TushareApi;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static io.marketsync.market.jobs.FetchWindow.compact;
import static io.marketsync.market.jobs.RowTransforms.dates;
import static io.marketsync.market.jobs.RowTransforms.decimals;
import static io.marketsync.market.jobs.RowTransforms.flag;
import static io.marketsync.market.jobs.RowTransforms.lotsToShares;
import static io.marketsync.market.jobs.RowTransforms.scale;
import static io.marketsync.market.tushare.TushareApi.params;

/**
 * The end-of-day catalogue: reference data plus daily market feeds.
 */
public final class MasterJobs {
    public static final int DEFAULT_RETENTION = 500;
    public static final int PAGE_MAX = 6000;
    public static final List<String> INDEX_DAILY_CODES = List.of("000001.SH", "000300.SH", "399001.SZ", "399006.SZ");
    static final int INDEX_DAILY_SLICE_DAYS = 90;
    static final List<String> HSGT_MONEY = List.of("ggt_ss", "ggt_sz", "hgt", "sgt", "north_money", "south_money");

    private MasterJobs() {}

    public static JobRegistry registry(TushareApi api, List<String> indexWeightCodes) {
        List<SyncJob> jobs = new ArrayList<>();

        jobs.add(new RangeGranularJob(
                JobSpec.range("stock_basic").keys("ts_code").build(),
                (s, e, k) -> api.query("stock_basic", params("exchange", "", "list_status", "L")),
                dates("list_date", "delist_date")));

        jobs.add(new RangeGranularJob(
                JobSpec.range("trade_cal").keys("exchange", "cal_date").cursor("cal_date").advanceToEndWithoutCursor().build(),
                (s, e, k) -> api.query("trade_cal", params("exchange", "SSE", "start_date", compact(s), "end_date", compact(e))),
                dates("cal_date", "pretrade_date").andThen(flag("is_open"))));

        jobs.add(new RangeGranularJob(
                JobSpec.range("index_basic").keys("ts_code").build(),
                (s, e, k) -> api.query("index_basic", params()),
                dates("base_date", "list_date", "exp_date")));

        jobs.add(new RangeGranularJob(
                JobSpec.range("index_classify").keys("index_code").build(),
                (s, e, k) -> api.query("index_classify", params()),
                null));

        // latest membership only
        jobs.add(new RangeGranularJob(
                JobSpec.range("index_member_all").keys("ts_code", "l3_code").build(),
                (s, e, k) -> api.queryPaged("index_member_all", 2000, params("is_new", "Y")),
                dates("in_date", "out_date")));

        jobs.add(new DayGranularJob(
                JobSpec.day("daily_raw").keys("ts_code", "trade_date").cursor("trade_date").retainOpenDays(DEFAULT_RETENTION).build(),
                (d, codes) -> dailyRaw(api, d, codes),
                dates("trade_date").andThen(scale("amount", 1000.0)).andThen(lotsToShares("vol"))));

        jobs.add(dayJob(api, "adj_factor", "adj_factor", "ts_code", "trade_date"));

        jobs.add(new RangeGranularJob(
                JobSpec.range("index_daily").keys("ts_code", "trade_date").cursor("trade_date")
                        .retainOpenDays(DEFAULT_RETENTION).advanceToEndWithoutCursor().build(),
                (s, e, k) -> indexDaily(api, s, e),
                dates("trade_date").andThen(lotsToShares("vol"))));

        jobs.add(new RangeGranularJob(
                JobSpec.range("index_weight").keys("index_code", "con_code", "trade_date").cursor("trade_date").retainOpenDays(2000).build(),
                (s, e, k) -> indexWeight(api, indexWeightCodes, s, e),
                dates("trade_date")));

        jobs.add(new DayGranularJob(
                JobSpec.day("stk_limit").keys("ts_code", "trade_date").cursor("trade_date").retainOpenDays(DEFAULT_RETENTION).build(),
                (d, k) -> api.query("stk_limit", params("trade_date", compact(d), "limit", 5800, "offset", 0)),
                dates("trade_date")));

        jobs.add(new DayGranularJob(
                JobSpec.day("limit_list_d").keys("ts_code", "trade_date", "limit").cursor("trade_date").retainOpenDays(DEFAULT_RETENTION).build(),
                (d, k) -> {
                    List<Row> out = new ArrayList<>();
                    for (String type : List.of("U", "D", "Z")) {
                        out.addAll(api.queryPaged("limit_list_d", 2500, params("trade_date", compact(d), "limit_type", type)));
                    }
                    return out;
                },
                dates("trade_date")));

        jobs.add(new RangeGranularJob(
                JobSpec.range("share_float").keys("ts_code", "ann_date", "float_date", "holder_name", "share_type")
                        .cursor("float_date").retainOpenDays(DEFAULT_RETENTION).build(),
                (s, e, k) -> api.queryPaged("share_float", PAGE_MAX, params("start_date", compact(s), "end_date", compact(e))),
                dates("ann_date", "float_date")));

        // the upstream only filters dividends by point dates, so walk announcement dates one calendar day at a time
        jobs.add(new RangeGranularJob(
                JobSpec.range("dividend").keys("ts_code", "ann_date", "end_date").cursor("ann_date").retainOpenDays(DEFAULT_RETENTION).build(),
                (s, e, k) -> {
                    List<Row> out = new ArrayList<>();
                    for (LocalDate d = s; !d.isAfter(e); d = d.plusDays(1)) {
                        out.addAll(api.queryPaged("dividend", PAGE_MAX, params("ann_date", compact(d))));
                    }
                    return out;
                },
                dates("end_date", "ann_date", "record_date", "ex_date", "pay_date", "div_listdate", "imp_ann_date", "base_date")));

        jobs.add(dayJob(api, "moneyflow_ind", "moneyflow_dc", "ts_code", "trade_date"));
        jobs.add(dayJob(api, "moneyflow_sector", "moneyflow_ind_dc", "ts_code", "trade_date", "content_type"));
        jobs.add(dayJob(api, "moneyflow_mkt", "moneyflow_mkt_dc", "trade_date"));

        jobs.add(new DayGranularJob(
                JobSpec.day("moneyflow_hsgt").keys("trade_date").cursor("trade_date").retainOpenDays(DEFAULT_RETENTION).build(),
                (d, k) -> api.query("moneyflow_hsgt", params("trade_date", compact(d))),
                dates("trade_date").andThen(decimals(HSGT_MONEY.toArray(new String[0])))));

        jobs.add(dayJob(api, "limit_list", "limit_list", "ts_code", "trade_date"));

        jobs.add(new RangeGranularJob(
                JobSpec.range("st_list").keys("ts_code", "start_date").cursor("start_date")
                        .retainOpenDays(DEFAULT_RETENTION).advanceToEndWithoutCursor().build(),
                (s, e, k) -> api.query("namechange", params("start_date", compact(s), "end_date", compact(e))),
                dates("start_date", "end_date", "ann_date")));

        jobs.add(dayJob(api, "suspend_d", "suspend_d", "ts_code", "trade_date"));

        return new JobRegistry(jobs);
    }

    private static SyncJob dayJob(TushareApi api, String table, String upstream, String... keys) {
        return new DayGranularJob(
                JobSpec.day(table).keys(keys).cursor("trade_date").retainOpenDays(DEFAULT_RETENTION).build(),
                (d, k) -> api.query(upstream, params("trade_date", compact(d))),
                dates("trade_date"));
    }

    static List<Row> dailyRaw(TushareApi api, LocalDate day, List<String> codes) {
        String td = compact(day);
        List<Row> daily = new ArrayList<>();
        List<Row> basic = new ArrayList<>();
        if (codes.isEmpty()) {
            daily.addAll(api.query("daily", params("trade_date", td)));
            basic.addAll(api.query("daily_basic", params("trade_date", td)));
        } else {
            for (String code : codes) {
                daily.addAll(api.query("daily", params("ts_code", code, "trade_date", td)));
                basic.addAll(api.query("daily_basic", params("ts_code", code, "trade_date", td)));
            }
        }
        return RowTransforms.mergeOuter(daily, basic, List.of("ts_code", "trade_date"));
    }

    // long ranges have been seen to hang upstream, so each code is fetched in short slices
    static List<Row> indexDaily(TushareApi api, LocalDate start, LocalDate end) {
        List<Row> out = new ArrayList<>();
        for (String code : INDEX_DAILY_CODES) {
            LocalDate cur = start;
            while (!cur.isAfter(end)) {
                LocalDate sliceEnd = cur.plusDays(INDEX_DAILY_SLICE_DAYS);
                if (sliceEnd.isAfter(end)) sliceEnd = end;
                out.addAll(api.query("index_daily",
                        params("ts_code", code, "start_date", compact(cur), "end_date", compact(sliceEnd))));
                cur = sliceEnd.plusDays(1);
            }
        }
        return out;
    }

    static List<Row> indexWeight(TushareApi api, List<String> codes, LocalDate start, LocalDate end) {
        List<Row> out = new ArrayList<>();
        if (codes == null || codes.isEmpty()) return out;
        LocalDate month = start.withDayOfMonth(1);
        while (!month.isAfter(end)) {
            LocalDate next = month.plusMonths(1);
            LocalDate monthEnd = next.minusDays(1).isAfter(end) ? end : next.minusDays(1);
            for (String code : codes) {
                out.addAll(api.queryPaged("index_weight", PAGE_MAX,
                        params("index_code", code, "start_date", compact(month), "end_date", compact(monthEnd))));
            }
            month = next;
        }
        return out;
    }
}
