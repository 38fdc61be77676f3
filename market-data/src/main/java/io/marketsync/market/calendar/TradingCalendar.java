package io.marketsync.market.calendar;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative list of market-open dates. "N days of data" always means N open trading days.
 */
public interface TradingCalendar {
    /** Open dates in {@code [start, end]}, ascending. */
    List<LocalDate> openDates(String exchange, LocalDate start, LocalDate end);

    /**
     * The earliest of the {@code n} most recent open dates on or before {@code end};
     * empty when the calendar holds fewer than {@code n} such dates or {@code n <= 0}.
     */
    Optional<LocalDate> cutoffByLastOpenDays(String exchange, LocalDate end, int n);

    /** Like {@link #cutoffByLastOpenDays} but refuses to continue on a short calendar. */
    default LocalDate requireCutoff(String exchange, LocalDate end, int n) {
        return cutoffByLastOpenDays(exchange, end, n)
                .orElseThrow(() -> new InsufficientHistoryException(exchange, end, n));
    }

    /** Latest open date strictly before {@code day}, looking back at most 30 calendar days. */
    default Optional<LocalDate> previousOpenDay(String exchange, LocalDate day) {
        List<LocalDate> days = openDates(exchange, day.minusDays(30), day.minusDays(1));
        return days.isEmpty() ? Optional.empty() : Optional.of(days.get(days.size() - 1));
    }

    /**
     * The last day whose session has fully settled as of {@code now}. Before the settle time
     * today's session is still in progress, so the previous open day is returned (yesterday when
     * the calendar has nothing earlier).
     */
    default LocalDate lastCompletedOpenDay(String exchange, LocalDateTime now, TradingSession session) {
        LocalDate today = now.toLocalDate();
        if (session.settled(now)) return today;
        return previousOpenDay(exchange, today).orElse(today.minusDays(1));
    }
}
