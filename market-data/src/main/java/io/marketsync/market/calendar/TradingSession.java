package io.marketsync.market.calendar;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Intraday session bounds and the grace period after the close before a day counts as settled.
 */
public record TradingSession(LocalTime open, LocalTime close, Duration settleDelay) {
    /** Shanghai/Shenzhen A-shares: 09:30 to 15:00, settled from 15:05. */
    public static TradingSession cnEquities() {
        return new TradingSession(LocalTime.of(9, 30), LocalTime.of(15, 0), Duration.ofMinutes(5));
    }

    public LocalDateTime start(LocalDate day) { return day.atTime(open); }
    public LocalDateTime end(LocalDate day) { return day.atTime(close); }

    public boolean settled(LocalDateTime now) {
        return !now.toLocalTime().isBefore(close.plus(settleDelay));
    }
}
