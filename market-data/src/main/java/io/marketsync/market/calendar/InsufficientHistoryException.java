package io.marketsync.market.calendar;

import io.marketsync.error.SyncException;

import java.time.LocalDate;

/** The calendar cannot answer "last N open days"; a shorter window is never substituted. */
public class InsufficientHistoryException extends SyncException {
    private final String exchange;
    private final int openDays;

    public InsufficientHistoryException(String exchange, LocalDate end, int openDays) {
        super("trade_cal doesn't have " + openDays + " open days for " + exchange + " up to " + end
                + ". Run `update --tables trade_cal` with a longer history first.");
        this.exchange = exchange;
        this.openDays = openDays;
    }

    public String exchange() { return exchange; }
    public int openDays() { return openDays; }
}
