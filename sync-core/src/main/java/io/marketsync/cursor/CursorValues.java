package io.marketsync.cursor;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Cursor values are opaque strings, normally an ISO date or a compact yyyyMMdd date. */
public final class CursorValues {
    public static final DateTimeFormatter COMPACT = DateTimeFormatter.BASIC_ISO_DATE;

    private CursorValues() {}

    public static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String s = value.trim();
        try {
            if (s.contains("-")) return Optional.of(LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s));
            return Optional.of(LocalDate.parse(s, COMPACT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String format(LocalDate d) { return d.toString(); }

    /** Date-aware ordering; falls back to string order when either side is not a date. */
    public static int compare(String a, String b) {
        Optional<LocalDate> da = parseDate(a);
        Optional<LocalDate> db = parseDate(b);
        if (da.isPresent() && db.isPresent()) return da.get().compareTo(db.get());
        return a.trim().compareTo(b.trim());
    }
}
