package io.marketsync.market.cli;

import io.marketsync.cursor.CursorValues;
import picocli.CommandLine;

import java.time.LocalDate;

/** Accepts YYYY-MM-DD or YYYYMMDD. */
public class DateConverter implements CommandLine.ITypeConverter<LocalDate> {
    @Override
    public LocalDate convert(String value) {
        return CursorValues.parseDate(value)
                .orElseThrow(() -> new CommandLine.TypeConversionException("not a date: " + value));
    }
}
