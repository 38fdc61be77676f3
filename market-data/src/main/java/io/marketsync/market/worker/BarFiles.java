package io.marketsync.market.worker;

import io.marketsync.core.Row;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * The worker file protocol: gzip CSV with a fixed header that is written even when there are no bars,
 * plus an optional {@code <out>.err.txt} report when the worker fails.
 */
public final class BarFiles {
    public static final List<String> HEADER = List.of("ts_code", "trade_time", "open", "high", "low", "close", "volume", "amount");
    public static final DateTimeFormatter COMPACT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private BarFiles() {}

    public static Path errorReportPath(Path out) {
        return out.resolveSibling(out.getFileName() + ".err.txt");
    }

    /** Rows keyed by header name; {@code ts_code} and {@code trade_time} stay strings, other columns become doubles. */
    public static List<Row> read(Path file) throws IOException {
        List<Row> rows = new ArrayList<>();
        if (Files.size(file) == 0) return rows;
        try (BufferedReader r = reader(file)) {
            String headerLine = r.readLine();
            if (headerLine == null || headerLine.isBlank()) return rows;
            String[] header = headerLine.trim().split(",", -1);
            String line;
            while ((line = r.readLine()) != null) {
                if (line.isBlank()) continue;
                String[] cells = line.split(",", -1);
                Row row = new Row();
                for (int i = 0; i < header.length; i++) {
                    String cell = i < cells.length ? cells[i].trim() : "";
                    row.put(header[i], cell(header[i], cell));
                }
                rows.add(row);
            }
        }
        return rows;
    }

    /** True when the file holds at least one non-blank line after the header. */
    public static boolean hasBars(Path file) throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) return false;
        try (BufferedReader r = reader(file)) {
            if (r.readLine() == null) return false;
            String line;
            while ((line = r.readLine()) != null) {
                if (!line.isBlank()) return true;
            }
        }
        return false;
    }

    /** Worker side: writes the header and one line per row, overwriting {@code out}. */
    public static void write(Path out, List<Row> rows) throws IOException {
        try (BufferedWriter w = new BufferedWriter(new OutputStreamWriter(
                new GZIPOutputStream(Files.newOutputStream(out)), StandardCharsets.UTF_8))) {
            w.write(String.join(",", HEADER));
            w.newLine();
            for (Row row : rows) {
                List<String> cells = new ArrayList<>(HEADER.size());
                for (String c : HEADER) {
                    Object v = row.get(c);
                    cells.add(v == null ? "" : v.toString());
                }
                w.write(String.join(",", cells));
                w.newLine();
            }
        }
    }

    /** Worker side: records a failure next to the output so the caller can surface it. */
    public static void writeErrorReport(Path out, Throwable error) throws IOException {
        StringWriter sw = new StringWriter();
        error.printStackTrace(new PrintWriter(sw));
        Files.writeString(errorReportPath(out), sw.toString(), StandardCharsets.UTF_8);
    }

    private static BufferedReader reader(Path file) throws IOException {
        return new BufferedReader(new InputStreamReader(new GZIPInputStream(Files.newInputStream(file)), StandardCharsets.UTF_8));
    }

    private static Object cell(String column, String value) {
        if (value.isEmpty()) return null;
        if ("ts_code".equals(column) || "trade_time".equals(column)) return value;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }
}
