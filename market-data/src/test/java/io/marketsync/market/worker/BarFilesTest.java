package io.marketsync.market.worker;

import io.marketsync.core.Row;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BarFilesTest {
    @Test
    void header_only_file_has_no_bars() throws Exception {
        Path out = Files.createTempDirectory("bars").resolve("empty.csv.gz");
        BarFiles.write(out, List.of());
        assertTrue(Files.size(out) > 0);
        assertFalse(BarFiles.hasBars(out));
        assertTrue(BarFiles.read(out).isEmpty());
    }

    @Test
    void reads_bars_with_blank_cells_as_null() throws Exception {
        Path out = Files.createTempDirectory("bars").resolve("bars.csv.gz");
        BarFiles.write(out, List.of(
                Row.of("ts_code", "000001.SZ", "trade_time", "20240102093500", "open", 10.0, "high", 10.2,
                        "low", 9.9, "close", 10.1, "volume", 1200.0, "amount", 12120.0),
                Row.of("ts_code", "000001.SZ", "trade_time", "20240102094000", "close", 10.15)));

        assertTrue(BarFiles.hasBars(out));
        List<Row> rows = BarFiles.read(out);
        assertEquals(2, rows.size());
        assertEquals("20240102093500", rows.get(0).get("trade_time"));
        assertEquals(10.1, rows.get(0).get("close"));
        assertEquals(1200.0, rows.get(0).get("volume"));
        assertNull(rows.get(1).get("open"));
        assertEquals(10.15, rows.get(1).get("close"));
        assertEquals(BarFiles.HEADER, List.copyOf(rows.get(1).columns()));
    }

    @Test
    void missing_or_zero_length_file_has_no_bars() throws IOException {
        Path dir = Files.createTempDirectory("bars");
        assertFalse(BarFiles.hasBars(dir.resolve("absent.csv.gz")));
        Path zero = Files.createFile(dir.resolve("zero.csv.gz"));
        assertFalse(BarFiles.hasBars(zero));
        assertTrue(BarFiles.read(zero).isEmpty());
    }

    @Test
    void error_report_sits_next_to_output() throws IOException {
        Path out = Files.createTempDirectory("bars").resolve("chunk_1of2.csv.gz");
        assertEquals(out.getParent().resolve("chunk_1of2.csv.gz.err.txt"), BarFiles.errorReportPath(out));
        BarFiles.writeErrorReport(out, new IllegalStateException("terminal not logged in"));
        String text = Files.readString(BarFiles.errorReportPath(out), StandardCharsets.UTF_8);
        assertTrue(text.contains("terminal not logged in"));
    }
}
