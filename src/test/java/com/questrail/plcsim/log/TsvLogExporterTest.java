package com.questrail.plcsim.log;

import com.questrail.plcsim.protocol.telegram.codec.TelegramCodec;
import com.questrail.plcsim.protocol.telegram.model.Telegram;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TsvLogExporterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T08:15:30.250Z");

    private final TsvLogExporter exporter = new TsvLogExporter(() -> T0, ZoneOffset.UTC);

    @Test
    void writesHeaderSeparatorAndRows() throws IOException {
        Telegram t = TelegramCodec.decode(TelegramCodec.encode("MO", "00", "EWM-MFS", "PLC-SIM", 12, "TU0001")).telegram();
        List<EventLogEntry> entries = List.of(
                EventLogEntry.telegram(1, T0, LogDirection.RX, t, ""),
                EventLogEntry.system(2, T0, "Connected"));

        StringWriter out = new StringWriter();
        exporter.export(entries, out);

        String[] lines = out.toString().split("\n");
        assertEquals(4, lines.length);
        assertEquals("TIME\t\t\tDIR\tSRC\t\tDST\t\tTYPE\tSEQ\tDATA", lines[0]);
        assertEquals("─".repeat(100), lines[1]);
        assertEquals("08:15:30.250\tRX\tEWM-MFS \tPLC-SIM \tMO\t000012\tTU0001", lines[2]);
        assertEquals("08:15:30.250\tSYS\tSYSTEM  \t        \tSYS\t-\tConnected", lines[3]);
    }

    @Test
    void hostDataCannotBreakTheColumns() throws IOException {
        Telegram t = TelegramCodec.decode(
                TelegramCodec.encode("ER", "00", "EW\tM", "PLC", 1, "E001bad\tvalue\r\nnext\u0007line")).telegram();

        StringWriter out = new StringWriter();
        exporter.export(List.of(EventLogEntry.telegram(1, T0, LogDirection.RX, t, "")), out);

        String row = out.toString().split("\n")[2];
        assertEquals(7, row.split("\t", -1).length);
        assertTrue(row.endsWith("E001bad value next" + "line"));
        assertFalse(row.contains("\r"));
        assertFalse(row.contains("\u0007"));
    }

    @Test
    void exportToNamesFileAfterEpochSeconds(@TempDir Path dir) throws IOException {
        List<EventLogEntry> entries = List.of(EventLogEntry.system(1, T0, "hello"));

        Path file = exporter.exportTo(entries, dir).orElseThrow();

        assertEquals("plcsim-export-" + T0.getEpochSecond() + ".txt", file.getFileName().toString());
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertTrue(lines.get(2).endsWith("hello"));
    }

    @Test
    void emptyLogWritesNothing(@TempDir Path dir) throws IOException {
        assertTrue(exporter.exportTo(List.of(), dir).isEmpty());
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void safeStripsControlCharacters() {
        assertEquals("a b c", TsvLogExporter.safe("a\tb\nc"));
        assertEquals("ab", TsvLogExporter.safe("a\r\u0000b"));
    }
}
