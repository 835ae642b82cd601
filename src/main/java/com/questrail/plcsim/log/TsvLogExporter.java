package com.questrail.plcsim.log;

import com.questrail.plcsim.protocol.telegram.internal.time.WallClock;
import com.questrail.plcsim.protocol.telegram.model.Telegram;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes log entries as a tab-separated text file.
 *
 * <p>Field values come partly from the host. Tabs and line breaks inside them are
 * turned into spaces and other control characters are dropped, so every entry
 * stays on one line with a fixed number of columns.</p>
 */
public final class TsvLogExporter
{
    static final String HEADER = "TIME\t\t\tDIR\tSRC\t\tDST\t\tTYPE\tSEQ\tDATA";
    static final String SEPARATOR = "─".repeat(100);

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final WallClock wallClock;
    private final ZoneId zone;

    public TsvLogExporter(WallClock wallClock, ZoneId zone)
    {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * Write {@code entries} to {@code plcsim-export-<epochSeconds>.txt} in {@code directory}.
     *
     * @return the file written, or empty if there was nothing to export
     */
    public Optional<Path> exportTo(List<EventLogEntry> entries, Path directory) throws IOException
    {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(directory, "directory");
        if (entries.isEmpty()) {
            return Optional.empty();
        }

        Path file = directory.resolve("plcsim-export-" + wallClock.now().getEpochSecond() + ".txt");
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            export(entries, out);
        }
        return Optional.of(file);
    }

    public void export(List<EventLogEntry> entries, Writer out) throws IOException
    {
        out.write(HEADER);
        out.write('\n');
        out.write(SEPARATOR);
        out.write('\n');
        for (EventLogEntry e : entries) {
            out.write(line(e));
            out.write('\n');
        }
        out.flush();
    }

    String line(EventLogEntry e)
    {
        String time = TIME.format(e.time().atZone(zone));
        String dir = e.direction().name();
        if (e.telegram().isEmpty()) {
            return String.join("\t",
                    safe(time), dir, padRight("SYSTEM", 8), padRight("", 8), "SYS", "-", safe(e.notice()));
        }
        Telegram t = e.telegram().get();
        return String.join("\t",
                safe(time),
                dir,
                padRight(safe(t.source()), 8),
                padRight(safe(t.destination()), 8),
                safe(t.typeCode()),
                String.format("%06d", t.sequence()),
                safe(t.data().strip()));
    }

    /** Tab and line feed become a space; every other control character is removed. */
    static String safe(String value)
    {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\t' || c == '\n') {
                sb.append(' ');
            }
            else if (c >= 0x20 && c != 0x7F) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String padRight(String value, int width)
    {
        return value.length() >= width ? value : value + " ".repeat(width - value.length());
    }
}
