package com.questrail.plcsim.log;

import com.questrail.plcsim.protocol.telegram.model.Telegram;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of the telegram log.
 *
 * @param index     position in the log, starting at 1; never reused after trimming
 * @param telegram  the telegram, absent for {@link LogDirection#SYS} entries
 * @param notice    free text; for RX/TX entries empty unless the frame was repaired
 */
public record EventLogEntry(
        long index,
        Instant time,
        LogDirection direction,
        Optional<Telegram> telegram,
        String notice,
        HandshakeTag tag
) {
    public EventLogEntry {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(telegram, "telegram");
        Objects.requireNonNull(notice, "notice");
        Objects.requireNonNull(tag, "tag");
        if (direction == LogDirection.SYS && telegram.isPresent()) {
            throw new IllegalArgumentException("SYS entries carry no telegram");
        }
        if (direction != LogDirection.SYS && telegram.isEmpty()) {
            throw new IllegalArgumentException(direction + " entries need a telegram");
        }
    }

    public static EventLogEntry telegram(long index, Instant time, LogDirection direction, Telegram telegram, String notice) {
        return new EventLogEntry(index, time, direction, Optional.of(telegram), notice, HandshakeTag.NONE);
    }

    public static EventLogEntry system(long index, Instant time, String notice) {
        return new EventLogEntry(index, time, LogDirection.SYS, Optional.empty(), notice, HandshakeTag.NONE);
    }

    public EventLogEntry withTag(HandshakeTag newTag) {
        return new EventLogEntry(index, time, direction, telegram, notice, newTag);
    }
}
