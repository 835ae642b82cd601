package com.questrail.plcsim.protocol.telegram.codec;

import com.questrail.plcsim.protocol.telegram.model.ConfirmPayload;
import com.questrail.plcsim.protocol.telegram.model.ErrorPayload;
import com.questrail.plcsim.protocol.telegram.model.TelegramType;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Builders for the telegrams the simulated device originates.
 *
 * <p>All builders use subtype {@code 00}. They are pure except for
 * {@link #confirm(String, String, long, String, String)}, which reads the local
 * wall-clock time.</p>
 */
public final class Telegrams
{
    public static final String DEFAULT_CONFIRM_STATUS = "DONE";

    private static final DateTimeFormatter CONFIRM_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private static final String SUBTYPE = "00";

    private Telegrams() {}

    /** LIFE telegram carrying {@code PING}, or {@code PONG} when answering one. */
    public static byte[] life(String source, String destination, long sequence, boolean pong)
    {
        return TelegramCodec.encode(TelegramType.LIFE, SUBTYPE, source, destination, sequence,
                pong ? "PONG" : "PING");
    }

    /** CONFIRM with status {@code DONE}, stamped with the current local time. */
    public static byte[] confirm(String source, String destination, long sequence,
                                 String transferUnit, String bin)
    {
        return confirm(source, destination, sequence, transferUnit, bin,
                DEFAULT_CONFIRM_STATUS, LocalDateTime.now());
    }

    public static byte[] confirm(String source, String destination, long sequence,
                                 String transferUnit, String bin, String status,
                                 LocalDateTime at)
    {
        String data = ConfirmPayload.format(transferUnit, bin, status, CONFIRM_TIMESTAMP.format(at));
        return TelegramCodec.encode(TelegramType.CONFIRM, SUBTYPE, source, destination, sequence, data);
    }

    public static byte[] error(String source, String destination, long sequence,
                               String code, String message)
    {
        return TelegramCodec.encode(TelegramType.ERROR, SUBTYPE, source, destination, sequence,
                ErrorPayload.format(code, message));
    }
}
