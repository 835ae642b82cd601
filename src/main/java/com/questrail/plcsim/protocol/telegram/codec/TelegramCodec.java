package com.questrail.plcsim.protocol.telegram.codec;

import com.questrail.plcsim.protocol.telegram.model.Telegram;
import com.questrail.plcsim.protocol.telegram.model.TelegramType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static com.questrail.plcsim.protocol.telegram.model.TelegramLayout.*;

/**
 * TelegramCodec
 * -----------------------------------------------------------------------------
 * Pure encode/decode functions for the fixed 128-byte telegram frame.
 *
 * <h2>Encoding</h2>
 * <p>Each field is fitted to its slot:</p>
 * <ul>
 *   <li>type: first two characters, upper-cased, space padded</li>
 *   <li>subtype: zero filled to two digits, then cut to two</li>
 *   <li>source, destination: first eight characters, space padded</li>
 *   <li>sequence: taken modulo 1,000,000 and zero padded to six digits</li>
 *   <li>data: first 102 characters, space padded</li>
 * </ul>
 * <p>Non-ASCII code points are replaced with {@code '?'} before slot fitting so
 * that each code point occupies exactly one wire byte.</p>
 *
 * <h2>Decoding</h2>
 * <p>Decoding reads exactly the first 128 bytes and ignores the rest. Locating
 * frame boundaries in a stream is the caller's job. Decoding never throws for a
 * non-null input; see {@link DecodeResult}.</p>
 */
public final class TelegramCodec
{
    private static final char REPLACEMENT = '?';

    private TelegramCodec() {}

    /**
     * Encode a telegram from its raw field values.
     *
     * @throws TelegramFramingException if the composed body is not 128 characters
     */
    public static byte[] encode(String typeCode,
                                String subtype,
                                String source,
                                String destination,
                                long sequence,
                                String data)
    {
        Objects.requireNonNull(typeCode, "typeCode");
        Objects.requireNonNull(subtype, "subtype");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(data, "data");

        String body = padRight(ascii(typeCode).toUpperCase(Locale.ROOT), TYPE_WIDTH)
                + zeroFill(ascii(subtype), SUBTYPE_WIDTH)
                + padRight(ascii(source), SOURCE_WIDTH)
                + padRight(ascii(destination), DESTINATION_WIDTH)
                + zeroFill(Long.toString(Math.floorMod(sequence, (long) SEQUENCE_MODULUS)), SEQUENCE_WIDTH)
                + padRight(ascii(data), DATA_WIDTH);

        if (body.length() != FRAME_LENGTH) {
            throw new TelegramFramingException(
                    "telegram body length " + body.length() + " != " + FRAME_LENGTH);
        }
        return body.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Encode a telegram of a known type.
     *
     * @throws IllegalArgumentException for {@link TelegramType#UNKNOWN}, which has no wire code
     */
    public static byte[] encode(TelegramType type,
                                String subtype,
                                String source,
                                String destination,
                                long sequence,
                                String data)
    {
        Objects.requireNonNull(type, "type");
        String code = type.code().orElseThrow(
                () -> new IllegalArgumentException("UNKNOWN telegrams cannot be encoded"));
        return encode(code, subtype, source, destination, sequence, data);
    }

    /**
     * Decode the first 128 bytes of {@code frame}.
     */
    public static DecodeResult decode(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        List<String> anomalies = new ArrayList<>(2);

        byte[] bytes;
        if (frame.length < FRAME_LENGTH) {
            anomalies.add("short frame: " + frame.length + " bytes");
            bytes = Arrays.copyOf(frame, FRAME_LENGTH);
            Arrays.fill(bytes, frame.length, FRAME_LENGTH, (byte) ' ');
        }
        else {
            bytes = frame;
        }

        char[] chars = new char[FRAME_LENGTH];
        int replaced = 0;
        for (int i = 0; i < FRAME_LENGTH; i++) {
            int b = bytes[i] & 0xFF;
            if (b > 0x7F) {
                chars[i] = REPLACEMENT;
                replaced++;
            }
            else {
                chars[i] = (char) b;
            }
        }
        if (replaced > 0) {
            anomalies.add(replaced + " non-ASCII byte(s) replaced");
        }

        String raw = new String(chars);
        String typeCode = slot(raw, TYPE_OFFSET, TYPE_WIDTH).strip();
        String subtype = slot(raw, SUBTYPE_OFFSET, SUBTYPE_WIDTH).strip();
        String source = slot(raw, SOURCE_OFFSET, SOURCE_WIDTH).strip();
        String destination = slot(raw, DESTINATION_OFFSET, DESTINATION_WIDTH).strip();
        String sequenceText = slot(raw, SEQUENCE_OFFSET, SEQUENCE_WIDTH).strip();
        String data = slot(raw, DATA_OFFSET, DATA_WIDTH);

        int sequence = parseSequence(sequenceText);
        if (sequence < 0) {
            anomalies.add("non-numeric sequence '" + sequenceText + "'");
            sequence = 0;
        }

        Telegram telegram = new Telegram(
                TelegramType.fromCode(typeCode),
                typeCode,
                subtype,
                source,
                destination,
                sequence,
                data,
                raw
        );

        return anomalies.isEmpty()
                ? new DecodeResult.Parsed(telegram)
                : new DecodeResult.Recovered(telegram, anomalies);
    }

    // -------------------------------------------------------------------------

    /** Returns the parsed value, or -1 if the text is not a plain decimal number. */
    private static int parseSequence(String text)
    {
        if (text.isEmpty()) {
            return -1;
        }
        int value = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }

    private static String slot(String raw, int offset, int width)
    {
        return raw.substring(offset, offset + width);
    }

    /** Replaces every non-ASCII code point with a single {@code '?'}. */
    static String ascii(String value)
    {
        StringBuilder sb = new StringBuilder(value.length());
        value.codePoints().forEach(cp -> sb.append(cp < 0x80 ? (char) cp : REPLACEMENT));
        return sb.toString();
    }

    private static String padRight(String value, int width)
    {
        if (value.length() >= width) {
            return value.substring(0, width);
        }
        return value + " ".repeat(width - value.length());
    }

    private static String zeroFill(String value, int width)
    {
        String filled = value.length() >= width ? value : "0".repeat(width - value.length()) + value;
        return filled.substring(0, width);
    }
}
