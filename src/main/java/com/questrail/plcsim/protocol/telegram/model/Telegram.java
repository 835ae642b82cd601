package com.questrail.plcsim.protocol.telegram.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Telegram
 * =============================================================================
 * Immutable value of one fixed 128-byte ASCII protocol message.
 *
 * <h2>Field conventions</h2>
 * <ul>
 *   <li>{@code typeCode}, {@code subtype}, {@code source} and {@code destination}
 *       are trimmed; they are never {@code null}.</li>
 *   <li>{@code data} is the untrimmed 102-character payload slot.</li>
 *   <li>{@code raw} is the exact 128-character frame as transmitted. It is
 *       ASCII-only; unrepresentable characters have already been replaced with
 *       {@code '?'}.</li>
 * </ul>
 *
 * <p>Instances are produced by {@code TelegramCodec.decode}. The sub-payload
 * accessors are derived views over {@code data} and are only present when the
 * telegram's type matches.</p>
 */
public record Telegram(
        TelegramType type,
        String typeCode,
        String subtype,
        String source,
        String destination,
        int sequence,
        String data,
        String raw
) {
    public Telegram {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(typeCode, "typeCode");
        Objects.requireNonNull(subtype, "subtype");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(raw, "raw");

        if (raw.length() != TelegramLayout.FRAME_LENGTH) {
            throw new IllegalArgumentException(
                    "raw frame must be " + TelegramLayout.FRAME_LENGTH + " chars, was " + raw.length());
        }
        if (data.length() != TelegramLayout.DATA_WIDTH) {
            throw new IllegalArgumentException(
                    "data must be " + TelegramLayout.DATA_WIDTH + " chars, was " + data.length());
        }
        if (sequence < 0 || sequence >= TelegramLayout.SEQUENCE_MODULUS) {
            throw new IllegalArgumentException("sequence out of range: " + sequence);
        }
    }

    public Optional<MovePayload> move() {
        return type == TelegramType.MOVE ? Optional.of(MovePayload.parse(data)) : Optional.empty();
    }

    public Optional<ConfirmPayload> confirm() {
        return type == TelegramType.CONFIRM ? Optional.of(ConfirmPayload.parse(data)) : Optional.empty();
    }

    public Optional<ErrorPayload> error() {
        return type == TelegramType.ERROR ? Optional.of(ErrorPayload.parse(data)) : Optional.empty();
    }

    /** True for a LIFE telegram whose data reads {@code PONG}. */
    public boolean isPong() {
        return type == TelegramType.LIFE && data.strip().equals("PONG");
    }

    /**
     * Trimmed payload, cut to {@code maxLength} characters, for one-line display.
     */
    public String payloadSummary(int maxLength) {
        String trimmed = data.strip();
        return trimmed.length() <= maxLength ? trimmed : trimmed.substring(0, maxLength);
    }

    /** The frame bytes exactly as they appear on the wire. */
    public byte[] toBytes() {
        return raw.getBytes(StandardCharsets.US_ASCII);
    }
}
