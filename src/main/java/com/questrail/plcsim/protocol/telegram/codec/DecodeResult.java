package com.questrail.plcsim.protocol.telegram.codec;

import com.questrail.plcsim.protocol.telegram.model.Telegram;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of decoding one frame.
 *
 * <p>Decoding never fails. A well-formed frame yields {@link Parsed}. A frame
 * that needed repair (non-ASCII bytes, a non-numeric sequence, a short input)
 * yields {@link Recovered}, which still carries a best-effort telegram together
 * with a description of each repair.</p>
 */
public sealed interface DecodeResult
        permits DecodeResult.Parsed, DecodeResult.Recovered
{
    Telegram telegram();

    default boolean isRecovered() {
        return this instanceof Recovered;
    }

    record Parsed(Telegram telegram) implements DecodeResult {
        public Parsed {
            Objects.requireNonNull(telegram, "telegram");
        }
    }

    record Recovered(Telegram telegram, List<String> anomalies) implements DecodeResult {
        public Recovered {
            Objects.requireNonNull(telegram, "telegram");
            anomalies = List.copyOf(anomalies);
        }
    }
}
