package com.questrail.plcsim.api;

import com.questrail.plcsim.protocol.telegram.model.TelegramType;

import java.util.Objects;
import java.util.Optional;

/**
 * Operator-composed telegram for {@link DeviceSimulator#sendManual(ManualTelegram)}.
 *
 * <p>The sequence number is never part of a manual telegram; the simulation
 * engine stamps the next one. Empty source or destination fall back to the
 * simulator's configured identity.</p>
 */
public record ManualTelegram(
        TelegramType type,
        String subtype,
        Optional<String> source,
        Optional<String> destination,
        String data
) {
    public ManualTelegram {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(subtype, "subtype");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(data, "data");
        if (type == TelegramType.UNKNOWN) {
            throw new IllegalArgumentException("manual telegrams need a known type");
        }
    }

    /** Subtype {@code 00}, addressed from the device to the host. */
    public static ManualTelegram of(TelegramType type, String data) {
        return new ManualTelegram(type, "00", Optional.empty(), Optional.empty(), data);
    }
}
