package com.questrail.plcsim.protocol.telegram.model;

/**
 * CONFIRM data view: {@code [TU:20][BIN:20][STATUS:4][TIMESTAMP:14][EXTRA:44]}.
 *
 * <p>The timestamp is the device's local time formatted as
 * {@code yyyyMMddHHmmss}.</p>
 */
public record ConfirmPayload(
        String transferUnit,
        String bin,
        String status,
        String timestamp
) {
    static ConfirmPayload parse(String data) {
        return new ConfirmPayload(
                Slots.field(data, 0, 20),
                Slots.field(data, 20, 40),
                Slots.field(data, 40, 44),
                Slots.field(data, 44, 58)
        );
    }

    public static String format(String transferUnit, String bin, String status, String timestamp) {
        return Slots.pad(transferUnit, 20)
                + Slots.pad(bin, 20)
                + Slots.pad(status, 4)
                + Slots.pad(timestamp, 14);
    }
}
