package com.questrail.plcsim.protocol.telegram.model;

/**
 * MOVE data view: {@code [TU:20][SRC_BIN:20][DST_BIN:20][PRIORITY:2][EXTRA:40]}.
 *
 * <p>All fields are trimmed. A move order asks the device to transport one
 * transfer unit from a source bin to a destination bin.</p>
 */
public record MovePayload(
        String transferUnit,
        String sourceBin,
        String destinationBin,
        String priority,
        String extra
) {
    static MovePayload parse(String data) {
        return new MovePayload(
                Slots.field(data, 0, 20),
                Slots.field(data, 20, 40),
                Slots.field(data, 40, 60),
                Slots.field(data, 60, 62),
                Slots.field(data, 62, 102)
        );
    }

    /**
     * Lays out a MOVE data block, truncating and padding each slot.
     */
    public static String format(String transferUnit, String sourceBin, String destinationBin, String priority) {
        return Slots.pad(transferUnit, 20)
                + Slots.pad(sourceBin, 20)
                + Slots.pad(destinationBin, 20)
                + Slots.pad(priority, 2);
    }
}
