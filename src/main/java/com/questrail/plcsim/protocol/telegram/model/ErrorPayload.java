package com.questrail.plcsim.protocol.telegram.model;

/**
 * ERROR data view: {@code [ERRCODE:4][ERRMSG:98]}.
 */
public record ErrorPayload(String code, String message) {

    static ErrorPayload parse(String data) {
        return new ErrorPayload(
                Slots.field(data, 0, 4),
                Slots.field(data, 4, 102)
        );
    }

    public static String format(String code, String message) {
        return Slots.pad(code, 4) + Slots.pad(message, 98);
    }
}
