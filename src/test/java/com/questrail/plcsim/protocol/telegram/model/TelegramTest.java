package com.questrail.plcsim.protocol.telegram.model;

import com.questrail.plcsim.protocol.telegram.codec.TelegramCodec;
import com.questrail.plcsim.protocol.telegram.codec.Telegrams;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TelegramTest {

    @Test
    void movePayloadIsOnlyVisibleOnMoveTelegrams() {
        Telegram move = decode(TelegramCodec.encode(TelegramType.MOVE, "00", "EWM", "PLC", 1,
                MovePayload.format("TU-42", "BIN-A", "BIN-B", "05")));

        MovePayload payload = move.move().orElseThrow();
        assertEquals("TU-42", payload.transferUnit());
        assertEquals("BIN-A", payload.sourceBin());
        assertEquals("BIN-B", payload.destinationBin());
        assertEquals("05", payload.priority());
        assertEquals("", payload.extra());
        assertTrue(move.confirm().isEmpty());
        assertTrue(move.error().isEmpty());
    }

    @Test
    void errorPayloadSplitsCodeAndMessage() {
        Telegram error = decode(Telegrams.error("PLC", "EWM", 3, "E001", "Manual error for TU TU-42"));

        ErrorPayload payload = error.error().orElseThrow();
        assertEquals("E001", payload.code());
        assertEquals("Manual error for TU TU-42", payload.message());
    }

    @Test
    void pongIsRecognisedOnlyForLifeTelegrams() {
        assertTrue(decode(Telegrams.life("PLC", "EWM", 1, true)).isPong());
        assertFalse(decode(Telegrams.life("PLC", "EWM", 1, false)).isPong());
        assertFalse(decode(TelegramCodec.encode(TelegramType.MOVE, "00", "EWM", "PLC", 1, "PONG")).isPong());
    }

    @Test
    void payloadSummaryIsTrimmedAndCut() {
        Telegram t = decode(TelegramCodec.encode(TelegramType.MOVE, "00", "EWM", "PLC", 1, "  ABCDEFGHIJ"));

        assertEquals("ABCDEFGHIJ", t.payloadSummary(80));
        assertEquals("ABCD", t.payloadSummary(4));
    }

    @Test
    void toBytesReturnsTheWireFrame() {
        byte[] frame = Telegrams.life("PLC", "EWM", 7, false);

        assertArrayEquals(frame, decode(frame).toBytes());
    }

    @Test
    void rejectsMalformedFields() {
        String data = " ".repeat(TelegramLayout.DATA_WIDTH);
        String raw = " ".repeat(TelegramLayout.FRAME_LENGTH);

        assertThrows(IllegalArgumentException.class,
                () -> new Telegram(TelegramType.LIFE, "LF", "00", "", "", 0, data, "short"));
        assertThrows(IllegalArgumentException.class,
                () -> new Telegram(TelegramType.LIFE, "LF", "00", "", "", 0, "short", raw));
        assertThrows(IllegalArgumentException.class,
                () -> new Telegram(TelegramType.LIFE, "LF", "00", "", "", 1_000_000, data, raw));
    }

    private static Telegram decode(byte[] frame) {
        return TelegramCodec.decode(frame).telegram();
    }
}
