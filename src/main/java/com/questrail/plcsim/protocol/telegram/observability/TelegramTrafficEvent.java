package com.questrail.plcsim.protocol.telegram.observability;

import com.questrail.plcsim.protocol.telegram.model.Telegram;

import java.time.Instant;

/**
 * Record of one telegram crossing the socket.
 */
public record TelegramTrafficEvent(
    Instant timestamp,
    long sessionId,
    Direction direction,
    Telegram telegram,
    boolean recovered
) {
    public enum Direction { INBOUND, OUTBOUND }
}
