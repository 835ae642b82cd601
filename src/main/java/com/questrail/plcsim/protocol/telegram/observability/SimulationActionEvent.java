package com.questrail.plcsim.protocol.telegram.observability;

import java.time.Instant;

/**
 * Record of a decision made by the simulation engine.
 */
public record SimulationActionEvent(
    Instant timestamp,
    Action action,
    String detail
) {
    public enum Action {
        AUTO_LIFE_PING,
        AUTO_PONG,
        /** A LIFE arrived inside the pong rate-limit window; no reply. */
        PONG_SUPPRESSED,
        AUTO_CONFIRM,
        MANUAL_SEND,
        ERROR_REPLY,
        /** A timer fired after its connection epoch ended. */
        STALE_TIMER_IGNORED
    }
}
