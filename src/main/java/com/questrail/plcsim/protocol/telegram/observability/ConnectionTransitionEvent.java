package com.questrail.plcsim.protocol.telegram.observability;

import com.questrail.plcsim.protocol.telegram.connection.ConnectionState;

import java.time.Instant;

/**
 * Record of one connection lifecycle transition.
 *
 * @param sessionId identity of the session that transitioned
 * @param remote    {@code host:port} the session targets
 */
public record ConnectionTransitionEvent(
    Instant timestamp,
    long sessionId,
    String remote,
    ConnectionState from,
    ConnectionState to
) {
}
