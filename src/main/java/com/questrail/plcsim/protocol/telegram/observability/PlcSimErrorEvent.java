package com.questrail.plcsim.protocol.telegram.observability;

import com.questrail.plcsim.api.ErrorKind;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the simulator.
 *
 * @param kind  consumer-facing classification, or {@code null} for internal
 *              faults (a failing listener or timer task)
 * @param cause underlying exception, may be {@code null}
 */
public record PlcSimErrorEvent(
    Instant timestamp,
    ErrorKind kind,
    String message,
    Throwable cause
) {
}
