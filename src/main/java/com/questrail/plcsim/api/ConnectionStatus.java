package com.questrail.plcsim.api;

/**
 * ConnectionStatus
 * -----------------------------------------------------------------------------
 * Coarse connection status reported to consumers through
 * {@link SimulatorEvent.StatusChanged}.
 *
 * <p>The sequence for a successful session is
 * {@code CONNECTING -> CONNECTED -> DISCONNECTED}. A failed connect attempt reports
 * {@code CONNECTING -> ERROR} and is followed by an
 * {@link SimulatorEvent.ErrorReported} carrying the cause.</p>
 */
public enum ConnectionStatus
{
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    ERROR
}
