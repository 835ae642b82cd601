package com.questrail.plcsim.protocol.telegram.connection;

/**
 * Lifecycle of the connection manager.
 *
 * <pre>
 *   IDLE → CONNECTING → CONNECTED → {DISCONNECTING, ERROR} → IDLE
 * </pre>
 *
 * <p>A failed connect goes {@code CONNECTING → ERROR → IDLE}.</p>
 */
public enum ConnectionState
{
    IDLE,
    CONNECTING,
    CONNECTED,
    DISCONNECTING,
    ERROR
}
