package com.questrail.plcsim.api;

/**
 * Classification of errors reported through {@link SimulatorEvent.ErrorReported}.
 *
 * <p>Every kind is recoverable. Codec framing defects are programmer errors and
 * never surface here.</p>
 */
public enum ErrorKind
{
    /** Host or port rejected before any socket was opened. */
    VALIDATION,

    /** TCP connect failed or timed out; the connection is back to idle. */
    CONNECT,

    /** Mid-session read or write failure; the session tore itself down. */
    STREAM,

    /** Receive buffer cap exceeded; oldest bytes were discarded. */
    OVERFLOW,

    /** An outbound telegram was requested while no session was connected. */
    NOT_CONNECTED
}
