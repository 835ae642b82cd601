package com.questrail.plcsim.protocol.telegram.connection;

/**
 * Raised when an operator-supplied host or port cannot be used.
 *
 * <p>This is a checked exception: the connection manager must translate it into
 * a {@code VALIDATION} error event rather than letting it reach the caller.</p>
 */
public final class InvalidEndpointException extends Exception
{
    public InvalidEndpointException(String message)
    {
        super(message);
    }
}
