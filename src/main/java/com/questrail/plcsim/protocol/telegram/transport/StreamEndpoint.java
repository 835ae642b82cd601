package com.questrail.plcsim.protocol.telegram.transport;

import java.io.IOException;
import java.time.Duration;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for one outbound byte-stream connection (TCP-style).
 *
 * <p>An endpoint instance serves exactly one connection attempt. The connection
 * manager creates a fresh endpoint for every session.</p>
 *
 * <p>Implementations may be backed by Netty, plain sockets, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Register the listener that receives inbound bytes and closure.
     *
     * <p>This must be called before {@link #open}.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * Connect to the remote peer, blocking for at most {@code timeout}.
     *
     * <p>Once this returns, inbound bytes begin to flow to the listener from the
     * endpoint's receive context.</p>
     *
     * @throws IOException if the connection cannot be established in time
     */
    void open(String host, int port, Duration timeout) throws IOException;

    /**
     * Write one payload, blocking until it has been handed to the socket or
     * {@code timeout} expires.
     *
     * @throws IOException if the endpoint is not open or the write fails
     */
    void write(byte[] payload, Duration timeout) throws IOException;

    /**
     * Best-effort abortive shutdown that unblocks any in-progress I/O.
     *
     * <p>Non-blocking, idempotent, never throws. Safe to call before
     * {@link #open} has returned.</p>
     */
    void abort();

    /**
     * Release every resource held by the endpoint.
     *
     * <p>Implementations must release resources exactly once, however often this
     * is called. It must not be called from the endpoint's receive context.</p>
     */
    void close();
}
