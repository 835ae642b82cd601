package com.questrail.plcsim.protocol.telegram.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>All callbacks are delivered serially from a single receive context.</p>
 */
public interface StreamEndpointListener
{
    /**
     * Called with each chunk read from the stream.
     *
     * <p>Chunk boundaries are arbitrary. They carry no framing meaning.</p>
     */
    void onBytes(byte[] chunk);

    /**
     * Called when the inbound side of the stream ends.
     *
     * <p>May be called more than once (an exception followed by channel
     * closure); listeners must tolerate repeats.</p>
     *
     * @param cause the failure, or {@code null} for an orderly close by either side
     */
    void onInputClosed(Throwable cause);
}
