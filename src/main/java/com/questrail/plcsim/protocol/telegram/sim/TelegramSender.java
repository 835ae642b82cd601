package com.questrail.plcsim.protocol.telegram.sim;

/**
 * Outbound port used by the simulation engine.
 *
 * <p>The engine hands over complete, encoded frames. Whether and when they reach
 * the wire is the implementation's concern.</p>
 *
 * <p>Replies produced by timers are bound to the session they were armed for:
 * {@link #send(long, byte[])} refuses them once that session is no longer the
 * connected one.</p>
 */
public interface TelegramSender
{
    /** Returned by {@link #session()} while nothing is connected. */
    long NO_SESSION = 0L;

    /**
     * Queue one encoded frame on the current connection.
     *
     * @return {@code true} if the frame was accepted, {@code false} if there is no
     *         open connection (the implementation reports that itself)
     */
    boolean send(byte[] frame);

    /**
     * Queue one encoded frame only if {@code session} is still the connected one.
     *
     * <p>A refusal here is expected after a disconnect or reconnect and is not
     * reported as an error.</p>
     *
     * @return {@code true} if the frame was accepted
     */
    boolean send(long session, byte[] frame);

    /** Id of the connected session, or {@link #NO_SESSION}. */
    long session();
}
