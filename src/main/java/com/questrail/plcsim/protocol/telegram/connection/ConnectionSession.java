package com.questrail.plcsim.protocol.telegram.connection;

import com.questrail.plcsim.api.ConnectionStatus;
import com.questrail.plcsim.api.ErrorKind;
import com.questrail.plcsim.api.SimulatorEvent;
import com.questrail.plcsim.protocol.telegram.codec.DecodeResult;
import com.questrail.plcsim.protocol.telegram.codec.TelegramCodec;
import com.questrail.plcsim.protocol.telegram.config.SimulatorTimingPolicy;
import com.questrail.plcsim.protocol.telegram.internal.events.EventChannel;
import com.questrail.plcsim.protocol.telegram.internal.frame.TelegramStreamAccumulator;
import com.questrail.plcsim.protocol.telegram.internal.time.WallClock;
import com.questrail.plcsim.protocol.telegram.observability.ConnectionTransitionEvent;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimErrorEvent;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimObservabilitySink;
import com.questrail.plcsim.protocol.telegram.observability.TelegramTrafficEvent;
import com.questrail.plcsim.protocol.telegram.transport.StreamEndpoint;
import com.questrail.plcsim.protocol.telegram.transport.StreamEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ConnectionSession
 * =============================================================================
 * One TCP session: a worker thread that connects and runs the send loop, plus
 * the receive path driven by the endpoint's I/O thread.
 *
 * <h2>Execution contexts</h2>
 * <ul>
 *   <li><b>Worker</b> ({@link #run()}): blocking connect, then drains the
 *       outbound queue until stopped. Owns teardown.</li>
 *   <li><b>Receive</b> ({@link #onBytes}, {@link #onInputClosed}): reassembles
 *       frames and publishes them. Never blocks, never tears down.</li>
 * </ul>
 *
 * <p>All events are published under this session's id, so anything emitted after
 * a newer session has opened is discarded by the {@link EventChannel}.</p>
 */
final class ConnectionSession implements Runnable, StreamEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);

    /** Wakes the send loop without writing anything. */
    private static final byte[] WAKE = new byte[0];

    private final long id;
    private final String host;
    private final int port;
    private final StreamEndpoint endpoint;
    private final TelegramStreamAccumulator accumulator;
    private final SimulatorTimingPolicy timing;
    private final EventChannel events;
    private final WallClock wallClock;
    private final PlcSimObservabilitySink sink;

    private final BlockingQueue<byte[]> outbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean endpointClosed = new AtomicBoolean(false);
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.IDLE);

    private volatile Thread worker;

    ConnectionSession(long id,
                      String host,
                      int port,
                      StreamEndpoint endpoint,
                      TelegramStreamAccumulator accumulator,
                      SimulatorTimingPolicy timing,
                      EventChannel events,
                      WallClock wallClock,
                      PlcSimObservabilitySink sink)
    {
        this.id = id;
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.accumulator = Objects.requireNonNull(accumulator, "accumulator");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.events = Objects.requireNonNull(events, "events");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.endpoint.setListener(this);
    }

    long id()
    {
        return id;
    }

    String remote()
    {
        return host + ":" + port;
    }

    ConnectionState state()
    {
        return state.get();
    }

    boolean isConnected()
    {
        return state.get() == ConnectionState.CONNECTED && !stopRequested.get();
    }

    /**
     * Announce CONNECTING and start the worker thread.
     */
    void start()
    {
        if (worker != null) {
            throw new IllegalStateException("session " + id + " already started");
        }
        transition(ConnectionState.CONNECTING);
        publishStatus(ConnectionStatus.CONNECTING);

        Thread t = new Thread(this, "plcsim-session-" + id);
        t.setDaemon(true);
        worker = t;
        t.start();
    }

    /**
     * Queue one frame for the send loop.
     *
     * @return {@code false} if the session is not connected
     */
    boolean enqueue(byte[] frame)
    {
        if (!isConnected()) {
            return false;
        }
        return outbound.offer(frame);
    }

    /**
     * Request shutdown and wait (bounded) for the worker to finish teardown.
     *
     * <p>Idempotent. Safe from any thread except the worker itself.</p>
     *
     * @return {@code true} if the worker terminated within {@code joinTimeout}
     */
    boolean stop(Duration joinTimeout)
    {
        if (stopRequested.compareAndSet(false, true)) {
            ConnectionState current = state.get();
            if (current == ConnectionState.CONNECTING || current == ConnectionState.CONNECTED) {
                transition(ConnectionState.DISCONNECTING);
            }
            endpoint.abort();
            outbound.offer(WAKE);
        }

        Thread t = worker;
        if (t == null || t == Thread.currentThread()) {
            return t == null;
        }
        try {
            t.join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("Session {} worker did not stop within {} ms", id, joinTimeout.toMillis());
            return false;
        }
        return true;
    }

    // -------------------------------------------------------------------------
    // Worker
    // -------------------------------------------------------------------------

    @Override
    public void run()
    {
        boolean opened = false;
        try {
            try {
                endpoint.open(host, port, timing.connectTimeout());
                opened = true;
            } catch (IOException e) {
                if (!stopRequested.get()) {
                    transition(ConnectionState.ERROR);
                    publishStatus(ConnectionStatus.ERROR);
                    publishError(ErrorKind.CONNECT, describe(e), e);
                }
                return;
            }

            if (stopRequested.get()) {
                return;
            }
            transition(ConnectionState.CONNECTED);
            publishStatus(ConnectionStatus.CONNECTED);

            sendLoop();
        } catch (RuntimeException e) {
            transition(ConnectionState.ERROR);
            publishError(ErrorKind.STREAM, describe(e), e);
        } finally {
            teardown(opened);
        }
    }

    private void sendLoop()
    {
        long pollMillis = timing.pollInterval().toMillis();
        while (!stopRequested.get()) {
            final byte[] frame;
            try {
                frame = outbound.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (frame == null || frame == WAKE || stopRequested.get()) {
                continue;
            }

            try {
                endpoint.write(frame, timing.writeTimeout());
            } catch (IOException e) {
                if (!stopRequested.get()) {
                    transition(ConnectionState.ERROR);
                    publishError(ErrorKind.STREAM, "Send failed: " + describe(e), e);
                }
                stopRequested.set(true);
                return;
            }

            DecodeResult sent = TelegramCodec.decode(frame);
            sink.onTelegram(new TelegramTrafficEvent(
                    wallClock.now(), id, TelegramTrafficEvent.Direction.OUTBOUND,
                    sent.telegram(), sent.isRecovered()));
            events.publish(id, new SimulatorEvent.TelegramSent(wallClock.now(), sent.telegram()));
        }
    }

    private void teardown(boolean opened)
    {
        if (endpointClosed.compareAndSet(false, true)) {
            endpoint.close();
        }

        int dropped;
        synchronized (accumulator) {
            dropped = accumulator.clear();
        }
        if (dropped > 0) {
            log.debug("Session {} dropped {} bytes of a partial frame", id, dropped);
        }

        int unsent = 0;
        byte[] pending;
        while ((pending = outbound.poll()) != null) {
            if (pending != WAKE) {
                unsent++;
            }
        }
        if (unsent > 0) {
            log.debug("Session {} discarded {} unsent frame(s)", id, unsent);
        }

        boolean announce = opened || stopRequested.get();
        stopRequested.set(true);
        transition(ConnectionState.IDLE);
        if (announce) {
            publishStatus(ConnectionStatus.DISCONNECTED);
        }
    }

    // -------------------------------------------------------------------------
    // Receive (endpoint I/O thread)
    // -------------------------------------------------------------------------

    @Override
    public void onBytes(byte[] chunk)
    {
        if (stopRequested.get()) {
            return;
        }

        TelegramStreamAccumulator.AppendResult result;
        synchronized (accumulator) {
            result = accumulator.append(chunk);
        }

        if (result.overflowed()) {
            publishError(ErrorKind.OVERFLOW,
                    "Receive buffer overflow: discarded " + result.discardedBytes() + " bytes", null);
        }

        for (byte[] frame : result.frames()) {
            DecodeResult decoded = TelegramCodec.decode(frame);
            if (decoded instanceof DecodeResult.Recovered r) {
                log.debug("Session {} recovered inbound frame: {}", id, r.anomalies());
            }
            sink.onTelegram(new TelegramTrafficEvent(
                    wallClock.now(), id, TelegramTrafficEvent.Direction.INBOUND,
                    decoded.telegram(), decoded.isRecovered()));
            events.publish(id, new SimulatorEvent.TelegramReceived(
                    wallClock.now(), decoded.telegram(), decoded.isRecovered()));
        }
    }

    @Override
    public void onInputClosed(Throwable cause)
    {
        if (stopRequested.getAndSet(true)) {
            return;
        }
        if (cause != null) {
            transition(ConnectionState.ERROR);
            publishError(ErrorKind.STREAM, describe(cause), cause);
        }
        else {
            log.info("Session {} closed by peer {}", id, remote());
        }
        outbound.offer(WAKE);
    }

    // -------------------------------------------------------------------------
    // Reporting
    // -------------------------------------------------------------------------

    private void transition(ConnectionState to)
    {
        ConnectionState from = state.getAndSet(to);
        if (from != to) {
            sink.onConnectionTransition(new ConnectionTransitionEvent(
                    wallClock.now(), id, remote(), from, to));
        }
    }

    private void publishStatus(ConnectionStatus status)
    {
        events.publish(id, new SimulatorEvent.StatusChanged(wallClock.now(), status));
    }

    private void publishError(ErrorKind kind, String message, Throwable cause)
    {
        sink.onError(new PlcSimErrorEvent(wallClock.now(), kind, message, cause));
        events.publish(id, new SimulatorEvent.ErrorReported(wallClock.now(), kind, message));
    }

    private static String describe(Throwable t)
    {
        String msg = t.getMessage();
        return msg != null && !msg.isBlank() ? msg : t.getClass().getSimpleName();
    }
}
