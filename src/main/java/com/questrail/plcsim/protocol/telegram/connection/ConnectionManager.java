package com.questrail.plcsim.protocol.telegram.connection;

import com.questrail.plcsim.api.ErrorKind;
import com.questrail.plcsim.api.SimulatorEvent;
import com.questrail.plcsim.protocol.telegram.config.SimulatorConfig;
import com.questrail.plcsim.protocol.telegram.internal.events.EventChannel;
import com.questrail.plcsim.protocol.telegram.internal.frame.TelegramStreamAccumulator;
import com.questrail.plcsim.protocol.telegram.internal.time.WallClock;
import com.questrail.plcsim.protocol.telegram.model.TelegramLayout;
import com.questrail.plcsim.protocol.telegram.observability.NullObservabilitySink;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimErrorEvent;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimObservabilitySink;
import com.questrail.plcsim.protocol.telegram.sim.TelegramSender;
import com.questrail.plcsim.protocol.telegram.transport.StreamEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * ConnectionManager
 * =============================================================================
 * Owns the (at most one) active {@link ConnectionSession} and translates
 * operator connect/disconnect/send requests into session operations.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Validate host and port before any socket is touched</li>
 *   <li>Stop and join the previous session before starting a new one</li>
 *   <li>Open a new event epoch per session so stale events never leak</li>
 *   <li>Create one fresh {@link StreamEndpoint} per session</li>
 * </ul>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class does not decide what to send. It never retries or reconnects on
 * its own; reconnecting is an operator action.
 *
 * <h2>Threading</h2>
 * {@link #connect} and {@link #disconnect} are serialized on an internal lock and
 * may block for up to the join timeout. {@link #send} never blocks.
 */
public final class ConnectionManager implements TelegramSender
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final Object lifecycleLock = new Object();

    private final SimulatorConfig config;
    private final Supplier<? extends StreamEndpoint> endpointFactory;
    private final EventChannel events;
    private final WallClock wallClock;
    private final PlcSimObservabilitySink sink;

    private volatile ConnectionSession current;

    public ConnectionManager(SimulatorConfig config,
                             Supplier<? extends StreamEndpoint> endpointFactory,
                             EventChannel events,
                             WallClock wallClock,
                             PlcSimObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.events = Objects.requireNonNull(events, "events");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = sink != null ? sink : NullObservabilitySink.INSTANCE;
    }

    /**
     * Connect to {@code host:port}, replacing any existing session.
     *
     * <p>Returns once the new session's worker is started; the outcome arrives as
     * events. Invalid input yields a single {@code VALIDATION} error event.</p>
     */
    public void connect(String host, int port)
    {
        final String target;
        try {
            target = HostPortValidator.validate(host, port);
        } catch (InvalidEndpointException e) {
            reportValidation(e);
            return;
        }
        open(target, port);
    }

    /**
     * Variant taking operator-entered port text.
     */
    public void connect(String host, String portText)
    {
        final String target;
        final int port;
        try {
            port = HostPortValidator.parsePort(portText);
            target = HostPortValidator.validate(host, port);
        } catch (InvalidEndpointException e) {
            reportValidation(e);
            return;
        }
        open(target, port);
    }

    /**
     * Stop the active session, if any. Idempotent.
     */
    public void disconnect()
    {
        synchronized (lifecycleLock) {
            ConnectionSession s = current;
            if (s != null) {
                s.stop(config.timing().joinTimeout());
            }
        }
    }

    @Override
    public boolean send(byte[] frame)
    {
        checkFrame(frame);

        ConnectionSession s = current;
        if (s != null && s.enqueue(frame.clone())) {
            return true;
        }

        String message = "Not connected";
        sink.onError(new PlcSimErrorEvent(wallClock.now(), ErrorKind.NOT_CONNECTED, message, null));
        events.publish(new SimulatorEvent.ErrorReported(wallClock.now(), ErrorKind.NOT_CONNECTED, message));
        return false;
    }

    @Override
    public boolean send(long session, byte[] frame)
    {
        checkFrame(frame);

        ConnectionSession s = current;
        if (s == null || s.id() != session) {
            log.debug("Dropping frame for ended session {}", session);
            return false;
        }
        return s.enqueue(frame.clone());
    }

    @Override
    public long session()
    {
        ConnectionSession s = current;
        return s != null && s.isConnected() ? s.id() : NO_SESSION;
    }

    public ConnectionState state()
    {
        ConnectionSession s = current;
        return s != null ? s.state() : ConnectionState.IDLE;
    }

    public boolean isConnected()
    {
        ConnectionSession s = current;
        return s != null && s.isConnected();
    }

    private void open(String host, int port)
    {
        synchronized (lifecycleLock) {
            ConnectionSession previous = current;
            if (previous != null) {
                previous.stop(config.timing().joinTimeout());
            }

            long sessionId = events.openSession();
            ConnectionSession session = new ConnectionSession(
                    sessionId,
                    host,
                    port,
                    endpointFactory.get(),
                    new TelegramStreamAccumulator(TelegramLayout.FRAME_LENGTH, config.receiveBufferFrames()),
                    config.timing(),
                    events,
                    wallClock,
                    sink);
            current = session;
            session.start();
        }
    }

    private static void checkFrame(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (frame.length != TelegramLayout.FRAME_LENGTH) {
            throw new IllegalArgumentException(
                    "frame must be " + TelegramLayout.FRAME_LENGTH + " bytes, got " + frame.length);
        }
    }

    private void reportValidation(InvalidEndpointException e)
    {
        sink.onError(new PlcSimErrorEvent(wallClock.now(), ErrorKind.VALIDATION, e.getMessage(), null));
        events.publish(new SimulatorEvent.ErrorReported(wallClock.now(), ErrorKind.VALIDATION, e.getMessage()));
    }
}
