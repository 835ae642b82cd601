package com.questrail.plcsim.protocol.telegram.internal.events;

import com.questrail.plcsim.api.SimulatorEvent;
import com.questrail.plcsim.api.SimulatorEventListener;
import com.questrail.plcsim.protocol.telegram.internal.time.WallClock;
import com.questrail.plcsim.protocol.telegram.observability.NullObservabilitySink;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimErrorEvent;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimObservabilitySink;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EventChannel
 * =============================================================================
 * Ordered conduit carrying {@link SimulatorEvent}s from the connection's send and
 * receive contexts to the single consumer context.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>{@link #publish} may be called from any thread (multiple producers).</li>
 *   <li>{@link #drain} must be called from one consumer thread only. Listeners
 *       are invoked serially on that thread in publication order.</li>
 * </ul>
 *
 * <h2>Session epochs</h2>
 * <p>Every event is tagged with the session that produced it. {@link #openSession()}
 * discards whatever is still queued and advances the epoch. Events from older
 * sessions, whether queued or published late, are dropped rather than
 * delivered to the new session's consumers.</p>
 */
public final class EventChannel {

    private record Envelope(long session, SimulatorEvent event) {}

    private final BlockingQueue<Envelope> queue = new LinkedBlockingQueue<>();
    private final List<SimulatorEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong activeSession = new AtomicLong();
    private final WallClock wallClock;
    private final PlcSimObservabilitySink observabilitySink;

    public EventChannel(WallClock wallClock, PlcSimObservabilitySink observabilitySink) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public void subscribe(SimulatorEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void unsubscribe(SimulatorEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts a new session epoch, discarding all pending events.
     *
     * @return the new session id
     */
    public long openSession() {
        long id = activeSession.incrementAndGet();
        queue.clear();
        return id;
    }

    public long activeSession() {
        return activeSession.get();
    }

    /**
     * Enqueues an event produced by {@code session}. Events from a session
     * other than the active one are dropped immediately.
     *
     * @return {@code true} if the event was queued
     */
    public boolean publish(long session, SimulatorEvent event) {
        Objects.requireNonNull(event, "event");
        if (session != activeSession.get()) {
            return false;
        }
        return queue.offer(new Envelope(session, event));
    }

    /** Enqueues an event on behalf of the active session. */
    public boolean publish(SimulatorEvent event) {
        return publish(activeSession.get(), event);
    }

    /**
     * Delivers every queued event to the listeners, in order.
     *
     * @return number of events delivered
     */
    public int drain() {
        int delivered = 0;
        Envelope next;
        while ((next = queue.poll()) != null) {
            if (next.session() != activeSession.get()) {
                continue;
            }
            dispatch(next.event());
            delivered++;
        }
        return delivered;
    }

    /** Number of events waiting for {@link #drain()}. */
    public int pending() {
        return queue.size();
    }

    private void dispatch(SimulatorEvent event) {
        for (SimulatorEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                observabilitySink.onError(new PlcSimErrorEvent(
                    wallClock.now(),
                    null,
                    "Listener " + listener.getClass().getName() + " failed on " + event.getClass().getSimpleName(),
                    e
                ));
            }
        }
    }
}
