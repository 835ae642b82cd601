package com.questrail.plcsim.log;

import com.questrail.plcsim.api.SimulatorEvent;
import com.questrail.plcsim.api.SimulatorEventListener;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * TelegramLog
 * =============================================================================
 * Bounded, in-memory record of the traffic and notices a presentation layer
 * shows to the operator.
 *
 * <p>Subscribe it to the simulator to have RX/TX telegrams, status changes and
 * errors appended automatically. When the log is full the oldest entry is
 * dropped.</p>
 *
 * <p>Thread-safe: events arrive on the consumer thread while a view may take
 * snapshots from its own.</p>
 */
public final class TelegramLog implements SimulatorEventListener
{
    public static final int DEFAULT_CAPACITY = 5_000;

    private final int capacity;
    private final Deque<EventLogEntry> entries = new ArrayDeque<>();

    private long nextIndex = 1;
    private long rxCount;
    private long txCount;

    public TelegramLog()
    {
        this(DEFAULT_CAPACITY);
    }

    public TelegramLog(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    @Override
    public void onEvent(SimulatorEvent event)
    {
        if (event instanceof SimulatorEvent.TelegramReceived rx) {
            synchronized (this) {
                rxCount++;
                append(EventLogEntry.telegram(nextIndex++, rx.timestamp(), LogDirection.RX, rx.telegram(),
                        rx.recovered() ? "recovered" : ""));
            }
        }
        else if (event instanceof SimulatorEvent.TelegramSent tx) {
            synchronized (this) {
                txCount++;
                append(EventLogEntry.telegram(nextIndex++, tx.timestamp(), LogDirection.TX, tx.telegram(), ""));
            }
        }
        else if (event instanceof SimulatorEvent.StatusChanged status) {
            notice(status.timestamp(), switch (status.status()) {
                case CONNECTING -> "Connecting";
                case CONNECTED -> "Connected";
                case DISCONNECTED -> "Disconnected";
                case ERROR -> "Connection error";
            });
        }
        else if (event instanceof SimulatorEvent.ErrorReported error) {
            notice(error.timestamp(), "ERROR: " + error.message());
        }
    }

    /** Append a local notice, e.g. the result of an export. */
    public synchronized void notice(Instant time, String text)
    {
        Objects.requireNonNull(text, "text");
        append(EventLogEntry.system(nextIndex++, time, text));
    }

    /**
     * Set the handshake tag on the entry with the given index.
     *
     * @return {@code false} if no such entry is still held
     */
    public synchronized boolean tag(long index, HandshakeTag tag)
    {
        Objects.requireNonNull(tag, "tag");
        List<EventLogEntry> copy = new ArrayList<>(entries);
        ListIterator<EventLogEntry> it = copy.listIterator();
        while (it.hasNext()) {
            EventLogEntry e = it.next();
            if (e.index() == index) {
                it.set(e.withTag(tag));
                entries.clear();
                entries.addAll(copy);
                return true;
            }
        }
        return false;
    }

    /** Remove every entry and reset the counters. Indices keep increasing. */
    public synchronized void clear()
    {
        entries.clear();
        rxCount = 0;
        txCount = 0;
    }

    public synchronized List<EventLogEntry> snapshot()
    {
        return List.copyOf(entries);
    }

    public synchronized int size()
    {
        return entries.size();
    }

    public synchronized long rxCount()
    {
        return rxCount;
    }

    public synchronized long txCount()
    {
        return txCount;
    }

    public int capacity()
    {
        return capacity;
    }

    private void append(EventLogEntry entry)
    {
        while (entries.size() >= capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }
}
