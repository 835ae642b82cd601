package com.questrail.plcsim.protocol.telegram.sim;

import com.questrail.plcsim.api.ConnectionStatus;
import com.questrail.plcsim.api.ManualTelegram;
import com.questrail.plcsim.api.SimulatorEvent;
import com.questrail.plcsim.api.SimulatorEventListener;
import com.questrail.plcsim.protocol.telegram.codec.TelegramCodec;
import com.questrail.plcsim.protocol.telegram.codec.Telegrams;
import com.questrail.plcsim.protocol.telegram.config.SimulatorConfig;
import com.questrail.plcsim.protocol.telegram.config.SimulatorTimingPolicy;
import com.questrail.plcsim.protocol.telegram.internal.time.Cancellable;
import com.questrail.plcsim.protocol.telegram.internal.time.MonotonicClock;
import com.questrail.plcsim.protocol.telegram.internal.time.MonotonicScheduler;
import com.questrail.plcsim.protocol.telegram.internal.time.WallClock;
import com.questrail.plcsim.protocol.telegram.model.ConfirmPayload;
import com.questrail.plcsim.protocol.telegram.model.MovePayload;
import com.questrail.plcsim.protocol.telegram.model.Telegram;
import com.questrail.plcsim.protocol.telegram.model.TelegramType;
import com.questrail.plcsim.protocol.telegram.observability.NullObservabilitySink;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimErrorEvent;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimObservabilitySink;
import com.questrail.plcsim.protocol.telegram.observability.SimulationActionEvent;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongConsumer;

/**
 * SimulationEngine
 * =============================================================================
 * Behaves like the conveyor PLC: answers LIFE with PONG, confirms MOVE orders,
 * emits periodic PINGs, and sends operator-composed telegrams.
 *
 * <h2>Inputs</h2>
 * <ul>
 *   <li>{@link SimulatorEvent}s from the connection, via {@link #onEvent}</li>
 *   <li>Operator commands (toggles, identity, manual sends)</li>
 *   <li>Its own timers, through the {@link MonotonicScheduler}</li>
 * </ul>
 *
 * <h2>Epochs and sessions</h2>
 * Every status change, and every {@link #cancelTimers()}, starts a new epoch and
 * cancels every pending timer. A timer also remembers the connection session it
 * was armed for. If its epoch has ended, or that session is no longer the
 * sender's connected one, the firing does nothing. Its frame is handed over
 * with {@link TelegramSender#send(long, byte[])}, so a delayed CONFIRM can never
 * reach a session other than the one whose MOVE caused it, even while the
 * status change of a reconnect is still queued.
 *
 * <h2>Threading</h2>
 * Not thread-safe. Event delivery, operator commands and timer tasks must all
 * run on the same consumer context.
 */
public final class SimulationEngine implements SimulatorEventListener
{
    public static final String MANUAL_ERROR_CODE = "E001";

    private final SimulatorConfig config;
    private final SimulatorTimingPolicy timing;
    private final TelegramSender sender;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ZoneId zone;
    private final PlcSimObservabilitySink sink;

    private final SequenceGenerator sequence = new SequenceGenerator();
    private final PongRateLimiter pongLimiter;
    private final Set<Timer> pending = new LinkedHashSet<>();

    private long epoch;
    private boolean connected;

    private String deviceId;
    private String hostId;

    private boolean autoLifeEnabled;
    private Duration autoLifeInterval;
    private Timer autoLifeTimer;

    private boolean autoConfirmEnabled;

    public SimulationEngine(SimulatorConfig config,
                            TelegramSender sender,
                            MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            WallClock wallClock,
                            PlcSimObservabilitySink sink)
    {
        this(config, sender, scheduler, clock, wallClock, ZoneId.systemDefault(), sink);
    }

    /**
     * @param zone zone used to render CONFIRM timestamps
     */
    public SimulationEngine(SimulatorConfig config,
                            TelegramSender sender,
                            MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            WallClock wallClock,
                            ZoneId zone,
                            PlcSimObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.timing = config.timing();
        this.sender = Objects.requireNonNull(sender, "sender");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.sink = sink != null ? sink : NullObservabilitySink.INSTANCE;

        this.pongLimiter = new PongRateLimiter(clock, timing.pongMinGap());
        this.deviceId = config.deviceId();
        this.hostId = config.hostId();
        this.autoLifeEnabled = config.autoLifeEnabled();
        this.autoLifeInterval = coerceInterval(config.autoLifeInterval());
        this.autoConfirmEnabled = config.autoConfirmEnabled();
    }

    // -------------------------------------------------------------------------
    // Event input
    // -------------------------------------------------------------------------

    @Override
    public void onEvent(SimulatorEvent event)
    {
        if (event instanceof SimulatorEvent.StatusChanged status) {
            onStatus(status.status());
        }
        else if (event instanceof SimulatorEvent.TelegramReceived received) {
            onReceived(received.telegram());
        }
    }

    private void onStatus(ConnectionStatus status)
    {
        epoch++;
        cancelAll();
        connected = status == ConnectionStatus.CONNECTED;

        if (connected && autoLifeEnabled) {
            startAutoLife();
        }
    }

    private void onReceived(Telegram telegram)
    {
        long session = sender.session();
        if (!connected || session == TelegramSender.NO_SESSION) {
            return;
        }
        switch (telegram.type()) {
            case LIFE -> onLife(session, telegram);
            case MOVE -> onMove(session, telegram);
            default -> {
                // CONFIRM, ERROR and unknown types need no reply.
            }
        }
    }

    private void onLife(long session, Telegram life)
    {
        if (!pongLimiter.tryAcquire()) {
            action(SimulationActionEvent.Action.PONG_SUPPRESSED,
                    "LIFE seq=" + life.sequence() + " inside " + timing.pongMinGap().toMillis() + " ms window");
            return;
        }
        schedule(session, timing.pongDelay(), "pong", armed -> {
            int seq = sequence.next();
            sender.send(armed, Telegrams.life(deviceId, hostId, seq, true));
            action(SimulationActionEvent.Action.AUTO_PONG, "seq=" + seq);
        });
    }

    private void onMove(long session, Telegram move)
    {
        if (!autoConfirmEnabled) {
            return;
        }
        MovePayload order = move.move().orElseThrow();
        schedule(session, timing.confirmDelay(), "confirm " + order.transferUnit(), armed -> {
            int seq = sequence.next();
            LocalDateTime at = LocalDateTime.ofInstant(wallClock.now(), zone);
            sender.send(armed, Telegrams.confirm(deviceId, hostId, seq,
                    order.transferUnit(), order.destinationBin(), Telegrams.DEFAULT_CONFIRM_STATUS, at));
            action(SimulationActionEvent.Action.AUTO_CONFIRM,
                    "tu=" + order.transferUnit() + " bin=" + order.destinationBin() + " seq=" + seq);
        });
    }

    // -------------------------------------------------------------------------
    // Operator commands
    // -------------------------------------------------------------------------

    /**
     * Enable or disable the periodic PING.
     *
     * <p>The interval is raised to the configured floor. Re-enabling (or changing
     * the interval) while connected sends a PING at once and restarts the cycle.
     * Enabling while disconnected takes effect on the next CONNECTED.</p>
     */
    public void toggleAutoLife(boolean enabled, Duration interval)
    {
        Objects.requireNonNull(interval, "interval");
        cancelAutoLife();
        autoLifeEnabled = enabled;
        autoLifeInterval = coerceInterval(interval);
        if (enabled && connected) {
            startAutoLife();
        }
    }

    /**
     * Drop every pending timer ahead of a disconnect.
     *
     * <p>The status change that follows does the same; this closes the window
     * before it is delivered.</p>
     */
    public void cancelTimers()
    {
        epoch++;
        cancelAll();
    }

    public void toggleAutoConfirm(boolean enabled)
    {
        autoConfirmEnabled = enabled;
    }

    /** Blank values fall back to the configured identity. */
    public void setIdentity(String deviceId, String hostId)
    {
        this.deviceId = deviceId == null || deviceId.isBlank() ? config.deviceId() : deviceId.strip();
        this.hostId = hostId == null || hostId.isBlank() ? config.hostId() : hostId.strip();
    }

    /**
     * Encode and send an operator-composed telegram with the next sequence number.
     *
     * @return whether the frame was accepted for sending
     */
    public boolean sendManual(ManualTelegram manual)
    {
        Objects.requireNonNull(manual, "manual");
        String source = manual.source().filter(s -> !s.isBlank()).orElse(deviceId);
        String destination = manual.destination().filter(s -> !s.isBlank()).orElse(hostId);
        int seq = sequence.next();

        byte[] frame = TelegramCodec.encode(manual.type(), manual.subtype(), source, destination, seq, manual.data());
        action(SimulationActionEvent.Action.MANUAL_SEND, manual.type().label() + " seq=" + seq);
        return sender.send(frame);
    }

    /**
     * Answer {@code telegram} with ERROR {@code E001 "Manual error for TU <tu>"}.
     */
    public boolean sendErrorFor(Telegram telegram)
    {
        Objects.requireNonNull(telegram, "telegram");
        String tu = transferUnitOf(telegram);
        int seq = sequence.next();

        byte[] frame = Telegrams.error(deviceId, hostId, seq, MANUAL_ERROR_CODE, "Manual error for TU " + tu);
        action(SimulationActionEvent.Action.ERROR_REPLY, "tu=" + tu + " seq=" + seq);
        return sender.send(frame);
    }

    // -------------------------------------------------------------------------
    // Introspection
    // -------------------------------------------------------------------------

    public boolean isConnected()
    {
        return connected;
    }

    public boolean isAutoLifeEnabled()
    {
        return autoLifeEnabled;
    }

    public Duration autoLifeInterval()
    {
        return autoLifeInterval;
    }

    public boolean isAutoConfirmEnabled()
    {
        return autoConfirmEnabled;
    }

    public String deviceId()
    {
        return deviceId;
    }

    public String hostId()
    {
        return hostId;
    }

    /** Number of armed timers (auto-life included). */
    public int pendingTimers()
    {
        return pending.size();
    }

    /** Last sequence number handed out. */
    public int lastSequence()
    {
        return sequence.current();
    }

    // -------------------------------------------------------------------------
    // Auto-life
    // -------------------------------------------------------------------------

    private void startAutoLife()
    {
        long session = sender.session();
        if (session != TelegramSender.NO_SESSION) {
            pingAndReschedule(session);
        }
    }

    private void pingAndReschedule(long session)
    {
        int seq = sequence.next();
        sender.send(session, Telegrams.life(deviceId, hostId, seq, false));
        action(SimulationActionEvent.Action.AUTO_LIFE_PING, "seq=" + seq);

        autoLifeTimer = schedule(session, autoLifeInterval, "auto-life", armed -> {
            autoLifeTimer = null;
            if (autoLifeEnabled) {
                pingAndReschedule(armed);
            }
        });
    }

    private void cancelAutoLife()
    {
        Timer t = autoLifeTimer;
        autoLifeTimer = null;
        if (t != null) {
            t.cancel();
        }
    }

    private Duration coerceInterval(Duration requested)
    {
        Duration floor = timing.minAutoLifeInterval();
        return requested.compareTo(floor) < 0 ? floor : requested;
    }

    // -------------------------------------------------------------------------
    // Timers
    // -------------------------------------------------------------------------

    private Timer schedule(long session, Duration delay, String label, LongConsumer action)
    {
        Timer timer = new Timer(epoch, session, label, action);
        pending.add(timer);
        timer.handle = scheduler.scheduleAfter(delay, clock, timer);
        return timer;
    }

    private void cancelAll()
    {
        List<Timer> armed = new ArrayList<>(pending);
        pending.clear();
        autoLifeTimer = null;
        for (Timer t : armed) {
            t.cancel();
        }
    }

    private final class Timer implements Runnable
    {
        private final long armedEpoch;
        private final long armedSession;
        private final String label;
        private final LongConsumer action;
        private Cancellable handle;

        private Timer(long armedEpoch, long armedSession, String label, LongConsumer action)
        {
            this.armedEpoch = armedEpoch;
            this.armedSession = armedSession;
            this.label = label;
            this.action = action;
        }

        void cancel()
        {
            pending.remove(this);
            if (handle != null) {
                handle.cancel();
            }
        }

        @Override
        public void run()
        {
            pending.remove(this);
            if (armedEpoch != epoch || !connected || armedSession != sender.session()) {
                action(SimulationActionEvent.Action.STALE_TIMER_IGNORED, label + " (session " + armedSession + ")");
                return;
            }
            try {
                action.accept(armedSession);
            } catch (RuntimeException e) {
                sink.onError(new PlcSimErrorEvent(wallClock.now(), null,
                        "Timer task '" + label + "' failed", e));
            }
        }
    }

    // -------------------------------------------------------------------------

    private static String transferUnitOf(Telegram telegram)
    {
        return telegram.move().map(MovePayload::transferUnit)
                .or(() -> telegram.confirm().map(ConfirmPayload::transferUnit))
                .filter(tu -> !tu.isEmpty())
                .orElse("?");
    }

    private void action(SimulationActionEvent.Action action, String detail)
    {
        sink.onSimulationAction(new SimulationActionEvent(wallClock.now(), action, detail));
    }
}
