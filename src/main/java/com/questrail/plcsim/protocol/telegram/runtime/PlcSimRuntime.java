package com.questrail.plcsim.protocol.telegram.runtime;

import com.questrail.plcsim.api.DeviceSimulator;
import com.questrail.plcsim.api.ManualTelegram;
import com.questrail.plcsim.api.SimulatorEventListener;
import com.questrail.plcsim.protocol.telegram.config.SimulatorConfig;
import com.questrail.plcsim.protocol.telegram.connection.ConnectionManager;
import com.questrail.plcsim.protocol.telegram.connection.ConnectionState;
import com.questrail.plcsim.protocol.telegram.internal.events.EventChannel;
import com.questrail.plcsim.protocol.telegram.internal.time.MonotonicClock;
import com.questrail.plcsim.protocol.telegram.internal.time.MonotonicScheduler;
import com.questrail.plcsim.protocol.telegram.internal.time.ScheduledExecutorScheduler;
import com.questrail.plcsim.protocol.telegram.internal.time.SystemMonotonicClock;
import com.questrail.plcsim.protocol.telegram.internal.time.SystemWallClock;
import com.questrail.plcsim.protocol.telegram.internal.time.WallClock;
import com.questrail.plcsim.protocol.telegram.model.Telegram;
import com.questrail.plcsim.protocol.telegram.observability.NullObservabilitySink;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimErrorEvent;
import com.questrail.plcsim.protocol.telegram.observability.PlcSimObservabilitySink;
import com.questrail.plcsim.protocol.telegram.sim.SimulationEngine;
import com.questrail.plcsim.protocol.telegram.transport.StreamEndpoint;
import com.questrail.plcsim.protocol.telegram.transport.tcp.netty.NettyTcpStreamEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * PlcSimRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the device simulator.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   StreamEndpoint (per session)
 *        → ConnectionManager ──events──→ EventChannel
 *                                             │ drain (consumer thread)
 *                                             ↓
 *                        SimulationEngine + consumer listeners
 *                                             │ send(frame)
 *        ConnectionManager ←──────────────────┘
 * </pre>
 *
 * <h2>Consumer context</h2>
 * A single-thread scheduled executor drains the event channel every
 * {@code dispatchPeriod} and runs every engine timer. Engine commands issued
 * through {@link DeviceSimulator} are marshalled onto it, so the engine never
 * sees concurrent access. Connect and disconnect run on the caller's thread
 * because they may block for the join timeout.
 */
public final class PlcSimRuntime implements DeviceSimulator {
    private static final Logger log = LoggerFactory.getLogger(PlcSimRuntime.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final SimulatorConfig config;
    private final EventChannel events;
    private final ConnectionManager connection;
    private final SimulationEngine engine;
    private final ScheduledExecutorService consumerExecutor;
    private final PlcSimObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private PlcSimRuntime(
            SimulatorConfig config,
            EventChannel events,
            ConnectionManager connection,
            SimulationEngine engine,
            ScheduledExecutorService consumerExecutor,
            PlcSimObservabilitySink observabilitySink,
            WallClock wallClock) {
        this.config = config;
        this.events = events;
        this.connection = connection;
        this.engine = engine;
        this.consumerExecutor = consumerExecutor;
        this.observabilitySink = observabilitySink;
        this.wallClock = wallClock;
    }

    /**
     * Start dispatching events. Idempotent.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("runtime already stopped");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long period = config.timing().dispatchPeriod().toMillis();
        consumerExecutor.scheduleWithFixedDelay(guarded("dispatch", events::drain), 0, period, TimeUnit.MILLISECONDS);
        log.info("PLC simulator started as {} -> {}", engine.deviceId(), engine.hostId());
    }

    /**
     * Disconnect, deliver the remaining events, and shut the consumer down.
     * Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        connection.disconnect();

        try {
            consumerExecutor.execute(guarded("final dispatch", events::drain));
        } catch (RejectedExecutionException e) {
            log.debug("Consumer already shut down; {} event(s) not delivered", events.pending());
        }
        consumerExecutor.shutdown();
        try {
            if (!consumerExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                consumerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            consumerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("PLC simulator stopped");
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    // -------------------------------------------------------------------------
    // DeviceSimulator
    // -------------------------------------------------------------------------

    @Override
    public void connect(String host, int port) {
        connection.connect(host, port);
    }

    @Override
    public void connect(String host, String port) {
        connection.connect(host, port);
    }

    /**
     * Also drops the engine's pending timers without waiting for DISCONNECTED
     * to be delivered.
     */
    @Override
    public void disconnect() {
        connection.disconnect();
        onConsumer("cancelTimers", engine::cancelTimers);
    }

    @Override
    public void sendManual(ManualTelegram telegram) {
        Objects.requireNonNull(telegram, "telegram");
        onConsumer("sendManual", () -> engine.sendManual(telegram));
    }

    @Override
    public void sendErrorFor(Telegram telegram) {
        Objects.requireNonNull(telegram, "telegram");
        onConsumer("sendErrorFor", () -> engine.sendErrorFor(telegram));
    }

    @Override
    public void toggleAutoLife(boolean enabled, int intervalSeconds) {
        Duration interval = Duration.ofSeconds(Math.max(0, intervalSeconds));
        onConsumer("toggleAutoLife", () -> engine.toggleAutoLife(enabled, interval));
    }

    @Override
    public void toggleAutoConfirm(boolean enabled) {
        onConsumer("toggleAutoConfirm", () -> engine.toggleAutoConfirm(enabled));
    }

    @Override
    public void setIdentity(String deviceId, String hostId) {
        onConsumer("setIdentity", () -> engine.setIdentity(deviceId, hostId));
    }

    @Override
    public void addListener(SimulatorEventListener listener) {
        events.subscribe(listener);
    }

    @Override
    public void removeListener(SimulatorEventListener listener) {
        events.unsubscribe(listener);
    }

    @Override
    public ConnectionState connectionState() {
        return connection.state();
    }

    // -------------------------------------------------------------------------

    private void onConsumer(String name, Runnable task) {
        try {
            consumerExecutor.execute(guarded(name, task));
        } catch (RejectedExecutionException e) {
            log.warn("Ignoring {}: runtime is stopped", name);
        }
    }

    private Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                observabilitySink.onError(new PlcSimErrorEvent(wallClock.now(), null,
                        "Consumer task '" + name + "' failed", e));
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SimulatorConfig config = SimulatorConfig.defaults();
        private PlcSimObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Supplier<? extends StreamEndpoint> endpointFactory = NettyTcpStreamEndpoint::new;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(SimulatorConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(PlcSimObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /** One endpoint is taken from the factory per connection attempt. */
        public Builder withEndpointFactory(Supplier<? extends StreamEndpoint> factory) {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public PlcSimRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(endpointFactory, "endpointFactory");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            PlcSimObservabilitySink sink = observabilitySink != null ? observabilitySink : NullObservabilitySink.INSTANCE;

            // 1. Consumer context: dispatch and every engine timer share one thread
            ScheduledExecutorService consumerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "plcsim-consumer");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(consumerExec, clock);

            // 2. Event channel and connection
            EventChannel events = new EventChannel(wallClock, sink);
            ConnectionManager connection = new ConnectionManager(config, endpointFactory, events, wallClock, sink);

            // 3. Engine subscribes first so it sees each event before consumer listeners
            SimulationEngine engine = new SimulationEngine(config, connection, scheduler, clock, wallClock, sink);
            events.subscribe(engine);

            return new PlcSimRuntime(config, events, connection, engine, consumerExec, sink, wallClock);
        }
    }
}
