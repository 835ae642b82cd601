package com.questrail.plcsim.protocol.telegram.connection;

import com.questrail.plcsim.api.ConnectionStatus;
import com.questrail.plcsim.api.ErrorKind;
import com.questrail.plcsim.api.SimulatorEvent;
import com.questrail.plcsim.protocol.telegram.codec.TelegramCodec;
import com.questrail.plcsim.protocol.telegram.codec.Telegrams;
import com.questrail.plcsim.protocol.telegram.config.SimulatorConfig;
import com.questrail.plcsim.protocol.telegram.config.SimulatorTimingPolicy;
import com.questrail.plcsim.protocol.telegram.internal.events.EventChannel;
import com.questrail.plcsim.protocol.telegram.internal.time.SystemWallClock;
import com.questrail.plcsim.protocol.telegram.model.MovePayload;
import com.questrail.plcsim.protocol.telegram.model.TelegramType;
import com.questrail.plcsim.protocol.telegram.observability.RecordingObservabilitySink;
import com.questrail.plcsim.protocol.telegram.observability.SimulationActionEvent;
import com.questrail.plcsim.protocol.telegram.sim.SimulationEngine;
import com.questrail.plcsim.protocol.telegram.sim.TelegramSender;
import com.questrail.plcsim.protocol.telegram.time.DeterministicScheduler;
import com.questrail.plcsim.protocol.telegram.time.ManualMonotonicClock;
import com.questrail.plcsim.protocol.telegram.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionManagerTest {

    private static final SimulatorTimingPolicy FAST = new SimulatorTimingPolicy(
            Duration.ofSeconds(2),
            Duration.ofSeconds(2),
            Duration.ofMillis(20),
            Duration.ofSeconds(2),
            Duration.ofMillis(10),
            Duration.ofMillis(200),
            Duration.ofSeconds(1),
            Duration.ofMillis(500),
            Duration.ofSeconds(1));

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final EventChannel events = new EventChannel(SystemWallClock.INSTANCE, sink);
    private final List<SimulatorEvent> seen = new CopyOnWriteArrayList<>();
    private final List<FakeStreamEndpoint> endpoints = new CopyOnWriteArrayList<>();

    private Supplier<FakeStreamEndpoint> nextEndpoint = FakeStreamEndpoint::new;
    private ConnectionManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.disconnect();
        }
    }

    private ConnectionManager newManager(SimulatorConfig config) {
        events.subscribe(seen::add);
        manager = new ConnectionManager(config, () -> {
            FakeStreamEndpoint e = nextEndpoint.get();
            endpoints.add(e);
            return e;
        }, events, SystemWallClock.INSTANCE, sink);
        return manager;
    }

    private ConnectionManager newManager() {
        return newManager(SimulatorConfig.builder().withTiming(FAST).build());
    }

    @Test
    void invalidTargetReportsValidationAndTouchesNoSocket() {
        ConnectionManager m = newManager();

        m.connect("", 5000);
        m.connect("localhost", 70000);
        m.connect("localhost", "port");
        events.drain();

        assertEquals(3, seen.size());
        assertTrue(seen.stream().allMatch(e -> isError(e, ErrorKind.VALIDATION)));
        assertTrue(endpoints.isEmpty());
        assertEquals(ConnectionState.IDLE, m.state());
    }

    @Test
    void connectFailureReportsErrorWithoutDisconnected() throws InterruptedException {
        nextEndpoint = () -> new FakeStreamEndpoint().failOpenWith(new IOException("Connection refused"));
        ConnectionManager m = newManager();

        m.connect("127.0.0.1", 5000);
        awaitEvent(e -> isError(e, ErrorKind.CONNECT));
        awaitState(m, ConnectionState.IDLE);
        Thread.sleep(50);
        events.drain();

        assertEquals(List.of(ConnectionStatus.CONNECTING, ConnectionStatus.ERROR), statuses());
        SimulatorEvent.ErrorReported error = errors(ErrorKind.CONNECT).get(0);
        assertTrue(error.message().contains("Connection refused"));
        assertEquals(1, endpoints.get(0).closeCount());
    }

    @Test
    void sentFramesAreWrittenAndReported() throws InterruptedException {
        ConnectionManager m = newManager();
        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);

        byte[] ping = Telegrams.life("PLC-SIM", "EWM-MFS", 1, false);
        assertTrue(m.send(ping));
        SimulatorEvent.TelegramSent sent = (SimulatorEvent.TelegramSent)
                awaitEvent(e -> e instanceof SimulatorEvent.TelegramSent);

        assertArrayEquals(ping, endpoints.get(0).written().get(0));
        assertArrayEquals(ping, sent.telegram().toBytes());
        assertEquals("127.0.0.1", endpoints.get(0).host());
        assertEquals(5000, endpoints.get(0).port());
    }

    @Test
    void sendWhileNotConnectedReportsNotConnected() {
        ConnectionManager m = newManager();

        assertFalse(m.send(Telegrams.life("PLC-SIM", "EWM-MFS", 1, false)));
        events.drain();

        assertEquals(1, errors(ErrorKind.NOT_CONNECTED).size());
        assertEquals("Not connected", errors(ErrorKind.NOT_CONNECTED).get(0).message());
    }

    @Test
    void sendRejectsFramesOfTheWrongLength() {
        ConnectionManager m = newManager();

        assertThrows(IllegalArgumentException.class, () -> m.send(new byte[10]));
    }

    @Test
    void chunkedInputIsReassembledInOrder() throws InterruptedException {
        ConnectionManager m = newManager();
        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);

        byte[] stream = frames(1, 2, 3);
        FakeStreamEndpoint endpoint = endpoints.get(0);
        int offset = 0;
        for (int size : new int[] {50, 200, 34, 100}) {
            endpoint.injectBytes(Arrays.copyOfRange(stream, offset, offset + size));
            offset += size;
        }
        events.drain();

        List<Integer> sequences = new ArrayList<>();
        for (SimulatorEvent e : seen) {
            if (e instanceof SimulatorEvent.TelegramReceived rx) {
                sequences.add(rx.telegram().sequence());
                assertFalse(rx.recovered());
            }
        }
        assertEquals(List.of(1, 2, 3), sequences);
    }

    @Test
    void overflowIsReportedOncePerAppend() throws InterruptedException {
        ConnectionManager m = newManager(SimulatorConfig.builder()
                .withTiming(FAST)
                .withReceiveBufferFrames(2)
                .build());
        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);

        endpoints.get(0).injectBytes(frames(1, 2, 3));
        events.drain();

        List<SimulatorEvent.ErrorReported> overflow = errors(ErrorKind.OVERFLOW);
        assertEquals(1, overflow.size());
        assertEquals("Receive buffer overflow: discarded 128 bytes", overflow.get(0).message());
        assertEquals(2, seen.stream().filter(e -> e instanceof SimulatorEvent.TelegramReceived).count());
    }

    @Test
    void disconnectClosesEndpointExactlyOnce() throws InterruptedException {
        ConnectionManager m = newManager();
        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);

        m.disconnect();
        m.disconnect();
        events.drain();

        FakeStreamEndpoint endpoint = endpoints.get(0);
        assertEquals(1, endpoint.closeCount());
        assertEquals(1, endpoint.abortCount());
        assertEquals(ConnectionState.IDLE, m.state());
        assertEquals(List.of(ConnectionStatus.CONNECTING, ConnectionStatus.CONNECTED, ConnectionStatus.DISCONNECTED),
                statuses());
    }

    @Test
    void peerCloseEndsSessionQuietly() throws InterruptedException {
        ConnectionManager m = newManager();
        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);

        endpoints.get(0).injectClose(null);
        awaitStatus(ConnectionStatus.DISCONNECTED);

        assertTrue(seen.stream().noneMatch(e -> e instanceof SimulatorEvent.ErrorReported));
        assertEquals(1, endpoints.get(0).closeCount());
        awaitState(m, ConnectionState.IDLE);
    }

    @Test
    void readErrorReportsStreamErrorThenDisconnected() throws InterruptedException {
        ConnectionManager m = newManager();
        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);

        endpoints.get(0).injectClose(new IOException("Connection reset by peer"));
        awaitStatus(ConnectionStatus.DISCONNECTED);

        int errorAt = indexOf(e -> isError(e, ErrorKind.STREAM));
        int disconnectedAt = indexOf(e -> isStatus(e, ConnectionStatus.DISCONNECTED));
        assertTrue(errorAt >= 0 && errorAt < disconnectedAt);
        assertEquals(1, endpoints.get(0).closeCount());
    }

    @Test
    void writeFailureEndsSession() throws InterruptedException {
        nextEndpoint = () -> new FakeStreamEndpoint().failWritesWith(new IOException("Broken pipe"));
        ConnectionManager m = newManager();
        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);

        assertTrue(m.send(Telegrams.life("PLC-SIM", "EWM-MFS", 1, false)));
        awaitStatus(ConnectionStatus.DISCONNECTED);

        assertTrue(errors(ErrorKind.STREAM).get(0).message().contains("Broken pipe"));
        assertTrue(seen.stream().noneMatch(e -> e instanceof SimulatorEvent.TelegramSent));
        assertEquals(1, endpoints.get(0).closeCount());
    }

    @Test
    void disconnectDuringConnectIsNotAnError() throws InterruptedException {
        nextEndpoint = () -> new FakeStreamEndpoint().hangOnOpen();
        ConnectionManager m = newManager();
        m.connect("10.255.255.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTING);

        m.disconnect();
        events.drain();

        assertTrue(errors(ErrorKind.CONNECT).isEmpty());
        assertEquals(List.of(ConnectionStatus.CONNECTING, ConnectionStatus.DISCONNECTED), statuses());
        assertEquals(1, endpoints.get(0).closeCount());
    }

    @Test
    void reconnectLeavesOneSessionAndNoStaleEvents() throws InterruptedException {
        ConnectionManager m = newManager();
        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);
        FakeStreamEndpoint first = endpoints.get(0);
        first.injectBytes(Arrays.copyOf(frames(1), 60));

        m.connect("127.0.0.1", 5001);
        seen.clear();
        // the old session is gone; anything it still produces must not surface
        first.injectBytes(frames(7));
        first.injectClose(new IOException("late"));
        awaitStatus(ConnectionStatus.CONNECTED);
        Thread.sleep(50);
        events.drain();

        assertEquals(2, endpoints.size());
        assertEquals(1, first.closeCount());
        assertEquals(0, endpoints.get(1).closeCount());
        assertEquals(5001, endpoints.get(1).port());
        assertEquals(List.of(ConnectionStatus.CONNECTING, ConnectionStatus.CONNECTED), statuses());
        assertTrue(seen.stream().noneMatch(e -> e instanceof SimulatorEvent.TelegramReceived));
        assertTrue(seen.stream().noneMatch(e -> e instanceof SimulatorEvent.ErrorReported));
        assertTrue(m.isConnected());
    }

    @Test
    void sessionIdIsExposedOnlyWhileConnected() throws InterruptedException {
        ConnectionManager m = newManager();
        assertEquals(TelegramSender.NO_SESSION, m.session());

        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);
        long first = m.session();
        assertNotEquals(TelegramSender.NO_SESSION, first);

        m.connect("127.0.0.1", 5001);
        awaitState(m, ConnectionState.CONNECTED);
        assertNotEquals(first, m.session());
        assertFalse(m.send(first, Telegrams.life("PLC-SIM", "EWM-MFS", 1, false)));
        assertTrue(m.send(m.session(), Telegrams.life("PLC-SIM", "EWM-MFS", 2, false)));

        m.disconnect();
        assertEquals(TelegramSender.NO_SESSION, m.session());
        events.drain();
        assertTrue(errors(ErrorKind.NOT_CONNECTED).isEmpty());
    }

    @Test
    void confirmArmedInOneSessionIsNotWrittenToTheNext() throws InterruptedException {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        SimulatorConfig config = SimulatorConfig.builder().withTiming(FAST).build();
        ConnectionManager m = newManager(config);
        SimulationEngine engine = new SimulationEngine(config, m, scheduler, clock, SystemWallClock.INSTANCE, sink);
        events.subscribe(engine);

        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);
        endpoints.get(0).injectBytes(TelegramCodec.encode(TelegramType.MOVE, "00", "EWM-MFS", "PLC-SIM", 5,
                MovePayload.format("TU-OLD", "BIN-01", "BIN-02", "01")));
        events.drain();
        assertEquals(1, engine.pendingTimers());

        // reconnect without delivering the new session's status changes
        m.connect("127.0.0.1", 5001);
        awaitState(m, ConnectionState.CONNECTED);
        scheduler.advanceMillis(600);
        Thread.sleep(100);

        assertTrue(endpoints.get(1).written().isEmpty());
        assertTrue(endpoints.get(0).written().isEmpty());
        assertEquals(1, sink.getActions(SimulationActionEvent.Action.STALE_TIMER_IGNORED).size());
    }

    @Test
    void autoLifeDueAfterDisconnectIsNotReportedAsNotConnected() throws InterruptedException {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        SimulatorConfig config = SimulatorConfig.builder()
                .withTiming(FAST)
                .withAutoLife(true, Duration.ofSeconds(1))
                .build();
        ConnectionManager m = newManager(config);
        SimulationEngine engine = new SimulationEngine(config, m, scheduler, clock, SystemWallClock.INSTANCE, sink);
        events.subscribe(engine);

        m.connect("127.0.0.1", 5000);
        awaitStatus(ConnectionStatus.CONNECTED);
        assertTrue(endpoints.get(0).awaitWrite(1_000));

        m.disconnect();
        scheduler.advanceMillis(1_000);
        events.drain();

        assertTrue(errors(ErrorKind.NOT_CONNECTED).isEmpty());
        assertEquals(1, endpoints.get(0).written().size());
        assertEquals(0, engine.pendingTimers());
    }

    // -------------------------------------------------------------------------

    private static byte[] frames(int... sequences) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int seq : sequences) {
            out.writeBytes(TelegramCodec.encode("LI", "00", "EWM-MFS", "PLC-SIM", seq, "PING"));
        }
        return out.toByteArray();
    }

    private SimulatorEvent awaitEvent(Predicate<SimulatorEvent> match) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(3).toNanos();
        while (System.nanoTime() < deadline) {
            events.drain();
            for (SimulatorEvent e : seen) {
                if (match.test(e)) {
                    return e;
                }
            }
            Thread.sleep(5);
        }
        fail("event not seen; got " + seen);
        return null;
    }

    private void awaitStatus(ConnectionStatus status) throws InterruptedException {
        awaitEvent(e -> isStatus(e, status));
    }

    private static void awaitState(ConnectionManager m, ConnectionState state) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(3).toNanos();
        while (m.state() != state && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(state, m.state());
    }

    private List<ConnectionStatus> statuses() {
        List<ConnectionStatus> out = new ArrayList<>();
        for (SimulatorEvent e : seen) {
            if (e instanceof SimulatorEvent.StatusChanged s) {
                out.add(s.status());
            }
        }
        return out;
    }

    private List<SimulatorEvent.ErrorReported> errors(ErrorKind kind) {
        List<SimulatorEvent.ErrorReported> out = new ArrayList<>();
        for (SimulatorEvent e : seen) {
            if (e instanceof SimulatorEvent.ErrorReported r && r.kind() == kind) {
                out.add(r);
            }
        }
        return out;
    }

    private int indexOf(Predicate<SimulatorEvent> match) {
        for (int i = 0; i < seen.size(); i++) {
            if (match.test(seen.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isStatus(SimulatorEvent e, ConnectionStatus status) {
        return e instanceof SimulatorEvent.StatusChanged s && s.status() == status;
    }

    private static boolean isError(SimulatorEvent e, ErrorKind kind) {
        return e instanceof SimulatorEvent.ErrorReported r && r.kind() == kind;
    }
}
