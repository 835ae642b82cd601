package com.questrail.plcsim.protocol.telegram.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PlcSimObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements PlcSimObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onConnectionTransition(ConnectionTransitionEvent event) {
        log.info("Session {} ({}): {} -> {}",
            event.sessionId(),
            event.remote(),
            event.from(),
            event.to());
    }

    @Override
    public void onTelegram(TelegramTrafficEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        var t = event.telegram();
        log.debug("Session {} {} {} {} {}->{} seq={} data='{}'{}",
            event.sessionId(),
            event.direction() == TelegramTrafficEvent.Direction.INBOUND ? "RX" : "TX",
            t.type().label(),
            t.subtype(),
            t.source(),
            t.destination(),
            t.sequence(),
            t.payloadSummary(60),
            event.recovered() ? " (recovered)" : "");
    }

    @Override
    public void onSimulationAction(SimulationActionEvent event) {
        if (event.action() == SimulationActionEvent.Action.PONG_SUPPRESSED) {
            log.info("Simulation: {} {}", event.action(), event.detail());
        }
        else {
            log.debug("Simulation: {} {}", event.action(), event.detail());
        }
    }

    @Override
    public void onError(PlcSimErrorEvent event) {
        String kind = event.kind() != null ? event.kind().name() : "INTERNAL";
        if (event.cause() != null) {
            log.error("PLC-SIM Error [{}]: {}", kind, event.message(), event.cause());
        }
        else {
            log.warn("PLC-SIM Error [{}]: {}", kind, event.message());
        }
    }
}
