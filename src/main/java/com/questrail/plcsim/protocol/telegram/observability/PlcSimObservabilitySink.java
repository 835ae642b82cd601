package com.questrail.plcsim.protocol.telegram.observability;

/**
 * Receives observability events from the connection manager and the
 * simulation engine. Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from the session worker, the receive thread and the
 * consumer context concurrently. Implementations must be thread-safe.</p>
 */
public interface PlcSimObservabilitySink {

    /** Connection lifecycle state changed. */
    void onConnectionTransition(ConnectionTransitionEvent event);

    /** A telegram was read from or written to the socket. */
    void onTelegram(TelegramTrafficEvent event);

    /** The simulation engine took (or deliberately skipped) an action. */
    void onSimulationAction(SimulationActionEvent event);

    /** An error or anomaly occurred. */
    void onError(PlcSimErrorEvent event);
}
