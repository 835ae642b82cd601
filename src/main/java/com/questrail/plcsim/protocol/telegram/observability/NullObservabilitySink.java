package com.questrail.plcsim.protocol.telegram.observability;

/**
 * No-op implementation of PlcSimObservabilitySink.
 */
public final class NullObservabilitySink implements PlcSimObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionTransition(ConnectionTransitionEvent event) {}

    @Override
    public void onTelegram(TelegramTrafficEvent event) {}

    @Override
    public void onSimulationAction(SimulationActionEvent event) {}

    @Override
    public void onError(PlcSimErrorEvent event) {}
}
