package com.questrail.plcsim.protocol.telegram.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements PlcSimObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onConnectionTransition(ConnectionTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTelegram(TelegramTrafficEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSimulationAction(SimulationActionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(PlcSimErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ConnectionTransitionEvent> getTransitions() {
        return ofType(ConnectionTransitionEvent.class);
    }

    public synchronized List<SimulationActionEvent> getActions(SimulationActionEvent.Action action) {
        return ofType(SimulationActionEvent.class).stream()
            .filter(e -> e.action() == action)
            .collect(Collectors.toList());
    }

    public synchronized List<PlcSimErrorEvent> getErrors() {
        return ofType(PlcSimErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
