package com.questrail.plcsim.api;

/**
 * Subscriber to the simulator's event stream.
 *
 * <p>Callbacks arrive on the consumer context, one at a time. Implementations
 * must not block.</p>
 */
@FunctionalInterface
public interface SimulatorEventListener
{
    void onEvent(SimulatorEvent event);
}
