package com.questrail.plcsim.protocol.telegram.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational decision in the simulator: timer deadlines,
 * the auto-pong rate limit and the auto-life cadence.
 *
 * <h2>Binding invariant</h2>
 * Operational timing MUST NOT use wall-clock time. {@link WallClock} exists
 * only for telegram timestamps and log entries.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
