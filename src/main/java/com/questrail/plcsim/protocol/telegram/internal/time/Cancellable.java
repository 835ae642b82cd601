package com.questrail.plcsim.protocol.telegram.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled simulator timer (auto-life cadence,
 * delayed auto-pong, delayed auto-confirm).
 *
 * <p>
 * Cancelling is best-effort. A task that has already started may still run,
 * which is why every simulator timer also re-checks its connection epoch when
 * it fires.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
