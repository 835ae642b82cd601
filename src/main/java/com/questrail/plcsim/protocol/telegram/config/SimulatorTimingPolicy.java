package com.questrail.plcsim.protocol.telegram.config;

import java.time.Duration;
import java.util.Objects;

/**
 * SimulatorTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the connection manager and the simulation engine.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: upper bound on one TCP connect attempt.</li>
 *   <li><b>writeTimeout</b>: upper bound on one frame write.</li>
 *   <li><b>pollInterval</b>: send-loop poll period; the longest a stop request
 *       waits to be observed.</li>
 *   <li><b>joinTimeout</b>: how long a stop waits for the session worker.</li>
 *   <li><b>dispatchPeriod</b>: how often the consumer drains the event channel.</li>
 *   <li><b>pongDelay</b>: device processing latency before answering a LIFE.</li>
 *   <li><b>pongMinGap</b>: at most one PONG per this window; excess LIFEs are dropped.</li>
 *   <li><b>confirmDelay</b>: latency before confirming a MOVE.</li>
 *   <li><b>minAutoLifeInterval</b>: floor applied to the operator's auto-life interval.</li>
 * </ul>
 */
public record SimulatorTimingPolicy(
        Duration connectTimeout,
        Duration writeTimeout,
        Duration pollInterval,
        Duration joinTimeout,
        Duration dispatchPeriod,
        Duration pongDelay,
        Duration pongMinGap,
        Duration confirmDelay,
        Duration minAutoLifeInterval
) {
    public SimulatorTimingPolicy {
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(writeTimeout, "writeTimeout");
        requirePositive(pollInterval, "pollInterval");
        requirePositive(joinTimeout, "joinTimeout");
        requirePositive(dispatchPeriod, "dispatchPeriod");
        requireNonNegative(pongDelay, "pongDelay");
        requireNonNegative(pongMinGap, "pongMinGap");
        requireNonNegative(confirmDelay, "confirmDelay");
        requirePositive(minAutoLifeInterval, "minAutoLifeInterval");
    }

    /**
     * Default values:
     * connect 5s, write 5s, poll 500ms, join 3s, dispatch 80ms,
     * pong delay 200ms, pong gap 1s, confirm delay 500ms, auto-life floor 1s.
     */
    public static SimulatorTimingPolicy defaults() {
        return new SimulatorTimingPolicy(
                Duration.ofSeconds(5),
                Duration.ofSeconds(5),
                Duration.ofMillis(500),
                Duration.ofSeconds(3),
                Duration.ofMillis(80),
                Duration.ofMillis(200),
                Duration.ofSeconds(1),
                Duration.ofMillis(500),
                Duration.ofSeconds(1)
        );
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
