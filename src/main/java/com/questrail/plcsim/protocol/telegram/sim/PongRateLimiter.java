package com.questrail.plcsim.protocol.telegram.sim;

import com.questrail.plcsim.protocol.telegram.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * PongRateLimiter
 * -----------------------------------------------------------------------------
 * Admits at most one PONG per {@code minGap}, measured on the monotonic clock.
 *
 * <p>A permit is taken when the LIFE arrives, not when the delayed PONG is
 * written. Denied requests are simply dropped; nothing is queued.</p>
 */
public final class PongRateLimiter
{
    private final MonotonicClock clock;
    private final long minGapNanos;

    private boolean granted;
    private long lastGrantNanos;

    public PongRateLimiter(MonotonicClock clock, Duration minGap)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(minGap, "minGap");
        if (minGap.isNegative()) {
            throw new IllegalArgumentException("minGap must be non-negative");
        }
        this.minGapNanos = minGap.toNanos();
    }

    /**
     * @return {@code true} if a PONG may be sent now; the window restarts
     */
    public boolean tryAcquire()
    {
        long now = clock.nowNanos();
        if (granted && now - lastGrantNanos < minGapNanos) {
            return false;
        }
        granted = true;
        lastGrantNanos = now;
        return true;
    }
}
