package com.questrail.plcsim.protocol.telegram.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for human-facing timestamps: the CONFIRM telegram's
 * {@code yyyyMMddHHmmss} field, event timestamps and log entries.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used for timer deadlines or rate limiting.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
