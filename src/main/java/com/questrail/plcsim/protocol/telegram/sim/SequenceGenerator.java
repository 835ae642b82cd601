package com.questrail.plcsim.protocol.telegram.sim;

import com.questrail.plcsim.protocol.telegram.model.TelegramLayout;

/**
 * Shared outbound sequence counter.
 *
 * <p>Pre-increments and wraps at {@link TelegramLayout#SEQUENCE_MODULUS}, so the
 * first value handed out is 1 and the value after 999999 is 0.</p>
 *
 * <p>Not thread-safe; confined to the simulation engine's context.</p>
 */
public final class SequenceGenerator
{
    private int current;

    public SequenceGenerator()
    {
        this(0);
    }

    public SequenceGenerator(int start)
    {
        if (start < 0 || start >= TelegramLayout.SEQUENCE_MODULUS) {
            throw new IllegalArgumentException("start out of range: " + start);
        }
        this.current = start;
    }

    public int next()
    {
        current = (current + 1) % TelegramLayout.SEQUENCE_MODULUS;
        return current;
    }

    /** Last value handed out (or the start value if none yet). */
    public int current()
    {
        return current;
    }
}
