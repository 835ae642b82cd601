package com.questrail.plcsim.protocol.telegram.codec;

/**
 * Raised when an assembled telegram body is not exactly 128 characters.
 *
 * <p>This is a programmer error in the codec's slot arithmetic, never a runtime
 * condition caused by input. It is not caught anywhere in the simulator.</p>
 */
public final class TelegramFramingException extends RuntimeException
{
    public TelegramFramingException(String message) {
        super(message);
    }
}
