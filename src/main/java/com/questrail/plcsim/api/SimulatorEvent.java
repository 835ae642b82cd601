package com.questrail.plcsim.api;

import com.questrail.plcsim.protocol.telegram.model.Telegram;

import java.time.Instant;
import java.util.Objects;

/**
 * SimulatorEvent
 * =============================================================================
 * Typed, ordered events emitted by the simulator core to its consumers (the
 * simulation engine, a presentation layer, the telegram log).
 *
 * <p>Events are immutable. They are delivered serially on the consumer context in
 * the order the connection produced them.</p>
 */
public sealed interface SimulatorEvent
{
    /** Wall-clock time at which the event was produced. */
    Instant timestamp();

    record StatusChanged(Instant timestamp, ConnectionStatus status) implements SimulatorEvent {
        public StatusChanged {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(status, "status");
        }
    }

    /**
     * One whole frame received from the host.
     *
     * @param recovered {@code true} if the decoder had to repair the frame
     */
    record TelegramReceived(Instant timestamp, Telegram telegram, boolean recovered) implements SimulatorEvent {
        public TelegramReceived {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(telegram, "telegram");
        }
    }

    /** One frame written to the socket, exactly as written. */
    record TelegramSent(Instant timestamp, Telegram telegram) implements SimulatorEvent {
        public TelegramSent {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(telegram, "telegram");
        }
    }

    record ErrorReported(Instant timestamp, ErrorKind kind, String message) implements SimulatorEvent {
        public ErrorReported {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }
    }
}
