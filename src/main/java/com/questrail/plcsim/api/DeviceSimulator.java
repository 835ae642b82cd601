package com.questrail.plcsim.api;

import com.questrail.plcsim.protocol.telegram.connection.ConnectionState;
import com.questrail.plcsim.protocol.telegram.model.Telegram;

/**
 * DeviceSimulator
 * =============================================================================
 * Consumer-facing surface of the PLC device simulator.
 *
 * <p>A presentation layer (window, console, test) drives the simulator only
 * through this interface. It issues commands and observes the resulting
 * {@link SimulatorEvent} stream. It never touches the socket.</p>
 *
 * <h2>Asynchrony</h2>
 * <p>Commands return immediately. Their effects are reported as events: a
 * successful {@link #connect(String, int)} shows up as {@code CONNECTING} then
 * {@code CONNECTED}, a manual send as a {@code TelegramSent}.</p>
 *
 * <h2>Validation</h2>
 * <p>Host and port are validated before any socket is opened. Violations are
 * reported as an {@link ErrorKind#VALIDATION} event, not thrown.</p>
 */
public interface DeviceSimulator
{
    void connect(String host, int port);

    /** Variant for operator-entered text; the port is parsed and validated. */
    void connect(String host, String port);

    void disconnect();

    void sendManual(ManualTelegram telegram);

    /** Answers {@code telegram} with an ERROR telegram ({@code E001}). */
    void sendErrorFor(Telegram telegram);

    /**
     * @param intervalSeconds seconds between PINGs; values below one are raised to one
     */
    void toggleAutoLife(boolean enabled, int intervalSeconds);

    void toggleAutoConfirm(boolean enabled);

    /** Blank values fall back to the configured defaults. */
    void setIdentity(String deviceId, String hostId);

    void addListener(SimulatorEventListener listener);

    void removeListener(SimulatorEventListener listener);

    ConnectionState connectionState();
}
