package com.questrail.plcsim.protocol.telegram.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the device simulator runtime.
 *
 * @param deviceId           source id stamped on outbound telegrams
 * @param hostId             destination id stamped on outbound telegrams
 * @param autoLifeEnabled    whether auto-life starts enabled
 * @param autoLifeInterval   initial auto-life interval
 * @param autoConfirmEnabled whether MOVE telegrams are confirmed automatically
 * @param receiveBufferFrames receive buffer cap, in whole frames
 */
public record SimulatorConfig(
    String deviceId,
    String hostId,
    boolean autoLifeEnabled,
    Duration autoLifeInterval,
    boolean autoConfirmEnabled,
    int receiveBufferFrames,
    SimulatorTimingPolicy timing
) {
    public static final String DEFAULT_DEVICE_ID = "PLC-SIM";
    public static final String DEFAULT_HOST_ID = "EWM-MFS";

    public SimulatorConfig {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(hostId, "hostId");
        Objects.requireNonNull(autoLifeInterval, "autoLifeInterval");
        Objects.requireNonNull(timing, "timing");
        if (deviceId.isBlank() || hostId.isBlank()) {
            throw new IllegalArgumentException("deviceId and hostId must not be blank");
        }
        if (receiveBufferFrames <= 0) {
            throw new IllegalArgumentException("receiveBufferFrames must be > 0");
        }
    }

    public static SimulatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String deviceId = DEFAULT_DEVICE_ID;
        private String hostId = DEFAULT_HOST_ID;
        private boolean autoLifeEnabled = false;
        private Duration autoLifeInterval = Duration.ofSeconds(10);
        private boolean autoConfirmEnabled = true;
        private int receiveBufferFrames = 256;
        private SimulatorTimingPolicy timing = SimulatorTimingPolicy.defaults();

        public Builder withDeviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder withHostId(String hostId) {
            this.hostId = hostId;
            return this;
        }

        public Builder withAutoLife(boolean enabled, Duration interval) {
            this.autoLifeEnabled = enabled;
            this.autoLifeInterval = interval;
            return this;
        }

        public Builder withAutoConfirm(boolean enabled) {
            this.autoConfirmEnabled = enabled;
            return this;
        }

        public Builder withReceiveBufferFrames(int frames) {
            this.receiveBufferFrames = frames;
            return this;
        }

        public Builder withTiming(SimulatorTimingPolicy timing) {
            this.timing = timing;
            return this;
        }

        public SimulatorConfig build() {
            return new SimulatorConfig(deviceId, hostId, autoLifeEnabled, autoLifeInterval,
                autoConfirmEnabled, receiveBufferFrames, timing);
        }
    }
}
