package com.questrail.pubsub.protocol.mqtt.config;

import com.questrail.pubsub.protocol.mqtt.internal.exec.ConnectionTimingPolicy;
import com.questrail.pubsub.protocol.mqtt.internal.state.BackoffResetPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of one resilient MQTT client. Every field has a default.
 *
 * @param id                    client-local identifier, folded into the generated broker client id
 * @param reconnectDelayInitial delay before the first reconnect of a failure episode
 * @param reconnectDelayMax     cap of the doubling reconnect delay
 * @param timeout               handshake timeout
 * @param keepalive             heartbeat interval, advertised to the broker as well
 * @param backoffResetPolicy    what a successful handshake does to the reconnect delay
 * @param maxMessageBytes       largest inbound packet the transport accepts
 */
public record MqttClientConfig(
    String id,
    Duration reconnectDelayInitial,
    Duration reconnectDelayMax,
    Duration timeout,
    Duration keepalive,
    BackoffResetPolicy backoffResetPolicy,
    int maxMessageBytes
) {
    public static final String DEFAULT_ID = "client";
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 8092;

    public MqttClientConfig {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(reconnectDelayInitial, "reconnectDelayInitial");
        Objects.requireNonNull(reconnectDelayMax, "reconnectDelayMax");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(keepalive, "keepalive");
        Objects.requireNonNull(backoffResetPolicy, "backoffResetPolicy");
        if (maxMessageBytes <= 0) {
            throw new IllegalArgumentException("maxMessageBytes must be > 0");
        }
        // Duration rules are shared with the timing policy.
        new ConnectionTimingPolicy(timeout, keepalive, reconnectDelayInitial, reconnectDelayMax, backoffResetPolicy);
    }

    /**
     * Timing view of this configuration for the lifecycle core.
     */
    public ConnectionTimingPolicy timingPolicy() {
        return new ConnectionTimingPolicy(timeout, keepalive, reconnectDelayInitial, reconnectDelayMax, backoffResetPolicy);
    }

    public static MqttClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final ConnectionTimingPolicy defaults = ConnectionTimingPolicy.defaults();

        private String id = DEFAULT_ID;
        private Duration reconnectDelayInitial = defaults.reconnectDelayInitial();
        private Duration reconnectDelayMax = defaults.reconnectDelayMax();
        private Duration timeout = defaults.handshakeTimeout();
        private Duration keepalive = defaults.keepalive();
        private BackoffResetPolicy backoffResetPolicy = defaults.backoffResetPolicy();
        private int maxMessageBytes = DEFAULT_MAX_MESSAGE_BYTES;

        private Builder() {}

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withReconnectDelayInitial(Duration delay) {
            this.reconnectDelayInitial = delay;
            return this;
        }

        public Builder withReconnectDelayMax(Duration delay) {
            this.reconnectDelayMax = delay;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withKeepalive(Duration keepalive) {
            this.keepalive = keepalive;
            return this;
        }

        public Builder withBackoffResetPolicy(BackoffResetPolicy policy) {
            this.backoffResetPolicy = policy;
            return this;
        }

        public Builder withMaxMessageBytes(int maxMessageBytes) {
            this.maxMessageBytes = maxMessageBytes;
            return this;
        }

        public MqttClientConfig build() {
            return new MqttClientConfig(id, reconnectDelayInitial, reconnectDelayMax, timeout,
                    keepalive, backoffResetPolicy, maxMessageBytes);
        }
    }
}
