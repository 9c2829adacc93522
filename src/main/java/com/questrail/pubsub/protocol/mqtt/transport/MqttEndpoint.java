package com.questrail.pubsub.protocol.mqtt.transport;

import java.util.Objects;

/**
 * Broker address remembered by the client and reused on every reconnect.
 */
public record MqttEndpoint(String host, int port)
{
    public MqttEndpoint {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535: " + port);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
