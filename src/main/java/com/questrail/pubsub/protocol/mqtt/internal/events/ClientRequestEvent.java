package com.questrail.pubsub.protocol.mqtt.internal.events;

import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;

import java.util.Objects;
import java.util.Optional;

/**
 * ClientRequestEvent
 * -----------------------------------------------------------------------------
 * Requests made by application code through the client facade.
 */
public sealed interface ClientRequestEvent extends ConnectionEvent
        permits ClientRequestEvent.ConnectRequested,
                ClientRequestEvent.PublishRequested,
                ClientRequestEvent.CloseRequested
{
    /**
     * Connect to {@code endpoint}, or to the remembered endpoint when absent.
     */
    final class ConnectRequested extends ConnectionEvent.Base implements ClientRequestEvent {
        private final MqttEndpoint endpoint;

        public ConnectRequested(long nanos, MqttEndpoint endpoint) {
            super(nanos);
            this.endpoint = endpoint;
        }

        public Optional<MqttEndpoint> endpoint() {
            return Optional.ofNullable(endpoint);
        }
    }

    /** Publish an already-encoded payload. */
    final class PublishRequested extends ConnectionEvent.Base implements ClientRequestEvent {
        private final String topic;
        private final byte[] payload;

        public PublishRequested(long nanos, String topic, byte[] payload) {
            super(nanos);
            this.topic = Objects.requireNonNull(topic, "topic");
            this.payload = Objects.requireNonNull(payload, "payload");
        }

        public String topic() {
            return topic;
        }

        public byte[] payload() {
            return payload;
        }
    }

    /** Terminal shutdown requested by the application. */
    final class CloseRequested extends ConnectionEvent.Base implements ClientRequestEvent {
        public CloseRequested(long nanos) {
            super(nanos);
        }
    }
}
