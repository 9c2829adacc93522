package com.questrail.pubsub.protocol.mqtt.transport;

import java.time.Duration;

/**
 * MqttSession
 * -----------------------------------------------------------------------------
 * Typed command surface of one transport + codec pairing.
 *
 * <p>A session is created per connection attempt and is never reused. Commands
 * issued before the underlying stream is established are sent once it is;
 * commands issued after the stream closed are dropped.</p>
 */
public interface MqttSession
{
    /**
     * Send CONNECT carrying the session identity.
     *
     * @param clientId  identity presented to the broker
     * @param keepAlive keepalive interval advertised to the broker
     */
    void connect(String clientId, Duration keepAlive);

    /**
     * Send PUBLISH (at-most-once).
     */
    void publish(String topic, byte[] payload);

    /**
     * Send PINGREQ.
     */
    void pingRequest();

    /**
     * Send DISCONNECT and close the stream once it has been written.
     */
    void disconnect();

    /**
     * Close the stream without any protocol exchange. Idempotent.
     */
    void release();
}
