package com.questrail.pubsub.protocol.mqtt.transport;

/**
 * MqttSessionListener
 * -----------------------------------------------------------------------------
 * Callback sink for the typed events of one {@link MqttSession}.
 *
 * <p>Callbacks carry no lifecycle decisions; the listener translates them into
 * connection events for the client's event loop. Implementations of
 * {@link MqttTransportFactory} deliver callbacks for one session serially.</p>
 */
public interface MqttSessionListener
{
    /**
     * CONNACK received.
     *
     * @param accepted {@code true} if the broker accepted the session
     * @param reason   broker return code, for diagnostics
     */
    void onConnAck(boolean accepted, String reason);

    /**
     * PUBLISH received. The payload is a private copy.
     */
    void onPublish(String topic, byte[] payload);

    /**
     * PINGRESP received.
     */
    void onPingResponse();

    /**
     * DISCONNECT received from the broker.
     */
    void onDisconnect();

    /**
     * The stream closed (orderly or not). Delivered at most once.
     */
    void onClosed();

    /**
     * The stream or codec failed.
     */
    void onError(Throwable cause);
}
