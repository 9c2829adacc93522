package com.questrail.pubsub.protocol.mqtt.transport;

/**
 * MqttTransportFactory
 * -----------------------------------------------------------------------------
 * Port for opening a byte stream to a broker and wrapping it in the MQTT
 * packet codec.
 *
 * <p>{@link #open} must not block. Connection establishment completes
 * asynchronously; a failure to connect is reported through
 * {@link MqttSessionListener#onError(Throwable)} and/or
 * {@link MqttSessionListener#onClosed()}, never thrown.</p>
 */
public interface MqttTransportFactory
{
    /**
     * Begin opening a session to {@code endpoint}.
     *
     * @param endpoint broker address
     * @param listener receives every event of the new session
     * @return the session handle; exclusively owned by the caller
     */
    MqttSession open(MqttEndpoint endpoint, MqttSessionListener listener);
}
