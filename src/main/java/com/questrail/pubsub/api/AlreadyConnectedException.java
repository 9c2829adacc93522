package com.questrail.pubsub.api;

/**
 * Reported to a {@link ConnectCallback} when {@code connect} is called on a
 * client that already holds an acknowledged session.
 */
public final class AlreadyConnectedException extends MqttClientException
{
    public AlreadyConnectedException(String message) {
        super(message);
    }
}
