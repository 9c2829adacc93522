package com.questrail.pubsub.protocol.mqtt.codec;

import com.questrail.pubsub.api.MqttClientException;

/**
 * Indicates that a message body could not be serialized or deserialized.
 *
 * <p>Inbound decode failures are dropped by the client (the message is logged
 * and not dispatched). Outbound encode failures are thrown to the caller of
 * {@code send}, since they are application errors rather than connection
 * errors.</p>
 */
public final class PayloadCodecException extends MqttClientException
{
    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
