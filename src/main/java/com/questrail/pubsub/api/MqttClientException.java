package com.questrail.pubsub.api;

/**
 * Root of the exceptions reported by a {@link TopicClient}.
 */
public class MqttClientException extends RuntimeException
{
    public MqttClientException(String message) {
        super(message);
    }

    public MqttClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
