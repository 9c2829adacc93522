package com.questrail.pubsub.protocol.mqtt.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the client stack.
 */
public record ConnectionErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
