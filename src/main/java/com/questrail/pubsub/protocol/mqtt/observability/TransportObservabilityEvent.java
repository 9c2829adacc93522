package com.questrail.pubsub.protocol.mqtt.observability;

import java.time.Instant;

/**
 * Record representing a session-level event (opened, released, closed, failed).
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    long generation,
    String endpoint,
    String detail
) {
    public enum Kind {
        SESSION_OPENED,
        SESSION_RELEASED,
        SESSION_CLOSED,
        SESSION_ERROR
    }
}
