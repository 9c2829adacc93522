package com.questrail.pubsub.protocol.mqtt.observability;

import com.questrail.pubsub.protocol.mqtt.internal.events.ConnectionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionState;

import java.time.Instant;

/**
 * Record representing one reducer step of a client's lifecycle.
 */
public record ConnectionStateTransitionEvent(
    Instant timestamp,
    ConnectionState oldState,
    ConnectionState newState,
    ConnectionEvent triggeringEvent,
    ConnectionIntents resultingIntents
) {
    /**
     * Checks if the lifecycle phase changed during this transition.
     */
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }

    /**
     * Checks if a new socket generation started during this transition.
     */
    public boolean isNewGeneration() {
        return oldState.socketGeneration() != newState.socketGeneration();
    }
}
