package com.questrail.pubsub.protocol.mqtt.observability;

/**
 * Main interface for receiving client observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ConnectionObservabilitySink {
    /**
     * Called after each event has been applied to the lifecycle state.
     * @param event the transition event details
     */
    void onStateTransition(ConnectionStateTransitionEvent event);

    /**
     * Called when a session is opened, released, closed or fails.
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs in the client stack.
     * @param event the error event
     */
    void onError(ConnectionErrorEvent event);
}
