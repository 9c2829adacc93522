package com.questrail.pubsub.protocol.mqtt.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ConnectionObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(ConnectionStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ConnectionErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ConnectionStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof ConnectionStateTransitionEvent)
            .map(e -> (ConnectionStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<TransportObservabilityEvent> getTransportEvents() {
        return events.stream()
            .filter(e -> e instanceof TransportObservabilityEvent)
            .map(e -> (TransportObservabilityEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<ConnectionErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof ConnectionErrorEvent)
            .map(e -> (ConnectionErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
