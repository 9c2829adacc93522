package com.questrail.pubsub.protocol.mqtt.observability;

import com.questrail.pubsub.protocol.mqtt.internal.events.TimerEvent;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ConnectionObservabilitySink that emits logs via SLF4J.
 *
 * <p>Phase changes and reconnect scheduling log at INFO, a stale session at
 * WARN, and every other reducer step at DEBUG.</p>
 */
public final class Slf4jConnectionObservabilitySink implements ConnectionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jConnectionObservabilitySink.class);

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {
        ConnectionIntents intents = event.resultingIntents();

        if (event.isPhaseChange()) {
            log.info("MQTT phase: {} -> {} (gen {}, on {})",
                event.oldState().phase(),
                event.newState().phase(),
                event.newState().socketGeneration(),
                event.triggeringEvent());
        } else if (log.isDebugEnabled()) {
            log.debug("MQTT event {} -> {}", event.triggeringEvent(), intents);
        }

        if (intents.contains(ConnectionIntents.Kind.SCHEDULE_RECONNECT)) {
            log.info("MQTT reconnect to {} scheduled in {} ms",
                event.newState().endpoint().map(Object::toString).orElse("?"),
                intents.reconnectDelay().map(d -> d.toMillis()).orElse(0L));
        }
        if (event.triggeringEvent() instanceof TimerEvent.HeartbeatTick
                && intents.contains(ConnectionIntents.Kind.RELEASE_SESSION)) {
            log.warn("MQTT session {} to {} is stale (no PINGRESP), closing",
                event.oldState().socketGeneration(),
                event.oldState().endpoint().map(Object::toString).orElse("?"));
        }
        if (intents.contains(ConnectionIntents.Kind.FATAL)) {
            log.error("MQTT client failed before first connect: {}",
                intents.fatalReason().map(Enum::name).orElse("?"));
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        switch (event.kind()) {
            case SESSION_ERROR -> log.warn("MQTT session {} to {} failed: {}",
                event.generation(), event.endpoint(), event.detail());
            case SESSION_OPENED -> log.info("MQTT session {} opening to {}",
                event.generation(), event.endpoint());
            default -> log.debug("MQTT transport event: {}", event);
        }
    }

    @Override
    public void onError(ConnectionErrorEvent event) {
        log.error("MQTT client error: {}", event.message(), event.cause());
    }
}
