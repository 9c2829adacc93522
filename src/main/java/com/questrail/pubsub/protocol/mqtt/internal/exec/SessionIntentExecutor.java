package com.questrail.pubsub.protocol.mqtt.internal.exec;

import com.questrail.pubsub.protocol.mqtt.internal.events.ConnectionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.events.SessionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents.Kind;
import com.questrail.pubsub.protocol.mqtt.internal.time.MonotonicClock;
import com.questrail.pubsub.protocol.mqtt.internal.time.WallClock;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionObservabilitySink;
import com.questrail.pubsub.protocol.mqtt.observability.TransportObservabilityEvent;
import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;
import com.questrail.pubsub.protocol.mqtt.transport.MqttSession;
import com.questrail.pubsub.protocol.mqtt.transport.MqttSessionListener;
import com.questrail.pubsub.protocol.mqtt.transport.MqttTransportFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * SessionIntentExecutor
 * =============================================================================
 * Realizes the session intents against an {@link MqttTransportFactory} and
 * then hands the intents to the next executor in the chain.
 *
 * <h2>Session ownership</h2>
 * This executor holds at most one {@link MqttSession}, the one of the current
 * socket generation. Opening a new session releases any session still held,
 * so two sockets are never live at once.
 *
 * <h2>Event translation</h2>
 * Each session gets its own {@link MqttSessionListener} bound to the
 * generation it was opened for. Callbacks become {@link SessionEvent}s tagged
 * with that generation; the reducer discards those of abandoned sessions.
 *
 * <h2>Ordering within one intent set</h2>
 * open, CONNECT, PUBLISH, PINGREQ, DISCONNECT, release; then the next
 * executor (signals and dispatch).
 */
public final class SessionIntentExecutor implements ConnectionIntentExecutor
{
    private final MqttTransportFactory transportFactory;
    private final String clientId;
    private final Duration keepalive;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Consumer<ConnectionEvent> eventSink;
    private final ConnectionObservabilitySink observabilitySink;
    private final ConnectionIntentExecutor next;

    private MqttSession session;
    private long sessionGeneration;
    private MqttEndpoint sessionEndpoint;

    public SessionIntentExecutor(MqttTransportFactory transportFactory,
                                 String clientId,
                                 Duration keepalive,
                                 MonotonicClock clock,
                                 WallClock wallClock,
                                 Consumer<ConnectionEvent> eventSink,
                                 ConnectionObservabilitySink observabilitySink,
                                 ConnectionIntentExecutor next)
    {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.keepalive = Objects.requireNonNull(keepalive, "keepalive");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.next = Objects.requireNonNull(next, "next");
    }

    @Override
    public void execute(ConnectionIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        if (intents.contains(Kind.OPEN_SESSION)) {
            open(intents.generation().orElseThrow(() -> new IllegalArgumentException("OPEN_SESSION without generation")),
                 intents.endpoint().orElseThrow(() -> new IllegalArgumentException("OPEN_SESSION without endpoint")));
        }

        MqttSession live = session;
        if (live != null) {
            if (intents.contains(Kind.SEND_CONNECT)) {
                live.connect(clientId, keepalive);
            }
            if (intents.contains(Kind.SEND_PUBLISH)) {
                live.publish(intents.topic().orElseThrow(), intents.payload().orElseThrow());
            }
            if (intents.contains(Kind.SEND_PING)) {
                live.pingRequest();
            }
            if (intents.contains(Kind.SEND_DISCONNECT)) {
                live.disconnect();
            }
        }

        if (intents.contains(Kind.RELEASE_SESSION)) {
            release();
        }

        next.execute(intents);
    }

    /**
     * Returns {@code true} while a session handle is held.
     */
    public boolean hasSession()
    {
        return session != null;
    }

    private void open(long generation, MqttEndpoint endpoint)
    {
        release();

        sessionGeneration = generation;
        sessionEndpoint = endpoint;
        session = transportFactory.open(endpoint, new GenerationListener(generation, endpoint));

        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), TransportObservabilityEvent.Kind.SESSION_OPENED,
                generation, endpoint.toString(), null));
    }

    private void release()
    {
        MqttSession prior = session;
        if (prior == null) {
            return;
        }
        session = null;
        prior.release();

        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                wallClock.now(), TransportObservabilityEvent.Kind.SESSION_RELEASED,
                sessionGeneration, String.valueOf(sessionEndpoint), null));
    }

    /**
     * Translates the callbacks of one session into generation-tagged events.
     */
    private final class GenerationListener implements MqttSessionListener
    {
        private final long generation;
        private final MqttEndpoint endpoint;

        private GenerationListener(long generation, MqttEndpoint endpoint)
        {
            this.generation = generation;
            this.endpoint = endpoint;
        }

        @Override
        public void onConnAck(boolean accepted, String reason)
        {
            eventSink.accept(new SessionEvent.ConnAckReceived(clock.nowNanos(), generation, accepted, reason));
        }

        @Override
        public void onPublish(String topic, byte[] payload)
        {
            eventSink.accept(new SessionEvent.PublishReceived(clock.nowNanos(), generation, topic, payload));
        }

        @Override
        public void onPingResponse()
        {
            eventSink.accept(new SessionEvent.PingResponseReceived(clock.nowNanos(), generation));
        }

        @Override
        public void onDisconnect()
        {
            eventSink.accept(new SessionEvent.DisconnectReceived(clock.nowNanos(), generation));
        }

        @Override
        public void onClosed()
        {
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                    wallClock.now(), TransportObservabilityEvent.Kind.SESSION_CLOSED,
                    generation, endpoint.toString(), null));
            eventSink.accept(new SessionEvent.SocketClosed(clock.nowNanos(), generation));
        }

        @Override
        public void onError(Throwable cause)
        {
            observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                    wallClock.now(), TransportObservabilityEvent.Kind.SESSION_ERROR,
                    generation, endpoint.toString(), String.valueOf(cause)));
            eventSink.accept(new SessionEvent.SocketError(clock.nowNanos(), generation, cause));
        }
    }
}
