package com.questrail.pubsub.protocol.mqtt.internal.state;

import com.questrail.pubsub.api.FatalConnectionException;
import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ConnectionIntents
 * -----------------------------------------------------------------------------
 * Immutable collection of <em>execution intentions</em> emitted by the
 * {@link ConnectionStateReducer}.
 *
 * <h2>Role in the architecture</h2>
 * {@code ConnectionIntents} is the bridge between:
 * <ul>
 *   <li>pure, deterministic lifecycle logic</li>
 *   <li>impure, side-effecting session I/O, timers and signals</li>
 * </ul>
 *
 * The reducer determines <b>what should happen next</b>; the executors
 * determine <b>how and when</b> those actions are carried out.
 *
 * <h2>Attachments</h2>
 * Some kinds need data (the generation of a session to open, the delay of a
 * reconnect, the payload of a publish). Attachments are carried alongside the
 * kind set and are only meaningful when the corresponding kind is present.
 */
public final class ConnectionIntents
{
    /**
     * Enumerates the actions the lifecycle core may request.
     */
    public enum Kind {
        /** Open a new transport session for the attached generation and endpoint. */
        OPEN_SESSION,

        /** Send CONNECT carrying the client identity on the live session. */
        SEND_CONNECT,

        /** Arm the single-shot handshake timer. */
        ARM_HANDSHAKE_TIMER,

        /** Cancel the handshake timer, if armed. */
        CANCEL_HANDSHAKE_TIMER,

        /** Start the repeating heartbeat timer. */
        START_HEARTBEAT,

        /** Stop the heartbeat timer, if running. */
        STOP_HEARTBEAT,

        /** Send PINGREQ on the live session. */
        SEND_PING,

        /** Send PUBLISH on the live session. */
        SEND_PUBLISH,

        /** Send DISCONNECT on the live session. */
        SEND_DISCONNECT,

        /** Drop the live session handle and close its stream. */
        RELEASE_SESSION,

        /** Schedule a reconnect attempt after the attached delay. */
        SCHEDULE_RECONNECT,

        /** Cancel a scheduled reconnect attempt. */
        CANCEL_RECONNECT,

        /** First successful handshake of the client's lifetime. */
        EMIT_CONNECT,

        /** A later successful handshake. */
        EMIT_RECONNECT,

        /** The broker ended the session with DISCONNECT. */
        EMIT_DISCONNECT,

        /** Deliver the attached inbound publish to topic listeners. */
        DISPATCH_PUBLISH,

        /** The client failed before ever connecting and is now closed. */
        FATAL
    }

    private final Set<Kind> kinds;
    private final Long generation;
    private final MqttEndpoint endpoint;
    private final Duration reconnectDelay;
    private final boolean reconnectPhase;
    private final FatalConnectionException.Reason fatalReason;
    private final String topic;
    private final byte[] payload;

    private ConnectionIntents(Set<Kind> kinds,
                              Long generation,
                              MqttEndpoint endpoint,
                              Duration reconnectDelay,
                              boolean reconnectPhase,
                              FatalConnectionException.Reason fatalReason,
                              String topic,
                              byte[] payload) {
        this.kinds = kinds.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(kinds));
        this.generation = generation;
        this.endpoint = endpoint;
        this.reconnectDelay = reconnectDelay;
        this.reconnectPhase = reconnectPhase;
        this.fatalReason = fatalReason;
        this.topic = topic;
        this.payload = payload;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    /**
     * Socket generation the intents refer to, if any.
     */
    public Optional<Long> generation() {
        return Optional.ofNullable(generation);
    }

    public Optional<MqttEndpoint> endpoint() {
        return Optional.ofNullable(endpoint);
    }

    public Optional<Duration> reconnectDelay() {
        return Optional.ofNullable(reconnectDelay);
    }

    /**
     * For {@link Kind#ARM_HANDSHAKE_TIMER}: whether the attempt follows an
     * earlier successful session.
     */
    public boolean reconnectPhase() {
        return reconnectPhase;
    }

    public Optional<FatalConnectionException.Reason> fatalReason() {
        return Optional.ofNullable(fatalReason);
    }

    /**
     * Topic of {@link Kind#SEND_PUBLISH} or {@link Kind#DISPATCH_PUBLISH}.
     */
    public Optional<String> topic() {
        return Optional.ofNullable(topic);
    }

    /**
     * Payload of {@link Kind#SEND_PUBLISH} or {@link Kind#DISPATCH_PUBLISH}.
     */
    public Optional<byte[]> payload() {
        return Optional.ofNullable(payload);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ConnectionIntents").append(kinds);
        if (generation != null) {
            sb.append(" gen=").append(generation);
        }
        if (reconnectDelay != null) {
            sb.append(" delay=").append(reconnectDelay.toMillis()).append("ms");
        }
        if (fatalReason != null) {
            sb.append(" fatal=").append(fatalReason);
        }
        if (topic != null) {
            sb.append(" topic=").append(topic);
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private Long generation;
        private MqttEndpoint endpoint;
        private Duration reconnectDelay;
        private boolean reconnectPhase;
        private FatalConnectionException.Reason fatalReason;
        private String topic;
        private byte[] payload;

        private Builder() {}

        public Builder add(Kind kind) {
            Objects.requireNonNull(kind, "kind");
            kinds.add(kind);
            return this;
        }

        public Builder generation(long generation) {
            this.generation = generation;
            return this;
        }

        public Builder endpoint(MqttEndpoint endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
            return this;
        }

        public Builder reconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
            return this;
        }

        public Builder reconnectPhase(boolean reconnectPhase) {
            this.reconnectPhase = reconnectPhase;
            return this;
        }

        public Builder fatalReason(FatalConnectionException.Reason fatalReason) {
            this.fatalReason = Objects.requireNonNull(fatalReason, "fatalReason");
            return this;
        }

        public Builder publish(String topic, byte[] payload) {
            this.topic = Objects.requireNonNull(topic, "topic");
            this.payload = Objects.requireNonNull(payload, "payload");
            return this;
        }

        public ConnectionIntents build() {
            return new ConnectionIntents(kinds, generation, endpoint, reconnectDelay,
                    reconnectPhase, fatalReason, topic, payload);
        }
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    /**
     * No-op intent (do nothing).
     */
    public static ConnectionIntents none() {
        return new ConnectionIntents(EnumSet.noneOf(Kind.class), null, null, null, false, null, null, null);
    }

    /**
     * Send one PINGREQ.
     */
    public static ConnectionIntents sendPing() {
        return new ConnectionIntents(EnumSet.of(Kind.SEND_PING), null, null, null, false, null, null, null);
    }

    /**
     * Publish on the live session.
     */
    public static ConnectionIntents sendPublish(String topic, byte[] payload) {
        return builder().add(Kind.SEND_PUBLISH).publish(topic, payload).build();
    }

    /**
     * Hand an inbound publish to topic listeners.
     */
    public static ConnectionIntents dispatchPublish(String topic, byte[] payload) {
        return builder().add(Kind.DISPATCH_PUBLISH).publish(topic, payload).build();
    }
}
