package com.questrail.pubsub.protocol.mqtt.internal.events;

import java.util.Objects;

/**
 * SessionEvent
 * -----------------------------------------------------------------------------
 * Events raised by one transport session.
 *
 * Every session event carries the socket generation of the session that raised
 * it. The reducer ignores events whose generation is not the current one, so a
 * late callback from an abandoned socket can never affect the live session.
 */
public sealed interface SessionEvent extends ConnectionEvent
        permits SessionEvent.ConnAckReceived,
                SessionEvent.PublishReceived,
                SessionEvent.PingResponseReceived,
                SessionEvent.DisconnectReceived,
                SessionEvent.SocketClosed,
                SessionEvent.SocketError
{
    long generation();

    abstract class SessionBase extends ConnectionEvent.Base {
        private final long generation;

        protected SessionBase(long nanos, long generation) {
            super(nanos);
            this.generation = generation;
        }

        public long generation() {
            return generation;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[gen=" + generation + "]@" + nanos();
        }
    }

    /** Broker answered the CONNECT packet. */
    final class ConnAckReceived extends SessionBase implements SessionEvent {
        private final boolean accepted;
        private final String reason;

        public ConnAckReceived(long nanos, long generation, boolean accepted, String reason) {
            super(nanos, generation);
            this.accepted = accepted;
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public boolean accepted() {
            return accepted;
        }

        public String reason() {
            return reason;
        }
    }

    /** Inbound PUBLISH. */
    final class PublishReceived extends SessionBase implements SessionEvent {
        private final String topic;
        private final byte[] payload;

        public PublishReceived(long nanos, long generation, String topic, byte[] payload) {
            super(nanos, generation);
            this.topic = Objects.requireNonNull(topic, "topic");
            this.payload = Objects.requireNonNull(payload, "payload");
        }

        public String topic() {
            return topic;
        }

        public byte[] payload() {
            return payload;
        }
    }

    /** PINGRESP. */
    final class PingResponseReceived extends SessionBase implements SessionEvent {
        public PingResponseReceived(long nanos, long generation) {
            super(nanos, generation);
        }
    }

    /** Broker sent DISCONNECT. */
    final class DisconnectReceived extends SessionBase implements SessionEvent {
        public DisconnectReceived(long nanos, long generation) {
            super(nanos, generation);
        }
    }

    /** The stream closed. */
    final class SocketClosed extends SessionBase implements SessionEvent {
        public SocketClosed(long nanos, long generation) {
            super(nanos, generation);
        }
    }

    /** The stream or codec failed. */
    final class SocketError extends SessionBase implements SessionEvent {
        private final Throwable cause;

        public SocketError(long nanos, long generation, Throwable cause) {
            super(nanos, generation);
            this.cause = cause;
        }

        public Throwable cause() {
            return cause;
        }
    }
}
