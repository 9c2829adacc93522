package com.questrail.pubsub.protocol.mqtt.internal.events;

/**
 * TimerEvent
 * -----------------------------------------------------------------------------
 * Expirations injected by the connection timer guard.
 *
 * Timer events are semantic: they say that a deadline passed, not what to do
 * about it. The reducer decides.
 */
public sealed interface TimerEvent extends ConnectionEvent
        permits TimerEvent.HandshakeTimeout, TimerEvent.HeartbeatTick, TimerEvent.ReconnectDue
{
    /**
     * No CONNACK arrived within the handshake timeout.
     */
    final class HandshakeTimeout extends ConnectionEvent.Base implements TimerEvent {
        private final long generation;
        private final boolean reconnectPhase;

        public HandshakeTimeout(long nanos, long generation, boolean reconnectPhase) {
            super(nanos);
            this.generation = generation;
            this.reconnectPhase = reconnectPhase;
        }

        public long generation() {
            return generation;
        }

        /**
         * {@code true} if the attempt was armed after a previous successful session.
         */
        public boolean reconnectPhase() {
            return reconnectPhase;
        }
    }

    /** One heartbeat interval elapsed for the session of {@code generation}. */
    final class HeartbeatTick extends ConnectionEvent.Base implements TimerEvent {
        private final long generation;

        public HeartbeatTick(long nanos, long generation) {
            super(nanos);
            this.generation = generation;
        }

        public long generation() {
            return generation;
        }
    }

    /** The backoff delay elapsed; a reconnect attempt may start. */
    final class ReconnectDue extends ConnectionEvent.Base implements TimerEvent {
        public ReconnectDue(long nanos) {
            super(nanos);
        }
    }
}
