package com.questrail.pubsub.protocol.mqtt.internal.events;

/**
 * ConnectionEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every stimulus processed by the connection lifecycle
 * state machine.
 *
 * <h2>Role in the architecture</h2>
 * The client is modeled as an event-driven, actor-style system. All changes to
 * connection state occur strictly in response to {@link ConnectionEvent}s that
 * are serialized and processed one at a time.
 * <p>
 * Events are the <em>only</em> way information enters the lifecycle core.
 * This includes:
 * <ul>
 *   <li>Application requests (connect, publish, close)</li>
 *   <li>Session callbacks from the transport (acks, publishes, closes)</li>
 *   <li>Timer expirations (handshake, heartbeat, reconnect)</li>
 * </ul>
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Events must be immutable</li>
 *   <li>Events must be side-effect free</li>
 * </ul>
 *
 * The timestamp is taken from a {@code MonotonicClock}; the reducer uses it
 * for heartbeat staleness arithmetic.
 */
public interface ConnectionEvent
{
    /**
     * Monotonic time, in nanoseconds, at which the event was generated.
     */
    long nanos();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements ConnectionEvent {
        private final long nanos;

        protected Base(long nanos) {
            this.nanos = nanos;
        }

        @Override
        public long nanos() {
            return nanos;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "@" + nanos;
        }
    }
}
