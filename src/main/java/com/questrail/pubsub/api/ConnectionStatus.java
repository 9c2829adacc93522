package com.questrail.pubsub.api;

/**
 * ConnectionStatus
 * -----------------------------------------------------------------------------
 * Coarse, protocol-neutral view of a {@link TopicClient}'s connection.
 *
 * <p>Implementations map their internal lifecycle state machine onto these
 * values. No ordering of transitions is guaranteed other than that
 * {@link #CLOSED} is terminal.</p>
 */
public enum ConnectionStatus
{
    /**
     * No session is established. Either {@code connect} has not been called
     * yet or the client is waiting to reconnect.
     */
    DISCONNECTED,

    /**
     * A transport is open and the session handshake is in flight.
     */
    CONNECTING,

    /**
     * The broker acknowledged the session; heartbeats are active.
     */
    CONNECTED,

    /**
     * The client was closed by the application or failed fatally.
     */
    CLOSED
}
