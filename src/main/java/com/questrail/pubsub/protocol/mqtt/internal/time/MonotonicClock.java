package com.questrail.pubsub.protocol.mqtt.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every connection timing decision.
 *
 * <h2>Binding invariant</h2>
 * Handshake deadlines, heartbeat staleness and reconnect spacing MUST be
 * computed from a monotonic source. Wall-clock time is permitted only for
 * observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
