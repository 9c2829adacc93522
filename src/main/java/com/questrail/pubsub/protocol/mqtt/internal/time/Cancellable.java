package com.questrail.pubsub.protocol.mqtt.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a connection timer (handshake timeout, heartbeat
 * tick, reconnect delay).
 *
 * <p>
 * A cancelled task must never run its body. Implementations backed by an
 * executor may still dequeue the task; the connection timer guard layers a
 * sequence check on top so a late dequeue is inert.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was previously cancelled.
     */
    boolean cancel();
}
