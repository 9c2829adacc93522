package com.questrail.pubsub.api;

/**
 * ConnectionSignalListener
 * -----------------------------------------------------------------------------
 * Control signals raised by a {@link TopicClient}. Kept apart from topic
 * listeners so application topic names can never collide with lifecycle
 * signals.
 *
 * <p>All methods default to no-ops; override only what is needed.</p>
 */
public interface ConnectionSignalListener
{
    /**
     * The first session with the broker was established. Raised exactly once
     * over the lifetime of the client.
     */
    default void onConnect() {}

    /**
     * A session was re-established after a connection loss.
     */
    default void onReconnect() {}

    /**
     * The broker sent an explicit disconnect.
     *
     * @param identity the identity of the client that was disconnected
     */
    default void onDisconnect(ClientIdentity identity) {}

    /**
     * The client failed before ever connecting and has been closed.
     */
    default void onFatal(FatalConnectionException cause) {}
}
