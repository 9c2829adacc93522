package com.questrail.pubsub.api;

import java.util.Objects;

/**
 * Failure of a client that has never completed a session handshake.
 *
 * <p>There is no degraded mode without an initial session, so the client
 * closes itself and reports this exception once. The owning application
 * decides whether to exit, alert, or build a new client.</p>
 */
public final class FatalConnectionException extends MqttClientException
{
    /**
     * Why the first connection attempt failed.
     */
    public enum Reason {
        /** The broker did not acknowledge the handshake within the timeout. */
        HANDSHAKE_TIMEOUT,

        /** The transport closed or errored before any handshake completed. */
        CONNECTION_LOST_BEFORE_FIRST_CONNECT
    }

    private final Reason reason;

    public FatalConnectionException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
