package com.questrail.pubsub.protocol.mqtt.internal.state;

/**
 * What happens to the reconnect delay after a successful handshake.
 */
public enum BackoffResetPolicy {
    /**
     * The next failure episode starts again at the initial delay.
     */
    RESET_ON_SUCCESS,

    /**
     * The delay keeps growing across episodes until it reaches the maximum,
     * even after long stable sessions.
     */
    PERSIST_ACROSS_EPISODES
}
