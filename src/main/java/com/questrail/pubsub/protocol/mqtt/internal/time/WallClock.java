package com.questrail.pubsub.protocol.mqtt.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp events and observability
 * records. It MUST NOT be used for handshake, heartbeat or backoff timing.
 */
public interface WallClock
{
    Instant now();
}
