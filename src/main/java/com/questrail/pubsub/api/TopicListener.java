package com.questrail.pubsub.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives decoded messages published on a single topic.
 *
 * <p>Invoked synchronously on the client's event-loop thread, in registration
 * order. Implementations should not block.</p>
 */
@FunctionalInterface
public interface TopicListener
{
    void onMessage(String topic, JsonNode message);
}
