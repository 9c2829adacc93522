package com.questrail.pubsub.api;

/**
 * Handle returned when registering a listener.
 */
@FunctionalInterface
public interface ListenerRegistration
{
    /**
     * Removes the listener. Safe to call more than once and from inside a
     * listener callback.
     */
    void remove();
}
