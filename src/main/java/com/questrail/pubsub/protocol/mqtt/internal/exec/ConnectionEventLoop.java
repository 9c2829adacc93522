package com.questrail.pubsub.protocol.mqtt.internal.exec;

import com.questrail.pubsub.protocol.mqtt.internal.events.ConnectionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionState;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionStateReducer;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionObservabilitySink;

/**
 * ConnectionEventLoop
 * -----------------------------------------------------------------------------
 * Host of the event → reducer → intents → executor loop of one client.
 *
 * <pre>
 *   event → reducer → new state → intents → executor
 * </pre>
 *
 * Two hosts exist: a threaded driver for production and a synchronous
 * controller for deterministic tests. Both process one event at a time in
 * submission order.
 */
public interface ConnectionEventLoop
{
    /**
     * Enqueue an event. May be called from any thread, including from within
     * an executor while an event is being processed.
     */
    void submit(ConnectionEvent event);

    /**
     * Returns the current immutable state snapshot.
     */
    ConnectionState currentState();

    void start();

    /**
     * Stops processing. Events submitted before this call are processed
     * first; later events are dropped.
     */
    void stop();

    /**
     * Creates an event loop over the given collaborators.
     */
    @FunctionalInterface
    interface Factory {
        ConnectionEventLoop create(ConnectionStateReducer reducer,
                                   ConnectionIntentExecutor executor,
                                   ConnectionState initialState,
                                   ConnectionObservabilitySink observabilitySink);
    }
}
