package com.questrail.pubsub.protocol.mqtt.internal.exec;

import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents;

/**
 * ConnectionIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure lifecycle state machine and the impure
 * world of sessions, timers and application callbacks.
 *
 * <h2>Role in the architecture</h2>
 * {@code ConnectionIntentExecutor} is responsible for <em>realizing</em> the
 * intentions produced by the
 * {@link com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionStateReducer}.
 *
 * It is the ONLY layer allowed to:
 * <ul>
 *   <li>Open, write to and release transport sessions</li>
 *   <li>Start or cancel timers</li>
 *   <li>Invoke application listeners and callbacks</li>
 * </ul>
 *
 * <h2>Actor-style execution model</h2>
 * Implementations are called from the client's single event loop. Outcomes
 * (acknowledgements, closes, expirations) are reported back only as
 * {@code ConnectionEvent}s.
 */
public interface ConnectionIntentExecutor
{
    /**
     * Execute the supplied intentions. Must not block.
     *
     * @param intents immutable set of actions to perform
     */
    void execute(ConnectionIntents intents);
}
