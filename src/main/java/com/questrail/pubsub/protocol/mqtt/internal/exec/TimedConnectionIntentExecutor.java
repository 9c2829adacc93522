package com.questrail.pubsub.protocol.mqtt.internal.exec;

import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents.Kind;

import java.util.Objects;

/**
 * TimedConnectionIntentExecutor
 * =============================================================================
 * Operational wrapper that realizes the timer intents through a
 * {@link ConnectionTimerGuard} and hands everything else to a delegate.
 *
 * <h2>Ordering</h2>
 * <ol>
 *   <li>Cancellations (handshake, heartbeat, reconnect) run first, so nothing
 *       stale can fire while the delegate works.</li>
 *   <li>The delegate performs session I/O and signals.</li>
 *   <li>Arming (handshake, heartbeat, reconnect) runs last, once the session
 *       the timer refers to exists.</li>
 * </ol>
 *
 * Timer expirations are injected by the guard as events; this executor never
 * decides what an expiration means.
 */
public final class TimedConnectionIntentExecutor implements ConnectionIntentExecutor {

    private final ConnectionIntentExecutor delegate;
    private final ConnectionTimerGuard timers;
    private final ConnectionTimingPolicy timingPolicy;

    public TimedConnectionIntentExecutor(ConnectionIntentExecutor delegate,
                                         ConnectionTimerGuard timers,
                                         ConnectionTimingPolicy timingPolicy)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
    }

    @Override
    public void execute(ConnectionIntents intents)
    {
        Objects.requireNonNull(intents, "intents");
        if (intents.isEmpty()) {
            return;
        }

        if (intents.contains(Kind.CANCEL_HANDSHAKE_TIMER)) {
            timers.cancelHandshake();
        }
        if (intents.contains(Kind.STOP_HEARTBEAT)) {
            timers.stopHeartbeat();
        }
        if (intents.contains(Kind.CANCEL_RECONNECT)) {
            timers.cancelReconnect();
        }

        delegate.execute(intents);

        if (intents.contains(Kind.ARM_HANDSHAKE_TIMER)) {
            timers.armHandshake(requireGeneration(intents), intents.reconnectPhase(),
                    timingPolicy.handshakeTimeout());
        }
        if (intents.contains(Kind.START_HEARTBEAT)) {
            timers.startHeartbeat(requireGeneration(intents), timingPolicy.keepalive());
        }
        if (intents.contains(Kind.SCHEDULE_RECONNECT)) {
            timers.scheduleReconnect(intents.reconnectDelay()
                    .orElseThrow(() -> new IllegalArgumentException("SCHEDULE_RECONNECT without delay")));
        }
    }

    private static long requireGeneration(ConnectionIntents intents)
    {
        return intents.generation()
                .orElseThrow(() -> new IllegalArgumentException("timer intent without generation: " + intents));
    }
}
