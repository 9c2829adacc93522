package com.questrail.pubsub.protocol.mqtt;

import com.questrail.pubsub.protocol.mqtt.internal.events.ConnectionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.exec.ConnectionEventLoop;
import com.questrail.pubsub.protocol.mqtt.internal.exec.ConnectionIntentExecutor;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionState;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionStateReducer;
import com.questrail.pubsub.protocol.mqtt.internal.time.SystemWallClock;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionObservabilitySink;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionStateTransitionEvent;
import com.questrail.pubsub.protocol.mqtt.observability.NullObservabilitySink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * MqttConnectionController
 * -----------------------------------------------------------------------------
 * Synchronous, caller-thread host of the connection event loop.
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>An explicit owner of the event queue and the current state</li>
 *   <li>The composition point for reducer and executor</li>
 *   <li>A single-threaded, actor-style coordinator</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * <pre>
 *   event → reducer → new state → intents → executor
 * </pre>
 * <p>{@link #submit} enqueues and then drains the queue on the calling
 * thread, unless a drain is already in progress further up the same stack.
 * Events submitted by executors while an event is being processed are
 * therefore handled after it, in order, never recursively.</p>
 *
 * <p>This host makes no thread-safety guarantees. It is intended for
 * deterministic tests driven by a manual clock and scheduler, and for
 * embedding in an application that already serializes all calls.</p>
 */
public final class MqttConnectionController implements ConnectionEventLoop
{
    private final ConnectionStateReducer reducer;
    private final ConnectionIntentExecutor executor;
    private final ConnectionObservabilitySink observabilitySink;

    private final Deque<ConnectionEvent> queue = new ArrayDeque<>();

    private volatile ConnectionState state;
    private boolean draining;
    private boolean stopped;

    public MqttConnectionController(ConnectionStateReducer reducer,
                                    ConnectionIntentExecutor executor,
                                    ConnectionState initialState,
                                    ConnectionObservabilitySink observabilitySink)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public void submit(ConnectionEvent event)
    {
        Objects.requireNonNull(event, "event");
        if (stopped) {
            return;
        }
        queue.addLast(event);
        if (!draining) {
            drain();
        }
    }

    /**
     * Process exactly one queued event, if present.
     *
     * @return {@code true} if an event was processed; {@code false} if the queue was empty.
     */
    public boolean step()
    {
        ConnectionEvent event = queue.pollFirst();
        if (event == null) {
            return false;
        }

        ConnectionState oldState = state;
        ConnectionStateReducer.Result result = reducer.apply(oldState, event);
        this.state = result.newState();

        observabilitySink.onStateTransition(new ConnectionStateTransitionEvent(
                SystemWallClock.INSTANCE.now(), oldState, result.newState(), event, result.intents()));

        executor.execute(result.intents());
        return true;
    }

    /**
     * Drain the queue until no events remain.
     */
    public void drain()
    {
        draining = true;
        try {
            while (step()) {
                // Intentionally empty.
            }
        } finally {
            draining = false;
        }
    }

    @Override
    public ConnectionState currentState()
    {
        return state;
    }

    @Override
    public void start()
    {
        // Processing happens on submit.
    }

    @Override
    public void stop()
    {
        if (!draining) {
            drain();
        }
        stopped = true;
    }

    public int queuedEventCount()
    {
        return queue.size();
    }

    public Optional<ConnectionEvent> peekNextEvent()
    {
        return Optional.ofNullable(queue.peekFirst());
    }
}
