package com.questrail.pubsub.protocol.mqtt.internal.exec;

import com.questrail.pubsub.protocol.mqtt.internal.events.ConnectionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionState;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionStateReducer;
import com.questrail.pubsub.protocol.mqtt.internal.time.SystemWallClock;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionErrorEvent;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionObservabilitySink;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionStateTransitionEvent;
import com.questrail.pubsub.protocol.mqtt.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ConnectionOperationalDriver
 * =============================================================================
 * Operational coordinator that runs a serialized event loop on a dedicated
 * thread.
 *
 * <h2>Purpose</h2>
 * This class provides the "actor-like" runtime behavior of a client:
 * <ul>
 *   <li>Serialized event processing (one event at a time)</li>
 *   <li>State management (maintains the current {@link ConnectionState})</li>
 *   <li>Reducer coordination (applies events via {@link ConnectionStateReducer})</li>
 *   <li>Intent execution (via a {@link ConnectionIntentExecutor} chain)</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Netty callbacks, scheduler expirations and application calls only enqueue
 * events. The loop thread is the only thread that touches state, sessions
 * and application listeners.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()        → starts event loop thread
 *   driver.submit(...)    → enqueues event for processing
 *   driver.stop()         → processes what is queued, then stops
 * </pre>
 *
 * <h2>Failure isolation</h2>
 * An exception thrown while processing one event is reported to the
 * observability sink; the loop continues with the next event.
 */
public final class ConnectionOperationalDriver implements ConnectionEventLoop {

    private static final long STOP_JOIN_MILLIS = 5000;

    /** Queued by {@link #stop()}; never handed to the reducer. */
    private static final ConnectionEvent STOP = new ConnectionEvent.Base(0L) {};

    private final ConnectionStateReducer reducer;
    private final ConnectionIntentExecutor executor;
    private final ConnectionObservabilitySink observabilitySink;

    private final BlockingQueue<ConnectionEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private volatile ConnectionState currentState;
    private volatile Thread eventLoopThread;

    /**
     * Creates a new operational driver.
     *
     * @param reducer           reducer for state transitions
     * @param executor          executor for intents (typically {@link TimedConnectionIntentExecutor})
     * @param initialState      state before the first event
     * @param observabilitySink receives transitions and errors; {@code null} for none
     */
    public ConnectionOperationalDriver(ConnectionStateReducer reducer,
                                       ConnectionIntentExecutor executor,
                                       ConnectionState initialState,
                                       ConnectionObservabilitySink observabilitySink)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.currentState = Objects.requireNonNull(initialState, "initialState");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the event loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, "mqtt-connection-driver");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop thread gracefully.
     * Events queued before this call are processed; blocks until the loop
     * terminates or the join times out, in which case the thread is interrupted.
     */
    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            eventQueue.offer(STOP);

            Thread t = eventLoopThread;
            if (t != null && t != Thread.currentThread()) {
                try {
                    t.join(STOP_JOIN_MILLIS);
                    if (t.isAlive()) {
                        t.interrupt();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Submits an event for processing.
     * Events are processed sequentially in submission order; events submitted
     * while the driver is not running are dropped.
     *
     * @param event the event to process (must not be null)
     */
    @Override
    public void submit(ConnectionEvent event) {
        Objects.requireNonNull(event, "event");
        if (running.get()) {
            eventQueue.offer(event);
        }
    }

    /**
     * Returns the current state.
     * Thread-safe: can be called from any thread.
     */
    @Override
    public ConnectionState currentState() {
        synchronized (stateLock) {
            return currentState;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Main event loop - runs on dedicated thread.
     */
    private void runEventLoop() {
        while (true) {
            try {
                ConnectionEvent event = eventQueue.take();
                if (event == STOP) {
                    return;
                }
                processEvent(event);
            } catch (InterruptedException e) {
                // Stop timed out waiting for the queue to drain.
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                observabilitySink.onError(new ConnectionErrorEvent(
                    SystemWallClock.INSTANCE.now(),
                    "Event processing error",
                    e
                ));
            }
        }
    }

    /**
     * Processes a single event: apply via reducer, execute resulting intents.
     */
    private void processEvent(ConnectionEvent event) {
        final ConnectionState oldState;
        final ConnectionStateReducer.Result result;

        synchronized (stateLock) {
            oldState = currentState;
            result = reducer.apply(currentState, event);
            currentState = result.newState();
        }

        observabilitySink.onStateTransition(new ConnectionStateTransitionEvent(
            SystemWallClock.INSTANCE.now(),
            oldState,
            result.newState(),
            event,
            result.intents()
        ));

        if (!result.intents().isEmpty()) {
            executor.execute(result.intents());
        }
    }
}
