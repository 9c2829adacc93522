package com.questrail.pubsub.protocol.mqtt.runtime;

import com.questrail.pubsub.protocol.mqtt.config.MqttClientConfig;
import com.questrail.pubsub.protocol.mqtt.internal.events.ConnectionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.exec.ConnectionEventLoop;
import com.questrail.pubsub.protocol.mqtt.internal.exec.ConnectionIntentExecutor;
import com.questrail.pubsub.protocol.mqtt.internal.exec.ConnectionOperationalDriver;
import com.questrail.pubsub.protocol.mqtt.internal.exec.ConnectionTimerGuard;
import com.questrail.pubsub.protocol.mqtt.internal.exec.ConnectionTimingPolicy;
import com.questrail.pubsub.protocol.mqtt.internal.exec.SessionIntentExecutor;
import com.questrail.pubsub.protocol.mqtt.internal.exec.TimedConnectionIntentExecutor;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionState;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionStateReducer;
import com.questrail.pubsub.protocol.mqtt.internal.time.MonotonicClock;
import com.questrail.pubsub.protocol.mqtt.internal.time.MonotonicScheduler;
import com.questrail.pubsub.protocol.mqtt.internal.time.ScheduledExecutorScheduler;
import com.questrail.pubsub.protocol.mqtt.internal.time.SystemMonotonicClock;
import com.questrail.pubsub.protocol.mqtt.internal.time.SystemWallClock;
import com.questrail.pubsub.protocol.mqtt.internal.time.WallClock;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionErrorEvent;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionObservabilitySink;
import com.questrail.pubsub.protocol.mqtt.observability.ConnectionStateTransitionEvent;
import com.questrail.pubsub.protocol.mqtt.observability.Slf4jConnectionObservabilitySink;
import com.questrail.pubsub.protocol.mqtt.observability.TransportObservabilityEvent;
import com.questrail.pubsub.protocol.mqtt.transport.MqttTransportFactory;
import com.questrail.pubsub.protocol.mqtt.transport.netty.NettyMqttTransportFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * MqttClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the connection stack of one client.
 *
 * <p>Wires reducer, timer guard, executors and event loop together:</p>
 * <pre>
 *   event loop → reducer → TimedConnectionIntentExecutor
 *                              → SessionIntentExecutor → signal executor
 *   timer guard, session listeners → event loop
 * </pre>
 *
 * <p>Collaborators that are not supplied are created with production
 * defaults: a system monotonic clock, SLF4J logging of transitions, a
 * single-threaded scheduler, a Netty transport factory and a threaded
 * {@link ConnectionOperationalDriver}. The runtime shuts down exactly the
 * threads it created.</p>
 */
public final class MqttClientRuntime {
    private final ConnectionEventLoop eventLoop;
    private final ConnectionTimerGuard timers;
    private final ScheduledExecutorService ownedSchedulerExecutor;
    private final NettyMqttTransportFactory ownedTransportFactory;
    private final MonotonicClock clock;

    private MqttClientRuntime(
            ConnectionEventLoop eventLoop,
            ConnectionTimerGuard timers,
            ScheduledExecutorService ownedSchedulerExecutor,
            NettyMqttTransportFactory ownedTransportFactory,
            MonotonicClock clock) {
        this.eventLoop = eventLoop;
        this.timers = timers;
        this.ownedSchedulerExecutor = ownedSchedulerExecutor;
        this.ownedTransportFactory = ownedTransportFactory;
        this.clock = clock;
    }

    public void start() {
        eventLoop.start();
    }

    /**
     * Processes already-queued events, cancels every timer and releases the
     * threads this runtime created.
     */
    public void stop() {
        eventLoop.stop();
        timers.cancelAll();

        if (ownedSchedulerExecutor != null) {
            ownedSchedulerExecutor.shutdown();
            try {
                if (!ownedSchedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedSchedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedSchedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (ownedTransportFactory != null) {
            ownedTransportFactory.close();
        }
    }

    public ConnectionState currentState() {
        return eventLoop.currentState();
    }

    public void submitEvent(ConnectionEvent event) {
        eventLoop.submit(event);
    }

    /**
     * Monotonic clock used to timestamp events.
     */
    public MonotonicClock clock() {
        return clock;
    }

    /**
     * Timer guard of this runtime, exposed for diagnostics and tests.
     */
    public ConnectionTimerGuard timers() {
        return timers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MqttClientConfig config = MqttClientConfig.defaults();
        private String clientId;
        private MqttTransportFactory transportFactory;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ConnectionObservabilitySink observabilitySink = new Slf4jConnectionObservabilitySink();
        private ConnectionEventLoop.Factory eventLoopFactory = ConnectionOperationalDriver::new;
        private ConnectionIntentExecutor signalExecutor = intents -> {};
        private Consumer<ConnectionState> statusCallback;

        public Builder withConfig(MqttClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withClientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder withTransportFactory(MqttTransportFactory transportFactory) {
            this.transportFactory = transportFactory;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(ConnectionObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withEventLoopFactory(ConnectionEventLoop.Factory factory) {
            this.eventLoopFactory = factory;
            return this;
        }

        /**
         * Last executor of the chain; receives every intent set after the
         * session work is done. The client installs its signal handling here.
         */
        public Builder withSignalExecutor(ConnectionIntentExecutor executor) {
            this.signalExecutor = executor;
            return this;
        }

        /**
         * Called with the new state after every reducer step, before intents run.
         */
        public Builder withStatusCallback(Consumer<ConnectionState> callback) {
            this.statusCallback = callback;
            return this;
        }

        public MqttClientRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clientId, "clientId");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(eventLoopFactory, "eventLoopFactory");
            Objects.requireNonNull(signalExecutor, "signalExecutor");

            ConnectionTimingPolicy timingPolicy = config.timingPolicy();

            // 1. Time
            ScheduledExecutorService ownedExec = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ownedExec = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "mqtt-connection-timers");
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(ownedExec, clock);
            }

            // 2. Transport
            NettyMqttTransportFactory ownedTransport = null;
            MqttTransportFactory effectiveTransport = transportFactory;
            if (effectiveTransport == null) {
                ownedTransport = new NettyMqttTransportFactory(timingPolicy.handshakeTimeout(), config.maxMessageBytes());
                effectiveTransport = ownedTransport;
            }

            // 3. Observability, with the status callback folded in
            ConnectionObservabilitySink effectiveSink = observabilitySink;
            if (statusCallback != null) {
                Consumer<ConnectionState> callback = statusCallback;
                ConnectionObservabilitySink delegate = observabilitySink;
                effectiveSink = new ConnectionObservabilitySink() {
                    @Override
                    public void onStateTransition(ConnectionStateTransitionEvent event) {
                        callback.accept(event.newState());
                        delegate.onStateTransition(event);
                    }

                    @Override public void onTransportEvent(TransportObservabilityEvent event) { delegate.onTransportEvent(event); }
                    @Override public void onError(ConnectionErrorEvent event) { delegate.onError(event); }
                };
            }

            // 4. Executors; events are routed to the loop once it exists
            LoopForwarder forwarder = new LoopForwarder();
            ConnectionTimerGuard timers = new ConnectionTimerGuard(clock, effectiveScheduler, forwarder);

            SessionIntentExecutor sessionExecutor = new SessionIntentExecutor(
                effectiveTransport,
                clientId,
                timingPolicy.keepalive(),
                clock,
                wallClock,
                forwarder,
                effectiveSink,
                signalExecutor
            );
            TimedConnectionIntentExecutor timedExecutor = new TimedConnectionIntentExecutor(
                sessionExecutor,
                timers,
                timingPolicy
            );

            // 5. Event loop
            ConnectionStateReducer reducer = new ConnectionStateReducer(timingPolicy.keepalive(), timingPolicy.backoff());
            ConnectionEventLoop loop = eventLoopFactory.create(reducer, timedExecutor, ConnectionState.initial(), effectiveSink);
            forwarder.target = loop;

            return new MqttClientRuntime(loop, timers, ownedExec, ownedTransport, clock);
        }
    }

    private static final class LoopForwarder implements Consumer<ConnectionEvent> {
        private volatile ConnectionEventLoop target;

        @Override
        public void accept(ConnectionEvent event) {
            ConnectionEventLoop loop = target;
            if (loop != null) {
                loop.submit(event);
            }
        }
    }
}
