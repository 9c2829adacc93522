package com.questrail.pubsub.protocol.mqtt;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.pubsub.api.AlreadyConnectedException;
import com.questrail.pubsub.api.ConnectCallback;
import com.questrail.pubsub.api.ConnectionStatus;
import com.questrail.pubsub.api.FatalConnectionException;
import com.questrail.pubsub.core.AbstractTopicClient;
import com.questrail.pubsub.core.TopicEventRouter;
import com.questrail.pubsub.protocol.mqtt.codec.JacksonPayloadCodec;
import com.questrail.pubsub.protocol.mqtt.codec.PayloadCodec;
import com.questrail.pubsub.protocol.mqtt.codec.PayloadCodecException;
import com.questrail.pubsub.protocol.mqtt.config.ClientIdentityGenerator;
import com.questrail.pubsub.protocol.mqtt.config.MqttClientConfig;
import com.questrail.pubsub.protocol.mqtt.config.TimestampClientIdentityGenerator;
import com.questrail.pubsub.protocol.mqtt.internal.events.ClientRequestEvent;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents.Kind;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionState;
import com.questrail.pubsub.protocol.mqtt.runtime.MqttClientRuntime;
import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ResilientMqttClient
 * =============================================================================
 * Production {@link com.questrail.pubsub.api.TopicClient} over MQTT 3.1.1.
 *
 * <p>The client is a thin façade. Every call becomes a
 * {@link ClientRequestEvent} for the connection event loop; lifecycle
 * decisions belong to the reducer, and the intents it emits come back here
 * only as signals to fan out (connect, reconnect, disconnect, fatal) and
 * inbound publishes to route.</p>
 *
 * <h2>Synchronous checks</h2>
 * {@code connect} rejects a connected or closed client on the caller's
 * thread, through the callback. {@code send} encodes on the caller's thread,
 * so an unserializable message throws {@link PayloadCodecException}
 * immediately; a message sent while not connected is dropped with a warning.
 *
 * <h2>Lifecycle</h2>
 * The event loop starts on the first {@code connect}. {@link #close()}
 * submits the shutdown, lets the loop process it (a live session is sent
 * DISCONNECT and released), then stops the runtime.
 */
public final class ResilientMqttClient extends AbstractTopicClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientMqttClient.class);

    private final PayloadCodec codec;
    private final MqttClientRuntime runtime;

    private final Queue<ConnectCallback> pendingCallbacks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final AtomicBoolean firstSessionEstablished = new AtomicBoolean(false);

    private volatile MqttEndpoint rememberedEndpoint;

    /**
     * Production client: Netty transport, Jackson payloads, generated identity.
     */
    public ResilientMqttClient(MqttClientConfig config) {
        this(config, new TimestampClientIdentityGenerator(), new JacksonPayloadCodec(), MqttClientRuntime.builder());
    }

    /**
     * @param config            client configuration
     * @param identityGenerator called once for the client's identity
     * @param codec             payload serialization
     * @param runtime           runtime builder, possibly pre-configured with a
     *                          transport, clock, scheduler, sink or event loop
     */
    public ResilientMqttClient(MqttClientConfig config,
                               ClientIdentityGenerator identityGenerator,
                               PayloadCodec codec,
                               MqttClientRuntime.Builder runtime) {
        super(Objects.requireNonNull(identityGenerator, "identityGenerator")
                .generate(Objects.requireNonNull(config, "config").id()),
              new TopicEventRouter());

        this.codec = Objects.requireNonNull(codec, "codec");
        this.runtime = Objects.requireNonNull(runtime, "runtime")
                .withConfig(config)
                .withClientId(identity().clientId())
                .withSignalExecutor(this::onIntents)
                .withStatusCallback(this::onState)
                .build();
    }

    // ---------------------------------------------------------------------
    // TopicClient
    // ---------------------------------------------------------------------

    @Override
    public boolean connect(String host, int port, ConnectCallback callback) {
        Objects.requireNonNull(callback, "callback");
        return requestConnect(new MqttEndpoint(host, port), callback);
    }

    @Override
    public boolean connect(ConnectCallback callback) {
        Objects.requireNonNull(callback, "callback");
        if (rememberedEndpoint == null) {
            throw new IllegalArgumentException("No broker endpoint: call connect(host, port) first");
        }
        return requestConnect(null, callback);
    }

    @Override
    public void send(String topic, Object message) {
        Objects.requireNonNull(topic, "topic");
        byte[] payload = codec.encode(message);

        ConnectionStatus status = getStatus();
        if (status != ConnectionStatus.CONNECTED) {
            log.warn("Dropping message for topic '{}': client {} is {}", topic, identity().clientId(), status);
            return;
        }
        runtime.submitEvent(new ClientRequestEvent.PublishRequested(runtime.clock().nowNanos(), topic, payload));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        terminated.set(true);
        runtime.submitEvent(new ClientRequestEvent.CloseRequested(runtime.clock().nowNanos()));
        runtime.stop();
        setStatus(ConnectionStatus.CLOSED);

        failPending(new IllegalStateException("Client closed before a session was established"));
    }

    /**
     * The runtime hosting this client's connection, for diagnostics.
     */
    public MqttClientRuntime runtime() {
        return runtime;
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    private boolean requestConnect(MqttEndpoint endpoint, ConnectCallback callback) {
        if (terminated.get()) {
            notifyFailure(callback, new IllegalStateException("Client " + identity().clientId() + " is closed"));
            return false;
        }
        if (getStatus() == ConnectionStatus.CONNECTED) {
            notifyFailure(callback, new AlreadyConnectedException(
                    "Client " + identity().clientId() + " is already connected"));
            return false;
        }

        if (endpoint != null) {
            rememberedEndpoint = endpoint;
        }
        if (callback != ConnectCallback.NONE && !retainCallback(callback)) {
            log.debug("Client {} already had its first session; connect callback is not retained",
                    identity().clientId());
        }

        runtime.start();
        runtime.submitEvent(new ClientRequestEvent.ConnectRequested(runtime.clock().nowNanos(), endpoint));
        return true;
    }

    // ---------------------------------------------------------------------
    // Event loop hooks
    // ---------------------------------------------------------------------

    private void onState(ConnectionState state) {
        if (terminated.get()) {
            setStatus(ConnectionStatus.CLOSED);
            return;
        }
        setStatus(switch (state.phase()) {
            case DISCONNECTED -> ConnectionStatus.DISCONNECTED;
            case CONNECTING -> ConnectionStatus.CONNECTING;
            case CONNECTED -> ConnectionStatus.CONNECTED;
            case CLOSED -> ConnectionStatus.CLOSED;
        });
    }

    private void onIntents(ConnectionIntents intents) {
        if (intents.contains(Kind.DISPATCH_PUBLISH)) {
            deliver(intents.topic().orElseThrow(), intents.payload().orElseThrow());
        }
        if (intents.contains(Kind.EMIT_CONNECT)) {
            synchronized (pendingCallbacks) {
                firstSessionEstablished.set(true);
            }
            completePending();
            fireConnect();
        }
        if (intents.contains(Kind.EMIT_RECONNECT)) {
            fireReconnect();
        }
        if (intents.contains(Kind.EMIT_DISCONNECT)) {
            fireDisconnect();
        }
        if (intents.contains(Kind.FATAL)) {
            FatalConnectionException.Reason reason = intents.fatalReason()
                    .orElse(FatalConnectionException.Reason.CONNECTION_LOST_BEFORE_FIRST_CONNECT);
            FatalConnectionException fatal = new FatalConnectionException(reason,
                    "Client " + identity().clientId() + " could not establish a first session: " + reason);

            // No further connects; close() still releases the runtime.
            terminated.set(true);
            setStatus(ConnectionStatus.CLOSED);
            failPending(fatal);
            fireFatal(fatal);
        }
    }

    private void deliver(String topic, byte[] payload) {
        JsonNode message;
        try {
            message = codec.decode(payload);
        } catch (PayloadCodecException e) {
            log.warn("Dropping undecodable message on topic '{}' for client {}", topic, identity().clientId(), e);
            return;
        }
        dispatch(topic, message);
    }

    private boolean retainCallback(ConnectCallback callback) {
        synchronized (pendingCallbacks) {
            return !firstSessionEstablished.get() && pendingCallbacks.add(callback);
        }
    }

    private void completePending() {
        ConnectCallback callback;
        while ((callback = pendingCallbacks.poll()) != null) {
            try {
                callback.onConnected();
            } catch (RuntimeException e) {
                log.error("Connect callback failed for client {}", identity().clientId(), e);
            }
        }
    }

    private void failPending(Throwable cause) {
        ConnectCallback callback;
        while ((callback = pendingCallbacks.poll()) != null) {
            notifyFailure(callback, cause);
        }
    }

    private void notifyFailure(ConnectCallback callback, Throwable cause) {
        try {
            callback.onFailure(cause);
        } catch (RuntimeException e) {
            log.error("Connect callback failed for client {}", identity().clientId(), e);
        }
    }
}
