package com.questrail.pubsub.protocol.mqtt.internal.state;

import com.questrail.pubsub.api.FatalConnectionException;
import com.questrail.pubsub.protocol.mqtt.internal.events.ClientRequestEvent;
import com.questrail.pubsub.protocol.mqtt.internal.events.ConnectionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.events.SessionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.events.TimerEvent;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents.Kind;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionState.Phase;
import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for the connection lifecycle.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link ConnectionState} and a single {@link ConnectionEvent},
 * the reducer computes:
 * <ul>
 *   <li>a new {@link ConnectionState}</li>
 *   <li>a set of {@link ConnectionIntents} describing what should happen next</li>
 * </ul>
 *
 * The reducer itself never performs those actions. It holds no timers and no
 * sockets; execution is the responsibility of the intent executors.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   DISCONNECTED --connect--> CONNECTING --connack--> CONNECTED
 *        ^                        |                       |
 *        +---- close handler -----+------- close handler -+
 *   any --close()--> CLOSED
 * </pre>
 *
 * <h2>Shared close handler</h2>
 * Socket close, socket error, broker DISCONNECT, refused CONNACK, stale
 * heartbeat and reconnect-phase handshake timeout all converge on
 * {@link #closeSocket}. It runs at most once per socket generation. After a
 * first successful session it schedules a reconnect with backoff; before one,
 * the failure is fatal and the client closes.
 */
public final class ConnectionStateReducer
{
    /**
     * Result of applying an event to a connection state.
     *
     * @param newState the updated state
     * @param intents  intentions to be executed by the caller
     */
    public record Result(ConnectionState newState,
                         ConnectionIntents intents) {}

    private final Duration keepalive;
    private final ReconnectBackoff backoff;

    /**
     * @param keepalive heartbeat interval; a ping unanswered for more than
     *                  twice this long marks the session stale
     * @param backoff   reconnect delay policy
     */
    public ConnectionStateReducer(Duration keepalive, ReconnectBackoff backoff)
    {
        this.keepalive = Objects.requireNonNull(keepalive, "keepalive");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        if (keepalive.isNegative() || keepalive.isZero()) {
            throw new IllegalArgumentException("keepalive must be > 0");
        }
    }

    /**
     * Applies a single event to the current state.
     *
     * @param state the current state (must not be {@code null})
     * @param event the event to apply (must not be {@code null})
     * @return the resulting state and intentions
     */
    public Result apply(ConnectionState state, ConnectionEvent event)
    {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof ClientRequestEvent.ConnectRequested e) {
            return onConnectRequested(state, e);
        }
        if (event instanceof ClientRequestEvent.PublishRequested e) {
            return onPublishRequested(state, e);
        }
        if (event instanceof ClientRequestEvent.CloseRequested e) {
            return onCloseRequested(state);
        }
        if (event instanceof SessionEvent e) {
            if (e.generation() != state.socketGeneration() || !state.socketOpen()) {
                // Late callback from an abandoned socket.
                return unchanged(state);
            }
            return onSessionEvent(state, e);
        }
        if (event instanceof TimerEvent.HandshakeTimeout e) {
            return onHandshakeTimeout(state, e);
        }
        if (event instanceof TimerEvent.HeartbeatTick e) {
            return onHeartbeatTick(state, e);
        }
        if (event instanceof TimerEvent.ReconnectDue e) {
            return onReconnectDue(state);
        }

        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Application requests
    // ---------------------------------------------------------------------

    private Result onConnectRequested(ConnectionState state, ClientRequestEvent.ConnectRequested e)
    {
        if (state.phase() != Phase.DISCONNECTED) {
            // CONNECTED and CLOSED are rejected by the facade before submission;
            // CONNECTING already has a socket in flight.
            return unchanged(state);
        }

        Optional<MqttEndpoint> endpoint = e.endpoint().or(state::endpoint);
        if (endpoint.isEmpty()) {
            return unchanged(state);
        }

        return startAttempt(state.withEndpoint(endpoint.get()), state.reconnectPending());
    }

    private Result onPublishRequested(ConnectionState state, ClientRequestEvent.PublishRequested e)
    {
        if (state.phase() != Phase.CONNECTED || !state.socketOpen()) {
            return unchanged(state);
        }
        return new Result(state, ConnectionIntents.sendPublish(e.topic(), e.payload()));
    }

    private Result onCloseRequested(ConnectionState state)
    {
        if (state.phase() == Phase.CLOSED) {
            return unchanged(state);
        }

        ConnectionIntents.Builder intents = ConnectionIntents.builder()
                .add(Kind.CANCEL_HANDSHAKE_TIMER)
                .add(Kind.STOP_HEARTBEAT)
                .add(Kind.CANCEL_RECONNECT);

        ConnectionState newState = state;
        if (state.socketOpen()) {
            // DISCONNECT is written before the handle is released.
            intents.add(Kind.SEND_DISCONNECT)
                    .add(Kind.RELEASE_SESSION)
                    .generation(state.socketGeneration());
            newState = state.withSocketReleased();
        }

        newState = newState
                .withPhase(Phase.CLOSED)
                .withReconnectPending(false);

        return new Result(newState, intents.build());
    }

    // ---------------------------------------------------------------------
    // Session events (current generation only)
    // ---------------------------------------------------------------------

    private Result onSessionEvent(ConnectionState state, SessionEvent event)
    {
        if (event instanceof SessionEvent.ConnAckReceived e) {
            return onConnAck(state, e);
        }
        if (event instanceof SessionEvent.PublishReceived e) {
            if (state.phase() != Phase.CONNECTED) {
                return unchanged(state);
            }
            return new Result(state, ConnectionIntents.dispatchPublish(e.topic(), e.payload()));
        }
        if (event instanceof SessionEvent.PingResponseReceived e) {
            return new Result(state.withLastPong(e.nanos()), ConnectionIntents.none());
        }
        if (event instanceof SessionEvent.DisconnectReceived) {
            ConnectionIntents.Builder intents = ConnectionIntents.builder();
            if (state.phase() != Phase.CLOSED) {
                intents.add(Kind.EMIT_DISCONNECT);
            }
            return closeSocket(state, intents);
        }
        if (event instanceof SessionEvent.SocketClosed || event instanceof SessionEvent.SocketError) {
            return closeSocket(state, ConnectionIntents.builder());
        }
        return unchanged(state);
    }

    private Result onConnAck(ConnectionState state, SessionEvent.ConnAckReceived e)
    {
        if (state.phase() != Phase.CONNECTING) {
            // Duplicate acknowledgement.
            return unchanged(state);
        }
        if (!e.accepted()) {
            return closeSocket(state, ConnectionIntents.builder());
        }

        boolean first = state.successCount() == 0;

        ConnectionState newState = state
                .withPhase(Phase.CONNECTED)
                .withSuccessRecorded()
                .withReconnectPending(false)
                .withReconnectDelay(backoff.afterSuccess(state.reconnectDelay()));

        ConnectionIntents intents = ConnectionIntents.builder()
                .add(Kind.CANCEL_HANDSHAKE_TIMER)
                .add(Kind.CANCEL_RECONNECT)
                .add(Kind.START_HEARTBEAT)
                .add(first ? Kind.EMIT_CONNECT : Kind.EMIT_RECONNECT)
                .generation(state.socketGeneration())
                .build();

        return new Result(newState, intents);
    }

    // ---------------------------------------------------------------------
    // Timer events
    // ---------------------------------------------------------------------

    private Result onHandshakeTimeout(ConnectionState state, TimerEvent.HandshakeTimeout e)
    {
        if (state.phase() != Phase.CONNECTING
                || e.generation() != state.socketGeneration()
                || !state.socketOpen()) {
            return unchanged(state);
        }

        if (e.reconnectPhase()) {
            // Abandon the attempt; the close handler releases it and schedules the next one.
            return closeSocket(state, ConnectionIntents.builder());
        }

        ConnectionState newState = state
                .withSocketReleased()
                .withPhase(Phase.CLOSED)
                .withReconnectPending(false);

        return new Result(newState, fatal(state.socketGeneration(),
                FatalConnectionException.Reason.HANDSHAKE_TIMEOUT).build());
    }

    private Result onHeartbeatTick(ConnectionState state, TimerEvent.HeartbeatTick e)
    {
        if (state.phase() != Phase.CONNECTED
                || e.generation() != state.socketGeneration()
                || !state.socketOpen()) {
            return unchanged(state);
        }

        if (!state.pingOutstanding()) {
            return new Result(state.withLastPing(e.nanos()), ConnectionIntents.sendPing());
        }

        long silentNanos = e.nanos() - state.lastPingNanos();
        if (silentNanos > keepalive.multipliedBy(2).toNanos()) {
            return closeSocket(state, ConnectionIntents.builder().add(Kind.SEND_DISCONNECT));
        }

        return unchanged(state);
    }

    private Result onReconnectDue(ConnectionState state)
    {
        if (state.phase() != Phase.DISCONNECTED || !state.reconnectPending() || state.endpoint().isEmpty()) {
            return unchanged(state);
        }
        return startAttempt(state.withReconnectPending(false), false);
    }

    // ---------------------------------------------------------------------
    // Shared transitions
    // ---------------------------------------------------------------------

    /**
     * Opens a new socket generation against the remembered endpoint.
     */
    private Result startAttempt(ConnectionState state, boolean cancelReconnect)
    {
        ConnectionState newState = state
                .withPhase(Phase.CONNECTING)
                .withNewSocket()
                .withReconnectPending(false);

        ConnectionIntents.Builder intents = ConnectionIntents.builder()
                .add(Kind.OPEN_SESSION)
                .add(Kind.SEND_CONNECT)
                .add(Kind.ARM_HANDSHAKE_TIMER)
                .generation(newState.socketGeneration())
                .endpoint(newState.endpoint().orElseThrow())
                .reconnectPhase(newState.successCount() > 0);

        if (cancelReconnect) {
            intents.add(Kind.CANCEL_RECONNECT);
        }

        return new Result(newState, intents.build());
    }

    /**
     * The shared close handler. Runs at most once per socket generation.
     */
    private Result closeSocket(ConnectionState state, ConnectionIntents.Builder intents)
    {
        if (!state.socketOpen()) {
            return unchanged(state);
        }

        intents.add(Kind.CANCEL_HANDSHAKE_TIMER)
                .add(Kind.STOP_HEARTBEAT)
                .add(Kind.RELEASE_SESSION)
                .generation(state.socketGeneration());

        ConnectionState released = state.withSocketReleased();

        if (state.phase() == Phase.CLOSED) {
            return new Result(released, intents.build());
        }

        if (state.successCount() > 0) {
            Duration delay = backoff.nextDelay(state.reconnectDelay());
            ConnectionState newState = released
                    .withPhase(Phase.DISCONNECTED)
                    .withReconnectDelay(delay)
                    .withReconnectPending(true);

            intents.add(Kind.SCHEDULE_RECONNECT).reconnectDelay(delay);
            return new Result(newState, intents.build());
        }

        ConnectionState newState = released
                .withPhase(Phase.CLOSED)
                .withReconnectPending(false);

        intents.add(Kind.FATAL)
                .add(Kind.CANCEL_RECONNECT)
                .fatalReason(FatalConnectionException.Reason.CONNECTION_LOST_BEFORE_FIRST_CONNECT);
        return new Result(newState, intents.build());
    }

    private static ConnectionIntents.Builder fatal(long generation, FatalConnectionException.Reason reason)
    {
        return ConnectionIntents.builder()
                .add(Kind.CANCEL_HANDSHAKE_TIMER)
                .add(Kind.STOP_HEARTBEAT)
                .add(Kind.CANCEL_RECONNECT)
                .add(Kind.RELEASE_SESSION)
                .add(Kind.FATAL)
                .generation(generation)
                .fatalReason(reason);
    }

    private static Result unchanged(ConnectionState state)
    {
        return new Result(state, ConnectionIntents.none());
    }
}
