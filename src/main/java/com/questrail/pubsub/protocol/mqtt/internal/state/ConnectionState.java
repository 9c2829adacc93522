package com.questrail.pubsub.protocol.mqtt.internal.state;

import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one client's connection lifecycle.
 *
 * <h2>Role in the architecture</h2>
 * This class represents the state consumed and produced by
 * {@link ConnectionStateReducer}. It is pure immutable data; every
 * {@code withX} method returns a copy.
 *
 * <h2>Socket generation</h2>
 * {@code socketGeneration} is incremented for every connect attempt. Session
 * events and timer events are tagged with the generation they belong to, and
 * only the current generation may change state.
 *
 * <h2>Socket open</h2>
 * {@code socketOpen} records that a session handle for the current generation
 * is held. The shared close handler runs only while it is set and clears it,
 * which makes the handler run at most once per generation.
 */
public final class ConnectionState
{
    /** Sentinel for heartbeat timestamps that have not been recorded. */
    public static final long UNSET = Long.MIN_VALUE;

    /**
     * Lifecycle phase of the client.
     */
    public enum Phase {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        CLOSED
    }

    private final Phase phase;
    private final MqttEndpoint endpoint;
    private final long socketGeneration;
    private final boolean socketOpen;
    private final int successCount;
    private final long lastPingNanos;
    private final long lastPongNanos;
    private final Duration reconnectDelay;
    private final boolean reconnectPending;

    private ConnectionState(Phase phase,
                            MqttEndpoint endpoint,
                            long socketGeneration,
                            boolean socketOpen,
                            int successCount,
                            long lastPingNanos,
                            long lastPongNanos,
                            Duration reconnectDelay,
                            boolean reconnectPending)
    {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.endpoint = endpoint;
        this.socketGeneration = socketGeneration;
        this.socketOpen = socketOpen;
        this.successCount = successCount;
        this.lastPingNanos = lastPingNanos;
        this.lastPongNanos = lastPongNanos;
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        this.reconnectPending = reconnectPending;
    }

    /**
     * Initial state of a freshly constructed client.
     */
    public static ConnectionState initial() {
        return new ConnectionState(Phase.DISCONNECTED, null, 0L, false, 0,
                UNSET, UNSET, Duration.ZERO, false);
    }

    public Phase phase() {
        return phase;
    }

    public Optional<MqttEndpoint> endpoint() {
        return Optional.ofNullable(endpoint);
    }

    public long socketGeneration() {
        return socketGeneration;
    }

    public boolean socketOpen() {
        return socketOpen;
    }

    public int successCount() {
        return successCount;
    }

    public long lastPingNanos() {
        return lastPingNanos;
    }

    public long lastPongNanos() {
        return lastPongNanos;
    }

    /**
     * Last scheduled reconnect delay; {@link Duration#ZERO} when unset.
     */
    public Duration reconnectDelay() {
        return reconnectDelay;
    }

    public boolean reconnectPending() {
        return reconnectPending;
    }

    /**
     * A ping has been sent and no pong has been recorded since.
     */
    public boolean pingOutstanding() {
        return lastPingNanos != UNSET && lastPongNanos < lastPingNanos;
    }

    // ---------------------------------------------------------------------
    // Derivations
    // ---------------------------------------------------------------------

    public ConnectionState withPhase(Phase newPhase) {
        return new ConnectionState(newPhase, endpoint, socketGeneration, socketOpen, successCount,
                lastPingNanos, lastPongNanos, reconnectDelay, reconnectPending);
    }

    public ConnectionState withEndpoint(MqttEndpoint newEndpoint) {
        return new ConnectionState(phase, Objects.requireNonNull(newEndpoint, "newEndpoint"),
                socketGeneration, socketOpen, successCount,
                lastPingNanos, lastPongNanos, reconnectDelay, reconnectPending);
    }

    /**
     * Starts a new socket generation with an open session handle.
     */
    public ConnectionState withNewSocket() {
        return new ConnectionState(phase, endpoint, socketGeneration + 1, true, successCount,
                UNSET, UNSET, reconnectDelay, reconnectPending);
    }

    /**
     * Drops the session handle of the current generation and clears heartbeat bookkeeping.
     */
    public ConnectionState withSocketReleased() {
        return new ConnectionState(phase, endpoint, socketGeneration, false, successCount,
                UNSET, UNSET, reconnectDelay, reconnectPending);
    }

    public ConnectionState withSuccessRecorded() {
        return new ConnectionState(phase, endpoint, socketGeneration, socketOpen, successCount + 1,
                UNSET, UNSET, reconnectDelay, reconnectPending);
    }

    public ConnectionState withLastPing(long nanos) {
        return new ConnectionState(phase, endpoint, socketGeneration, socketOpen, successCount,
                nanos, lastPongNanos, reconnectDelay, reconnectPending);
    }

    public ConnectionState withLastPong(long nanos) {
        return new ConnectionState(phase, endpoint, socketGeneration, socketOpen, successCount,
                lastPingNanos, nanos, reconnectDelay, reconnectPending);
    }

    public ConnectionState withReconnectDelay(Duration delay) {
        return new ConnectionState(phase, endpoint, socketGeneration, socketOpen, successCount,
                lastPingNanos, lastPongNanos, Objects.requireNonNull(delay, "delay"), reconnectPending);
    }

    public ConnectionState withReconnectPending(boolean pending) {
        return new ConnectionState(phase, endpoint, socketGeneration, socketOpen, successCount,
                lastPingNanos, lastPongNanos, reconnectDelay, pending);
    }

    @Override
    public String toString() {
        return "ConnectionState{" +
                "phase=" + phase +
                ", endpoint=" + endpoint +
                ", gen=" + socketGeneration +
                ", socketOpen=" + socketOpen +
                ", successCount=" + successCount +
                ", reconnectDelay=" + reconnectDelay.toMillis() + "ms" +
                ", reconnectPending=" + reconnectPending +
                '}';
    }
}
