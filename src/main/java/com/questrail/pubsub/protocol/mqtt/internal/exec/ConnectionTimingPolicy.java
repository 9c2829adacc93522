package com.questrail.pubsub.protocol.mqtt.internal.exec;

import com.questrail.pubsub.protocol.mqtt.internal.state.BackoffResetPolicy;
import com.questrail.pubsub.protocol.mqtt.internal.state.ReconnectBackoff;

import java.time.Duration;
import java.util.Objects;

/**
 * ConnectionTimingPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration for the lifecycle core and its timer guard.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>handshakeTimeout</b>: how long a connect attempt may wait for
 *       CONNACK before a {@code HandshakeTimeout} event is injected.</li>
 *   <li><b>keepalive</b>: heartbeat interval, also advertised to the broker.
 *       A ping unanswered for more than twice this long closes the session.</li>
 *   <li><b>reconnectDelayInitial</b>: delay before the first reconnect attempt
 *       of a failure episode.</li>
 *   <li><b>reconnectDelayMax</b>: cap of the doubling reconnect delay.</li>
 *   <li><b>backoffResetPolicy</b>: whether a successful handshake resets the
 *       reconnect delay.</li>
 * </ul>
 */
public record ConnectionTimingPolicy(
        Duration handshakeTimeout,
        Duration keepalive,
        Duration reconnectDelayInitial,
        Duration reconnectDelayMax,
        BackoffResetPolicy backoffResetPolicy
) {
    public ConnectionTimingPolicy {
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(keepalive, "keepalive");
        Objects.requireNonNull(reconnectDelayInitial, "reconnectDelayInitial");
        Objects.requireNonNull(reconnectDelayMax, "reconnectDelayMax");
        Objects.requireNonNull(backoffResetPolicy, "backoffResetPolicy");

        requirePositive(handshakeTimeout, "handshakeTimeout");
        requirePositive(keepalive, "keepalive");
        requirePositive(reconnectDelayInitial, "reconnectDelayInitial");
        if (reconnectDelayMax.compareTo(reconnectDelayInitial) < 0) {
            throw new IllegalArgumentException("reconnectDelayMax must be >= reconnectDelayInitial");
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    /**
     * Backoff calculator configured from this policy.
     */
    public ReconnectBackoff backoff() {
        return new ReconnectBackoff(reconnectDelayInitial, reconnectDelayMax, backoffResetPolicy);
    }

    /**
     * Default values:
     * <ul>
     *   <li>handshakeTimeout: 5s</li>
     *   <li>keepalive: 10s</li>
     *   <li>reconnectDelayInitial: 1s</li>
     *   <li>reconnectDelayMax: 60s</li>
     *   <li>backoffResetPolicy: {@link BackoffResetPolicy#RESET_ON_SUCCESS}</li>
     * </ul>
     */
    public static ConnectionTimingPolicy defaults() {
        return new ConnectionTimingPolicy(
                Duration.ofSeconds(5),
                Duration.ofSeconds(10),
                Duration.ofSeconds(1),
                Duration.ofSeconds(60),
                BackoffResetPolicy.RESET_ON_SUCCESS
        );
    }
}
