package com.questrail.pubsub.protocol.mqtt.internal.exec;

import com.questrail.pubsub.protocol.mqtt.internal.state.BackoffResetPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionTimingPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        ConnectionTimingPolicy p = ConnectionTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(5), p.handshakeTimeout());
        assertEquals(Duration.ofSeconds(10), p.keepalive());
        assertEquals(Duration.ofSeconds(1), p.reconnectDelayInitial());
        assertEquals(Duration.ofSeconds(60), p.reconnectDelayMax());
        assertEquals(BackoffResetPolicy.RESET_ON_SUCCESS, p.backoffResetPolicy());
    }

    @Test
    void backoffCarriesBoundsAndPolicy() {
        ConnectionTimingPolicy p = new ConnectionTimingPolicy(
                Duration.ofMillis(1000), Duration.ofMillis(2000),
                Duration.ofMillis(500), Duration.ofMillis(4000),
                BackoffResetPolicy.PERSIST_ACROSS_EPISODES);

        assertEquals(Duration.ofMillis(500), p.backoff().initialDelay());
        assertEquals(Duration.ofMillis(4000), p.backoff().maxDelay());
        assertEquals(BackoffResetPolicy.PERSIST_ACROSS_EPISODES, p.backoff().resetPolicy());
    }

    @Test
    void rejectsNonPositiveDurations() {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionTimingPolicy(
                Duration.ZERO, Duration.ofMillis(2000), Duration.ofMillis(500), Duration.ofMillis(4000),
                BackoffResetPolicy.RESET_ON_SUCCESS));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionTimingPolicy(
                Duration.ofMillis(1000), Duration.ofMillis(-1), Duration.ofMillis(500), Duration.ofMillis(4000),
                BackoffResetPolicy.RESET_ON_SUCCESS));
    }

    @Test
    void rejectsMaxBelowInitial() {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionTimingPolicy(
                Duration.ofMillis(1000), Duration.ofMillis(2000), Duration.ofMillis(5000), Duration.ofMillis(4000),
                BackoffResetPolicy.RESET_ON_SUCCESS));
    }
}
