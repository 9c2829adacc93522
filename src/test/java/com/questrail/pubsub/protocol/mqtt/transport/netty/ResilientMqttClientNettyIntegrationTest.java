package com.questrail.pubsub.protocol.mqtt.transport.netty;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.pubsub.api.ClientIdentity;
import com.questrail.pubsub.api.ConnectionSignalListener;
import com.questrail.pubsub.api.ConnectionStatus;
import com.questrail.pubsub.api.FatalConnectionException;
import com.questrail.pubsub.protocol.mqtt.ResilientMqttClient;
import com.questrail.pubsub.protocol.mqtt.config.MqttClientConfig;
import io.netty.handler.codec.mqtt.MqttMessageType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResilientMqttClientNettyIntegrationTest
 * -----------------------------------------------------------------------------
 * Full production stack (threaded event loop, executor-backed timers, Netty
 * transport) against {@link MqttBrokerStub}.
 */
class ResilientMqttClientNettyIntegrationTest {

    private MqttBrokerStub broker;
    private int port;
    private ResilientMqttClient client;
    private Signals signals;

    @BeforeEach
    void setUp() throws InterruptedException {
        broker = new MqttBrokerStub();
        port = broker.start();
        signals = new Signals();

        client = new ResilientMqttClient(MqttClientConfig.builder()
                .withId("it")
                .withTimeout(Duration.ofSeconds(2))
                .withKeepalive(Duration.ofSeconds(1))
                .withReconnectDelayInitial(Duration.ofMillis(100))
                .withReconnectDelayMax(Duration.ofMillis(400))
                .build());
        client.addSignalListener(signals);
    }

    @AfterEach
    void tearDown() {
        client.close();
        broker.close();
    }

    @Test
    void connectsPublishesAndReceivesEcho() throws InterruptedException {
        CountDownLatch callback = new CountDownLatch(1);
        List<JsonNode> echoed = new CopyOnWriteArrayList<>();
        CountDownLatch echo = new CountDownLatch(1);
        client.subscribe("echo", (topic, message) -> {
            echoed.add(message);
            echo.countDown();
        });

        assertTrue(client.connect("127.0.0.1", port, callback::countDown));
        assertTrue(callback.await(3, TimeUnit.SECONDS));
        assertEquals(ConnectionStatus.CONNECTED, client.getStatus());
        assertTrue(broker.clientIds().get(0).startsWith("MQTT_ADMIN_it_"));

        client.send("echo", Map.of("x", 1));

        assertTrue(echo.await(3, TimeUnit.SECONDS));
        assertEquals(1, echoed.get(0).get("x").asInt());
    }

    @Test
    void heartbeatPingsAreAnswered() throws InterruptedException {
        CountDownLatch callback = new CountDownLatch(1);
        client.connect("127.0.0.1", port, callback::countDown);
        assertTrue(callback.await(3, TimeUnit.SECONDS));

        Thread.sleep(3500);

        assertTrue(broker.count(MqttMessageType.PINGREQ) >= 2);
        assertEquals(1, broker.count(MqttMessageType.CONNECT), "answered pings keep the session");
        assertEquals(ConnectionStatus.CONNECTED, client.getStatus());
    }

    @Test
    void reconnectsAfterBrokerDropsConnection() throws InterruptedException {
        CountDownLatch callback = new CountDownLatch(1);
        client.connect("127.0.0.1", port, callback::countDown);
        assertTrue(callback.await(3, TimeUnit.SECONDS));

        broker.dropAll();

        assertTrue(signals.reconnect.await(3, TimeUnit.SECONDS));
        assertEquals(ConnectionStatus.CONNECTED, client.getStatus());
        assertEquals(2, broker.count(MqttMessageType.CONNECT));
        assertEquals(broker.clientIds().get(0), broker.clientIds().get(1), "identity is stable across sessions");
    }

    @Test
    void brokerDisconnectRaisesSignalAndReconnects() throws InterruptedException {
        CountDownLatch callback = new CountDownLatch(1);
        client.connect("127.0.0.1", port, callback::countDown);
        assertTrue(callback.await(3, TimeUnit.SECONDS));

        broker.disconnectAll();

        assertTrue(signals.disconnect.await(3, TimeUnit.SECONDS));
        assertEquals(client.identity(), signals.disconnectedIdentity);
        assertTrue(signals.reconnect.await(3, TimeUnit.SECONDS));
    }

    @Test
    void unreachableBrokerIsFatal() throws Exception {
        int deadPort;
        try (ServerSocket probe = new ServerSocket(0)) {
            deadPort = probe.getLocalPort();
        }

        client.connect("127.0.0.1", deadPort);

        assertTrue(signals.fatal.await(5, TimeUnit.SECONDS));
        assertEquals(FatalConnectionException.Reason.CONNECTION_LOST_BEFORE_FIRST_CONNECT, signals.fatalReason);
        assertEquals(ConnectionStatus.CLOSED, client.getStatus());
    }

    @Test
    void closeSendsDisconnect() throws InterruptedException {
        CountDownLatch callback = new CountDownLatch(1);
        client.connect("127.0.0.1", port, callback::countDown);
        assertTrue(callback.await(3, TimeUnit.SECONDS));

        client.close();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (broker.count(MqttMessageType.DISCONNECT) == 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, broker.count(MqttMessageType.DISCONNECT));
        assertEquals(ConnectionStatus.CLOSED, client.getStatus());
    }

    private static final class Signals implements ConnectionSignalListener {
        final CountDownLatch reconnect = new CountDownLatch(1);
        final CountDownLatch disconnect = new CountDownLatch(1);
        final CountDownLatch fatal = new CountDownLatch(1);
        volatile ClientIdentity disconnectedIdentity;
        volatile FatalConnectionException.Reason fatalReason;

        @Override
        public void onReconnect() {
            reconnect.countDown();
        }

        @Override
        public void onDisconnect(ClientIdentity identity) {
            disconnectedIdentity = identity;
            disconnect.countDown();
        }

        @Override
        public void onFatal(FatalConnectionException cause) {
            fatalReason = cause.reason();
            fatal.countDown();
        }
    }
}
