package com.questrail.pubsub.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.pubsub.api.ClientIdentity;
import com.questrail.pubsub.api.ConnectCallback;
import com.questrail.pubsub.api.ConnectionSignalListener;
import com.questrail.pubsub.api.ConnectionStatus;
import com.questrail.pubsub.api.FatalConnectionException;
import com.questrail.pubsub.api.ListenerRegistration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AbstractTopicClientTest
 * -----------------------------------------------------------------------------
 * Registry and signal fan-out behavior shared by every client, exercised
 * through a minimal subclass with no transport.
 */
class AbstractTopicClientTest {

    private static final ClientIdentity IDENTITY = new ClientIdentity("test", "MQTT_ADMIN_test_1");

    private static final class StubClient extends AbstractTopicClient {
        int closes;

        StubClient() {
            super(IDENTITY, new TopicEventRouter());
        }

        @Override public boolean connect(String host, int port, ConnectCallback callback) { return false; }
        @Override public boolean connect(ConnectCallback callback) { return false; }
        @Override public void send(String topic, Object message) { }
        @Override public void close() { closes++; }

        void raiseAll() {
            fireConnect();
            fireReconnect();
            fireDisconnect();
            fireFatal(new FatalConnectionException(FatalConnectionException.Reason.HANDSHAKE_TIMEOUT, "timeout"));
        }
    }

    @Test
    void startsDisconnectedWithStableIdentity() {
        StubClient client = new StubClient();

        assertEquals(ConnectionStatus.DISCONNECTED, client.getStatus());
        assertSame(IDENTITY, client.identity());
    }

    @Test
    void signalsReachEveryListenerEvenIfOneThrows() {
        StubClient client = new StubClient();
        List<String> seen = new ArrayList<>();

        client.addSignalListener(new ConnectionSignalListener() {
            @Override public void onConnect() { throw new IllegalStateException("bad listener"); }
        });
        client.addSignalListener(new ConnectionSignalListener() {
            @Override public void onConnect() { seen.add("connect"); }
            @Override public void onReconnect() { seen.add("reconnect"); }
            @Override public void onDisconnect(ClientIdentity identity) { seen.add("disconnect:" + identity.clientId()); }
            @Override public void onFatal(FatalConnectionException cause) { seen.add("fatal:" + cause.reason()); }
        });

        client.raiseAll();

        assertEquals(List.of("connect", "reconnect", "disconnect:MQTT_ADMIN_test_1", "fatal:HANDSHAKE_TIMEOUT"), seen);
    }

    @Test
    void removedSignalListenerIsNotCalled() {
        StubClient client = new StubClient();
        List<String> seen = new ArrayList<>();
        ListenerRegistration registration = client.addSignalListener(new ConnectionSignalListener() {
            @Override public void onConnect() { seen.add("connect"); }
        });

        registration.remove();
        client.raiseAll();

        assertTrue(seen.isEmpty());
    }

    @Test
    void topicNamesNeverCollideWithSignals() {
        StubClient client = new StubClient();
        List<String> topics = new ArrayList<>();
        client.subscribe("connect", (topic, message) -> topics.add(topic));

        client.raiseAll();
        assertTrue(topics.isEmpty());

        assertEquals(1, client.dispatch("connect", JsonNodeFactory.instance.objectNode()));
        assertEquals(List.of("connect"), topics);
    }

    @Test
    void disconnectDelegatesToClose() {
        StubClient client = new StubClient();

        client.disconnect();

        assertEquals(1, client.closes);
    }
}
