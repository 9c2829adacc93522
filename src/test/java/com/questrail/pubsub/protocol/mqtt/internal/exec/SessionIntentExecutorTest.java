package com.questrail.pubsub.protocol.mqtt.internal.exec;

import com.questrail.pubsub.protocol.mqtt.internal.events.ConnectionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.events.SessionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents.Kind;
import com.questrail.pubsub.protocol.mqtt.internal.time.SystemWallClock;
import com.questrail.pubsub.protocol.mqtt.observability.RecordingObservabilitySink;
import com.questrail.pubsub.protocol.mqtt.observability.TransportObservabilityEvent;
import com.questrail.pubsub.protocol.mqtt.time.ManualMonotonicClock;
import com.questrail.pubsub.protocol.mqtt.transport.FakeMqttTransportFactory;
import com.questrail.pubsub.protocol.mqtt.transport.FakeMqttTransportFactory.FakeMqttSession;
import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionIntentExecutorTest
 * -----------------------------------------------------------------------------
 * Session I/O against the fake transport: one live session at a time, and
 * callbacks tagged with the generation they were opened for.
 */
class SessionIntentExecutorTest {

    private static final MqttEndpoint BROKER = new MqttEndpoint("broker.local", 1883);

    private FakeMqttTransportFactory transport;
    private List<ConnectionEvent> events;
    private List<ConnectionIntents> forwarded;
    private RecordingObservabilitySink sink;
    private SessionIntentExecutor executor;

    @BeforeEach
    void setUp() {
        transport = new FakeMqttTransportFactory();
        events = new ArrayList<>();
        forwarded = new ArrayList<>();
        sink = new RecordingObservabilitySink();
        executor = new SessionIntentExecutor(
                transport,
                "MQTT_ADMIN_test_1",
                Duration.ofSeconds(10),
                new ManualMonotonicClock(),
                SystemWallClock.INSTANCE,
                events::add,
                sink,
                forwarded::add);
    }

    private static ConnectionIntents open(long generation) {
        return ConnectionIntents.builder()
                .add(Kind.OPEN_SESSION)
                .add(Kind.SEND_CONNECT)
                .generation(generation)
                .endpoint(BROKER)
                .build();
    }

    @Test
    void openSendsConnectWithClientId() {
        executor.execute(open(1));

        FakeMqttSession session = transport.last();
        assertEquals(BROKER, session.endpoint());
        assertEquals("MQTT_ADMIN_test_1", session.connects().get(0).clientId());
        assertEquals(Duration.ofSeconds(10), session.connects().get(0).keepAlive());
        assertTrue(executor.hasSession());
        assertTrue(sink.getTransportEvents().stream()
                .anyMatch(e -> e.kind() == TransportObservabilityEvent.Kind.SESSION_OPENED));
    }

    @Test
    void openingNewSessionReleasesPrevious() {
        executor.execute(open(1));
        executor.execute(open(2));

        assertEquals(2, transport.openCount());
        assertTrue(transport.sessions().get(0).released());
        assertFalse(transport.sessions().get(1).released());
        assertEquals(1, transport.liveCount());
    }

    @Test
    void callbacksCarryTheirGeneration() {
        executor.execute(open(1));
        FakeMqttSession first = transport.last();
        executor.execute(open(2));

        first.injectClosed();
        transport.last().acceptConnAck();

        assertEquals(1, ((SessionEvent) events.get(0)).generation());
        assertInstanceOf(SessionEvent.SocketClosed.class, events.get(0));
        assertEquals(2, ((SessionEvent) events.get(1)).generation());
        assertTrue(((SessionEvent.ConnAckReceived) events.get(1)).accepted());
    }

    @Test
    void disconnectIsSentBeforeRelease() {
        executor.execute(open(1));
        FakeMqttSession session = transport.last();

        executor.execute(ConnectionIntents.builder()
                .add(Kind.SEND_DISCONNECT)
                .add(Kind.RELEASE_SESSION)
                .generation(1)
                .build());

        assertEquals(1, session.disconnects());
        assertTrue(session.released());
        assertFalse(executor.hasSession());
    }

    @Test
    void sendsWithoutSessionAreDroppedButForwarded() {
        ConnectionIntents ping = ConnectionIntents.sendPing();

        executor.execute(ping);

        assertEquals(0, transport.openCount());
        assertEquals(List.of(ping), forwarded);
    }

    @Test
    void publishAndPingReachLiveSession() {
        executor.execute(open(1));
        executor.execute(ConnectionIntents.sendPublish("foo", new byte[] {'{', '}'}));
        executor.execute(ConnectionIntents.sendPing());

        FakeMqttSession session = transport.last();
        assertEquals("foo", session.publishes().get(0).topic());
        assertEquals(1, session.pings());
    }
}
