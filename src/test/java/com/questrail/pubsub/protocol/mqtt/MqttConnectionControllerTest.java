package com.questrail.pubsub.protocol.mqtt;

import com.questrail.pubsub.protocol.mqtt.internal.events.ClientRequestEvent;
import com.questrail.pubsub.protocol.mqtt.internal.events.SessionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.state.BackoffResetPolicy;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionIntents.Kind;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionState;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionState.Phase;
import com.questrail.pubsub.protocol.mqtt.internal.state.ConnectionStateReducer;
import com.questrail.pubsub.protocol.mqtt.internal.state.ReconnectBackoff;
import com.questrail.pubsub.protocol.mqtt.observability.RecordingObservabilitySink;
import com.questrail.pubsub.protocol.mqtt.transport.MqttEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MqttConnectionControllerTest
 * -----------------------------------------------------------------------------
 * The synchronous controller: drain on submit, re-entrant submission from an
 * executor, and stop semantics.
 */
class MqttConnectionControllerTest {

    private static final MqttEndpoint BROKER = new MqttEndpoint("broker.local", 1883);

    private ConnectionStateReducer reducer;
    private RecordingObservabilitySink sink;
    private List<ConnectionIntents> executed;

    @BeforeEach
    void setUp() {
        reducer = new ConnectionStateReducer(Duration.ofSeconds(10),
                new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), BackoffResetPolicy.RESET_ON_SUCCESS));
        sink = new RecordingObservabilitySink();
        executed = new ArrayList<>();
    }

    @Test
    void submitProcessesImmediately() {
        MqttConnectionController controller =
                new MqttConnectionController(reducer, executed::add, ConnectionState.initial(), sink);

        controller.submit(new ClientRequestEvent.ConnectRequested(0, BROKER));

        assertEquals(Phase.CONNECTING, controller.currentState().phase());
        assertEquals(0, controller.queuedEventCount());
        assertEquals(1, sink.getStateTransitions().size());
        assertTrue(executed.get(0).contains(Kind.OPEN_SESSION));
    }

    @Test
    void eventsSubmittedFromExecutorRunAfterCurrentEvent() {
        MqttConnectionController[] self = new MqttConnectionController[1];
        List<Phase> phasesSeenByExecutor = new ArrayList<>();

        self[0] = new MqttConnectionController(reducer, intents -> {
            phasesSeenByExecutor.add(self[0].currentState().phase());
            if (intents.contains(Kind.OPEN_SESSION)) {
                // A transport that acknowledges synchronously.
                self[0].submit(new SessionEvent.ConnAckReceived(0, 1, true, "CONNECTION_ACCEPTED"));
                assertEquals(1, self[0].queuedEventCount());
                assertEquals(Phase.CONNECTING, self[0].currentState().phase());
            }
        }, ConnectionState.initial(), sink);

        self[0].submit(new ClientRequestEvent.ConnectRequested(0, BROKER));

        assertEquals(Phase.CONNECTED, self[0].currentState().phase());
        assertEquals(List.of(Phase.CONNECTING, Phase.CONNECTED), phasesSeenByExecutor);
    }

    @Test
    void stopDropsLaterEvents() {
        MqttConnectionController controller =
                new MqttConnectionController(reducer, executed::add, ConnectionState.initial(), sink);

        controller.stop();
        controller.submit(new ClientRequestEvent.ConnectRequested(0, BROKER));

        assertEquals(Phase.DISCONNECTED, controller.currentState().phase());
        assertTrue(controller.peekNextEvent().isEmpty());
    }
}
