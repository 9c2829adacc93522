package com.questrail.pubsub.protocol.mqtt.config;

import com.questrail.pubsub.api.ClientIdentity;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimestampClientIdentityGeneratorTest {

    private static final Instant FIXED = Instant.ofEpochMilli(1_700_000_000_000L);

    @Test
    void formatsPrefixLocalIdAndMillis() {
        ClientIdentity id = new TimestampClientIdentityGenerator(() -> FIXED).generate("client");

        assertEquals("client", id.localId());
        assertEquals("MQTT_ADMIN_client_1700000000000", id.clientId());
    }

    @Test
    void idsAreDistinctWithinOneMillisecond() {
        TimestampClientIdentityGenerator generator = new TimestampClientIdentityGenerator(() -> FIXED);

        String a = generator.generate("client").clientId();
        String b = generator.generate("client").clientId();

        assertNotEquals(a, b);
        assertEquals("MQTT_ADMIN_client_1700000000001", b);
    }

    @Test
    void emptyLocalIdIsOmitted() {
        ClientIdentity id = new TimestampClientIdentityGenerator(() -> FIXED).generate("");

        assertEquals("MQTT_ADMIN_1700000000000", id.clientId());
    }
}
