package com.questrail.pubsub.protocol.mqtt.config;

import com.questrail.pubsub.api.ClientIdentity;
import com.questrail.pubsub.protocol.mqtt.internal.time.SystemWallClock;
import com.questrail.pubsub.protocol.mqtt.internal.time.WallClock;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default {@link ClientIdentityGenerator}: {@code MQTT_ADMIN_<localId>_<millis>}.
 *
 * <p>The millisecond component is strictly increasing per generator, so two
 * clients created in the same millisecond still get distinct ids.</p>
 */
public final class TimestampClientIdentityGenerator implements ClientIdentityGenerator
{
    public static final String PREFIX = "MQTT_ADMIN_";

    private final WallClock wallClock;
    private final AtomicLong lastMillis = new AtomicLong(Long.MIN_VALUE);

    public TimestampClientIdentityGenerator()
    {
        this(SystemWallClock.INSTANCE);
    }

    public TimestampClientIdentityGenerator(WallClock wallClock)
    {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public ClientIdentity generate(String localId)
    {
        Objects.requireNonNull(localId, "localId");
        long now = wallClock.now().toEpochMilli();
        long millis = lastMillis.updateAndGet(prev -> Math.max(now, prev + 1));

        String clientId = localId.isEmpty()
                ? PREFIX + millis
                : PREFIX + localId + "_" + millis;
        return new ClientIdentity(localId, clientId);
    }
}
