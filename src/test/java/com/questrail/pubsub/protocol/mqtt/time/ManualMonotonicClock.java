package com.questrail.pubsub.protocol.mqtt.time;

import com.questrail.pubsub.protocol.mqtt.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock that moves only when a test (or the
 * {@link DeterministicScheduler} stepping through timer deadlines) moves it.
 * Starts at zero, so connection timestamps read as milliseconds since the
 * test began.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong(0);

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    /**
     * Elapsed test time in milliseconds, for asserting timer firing points.
     */
    public long nowMillis() {
        return Duration.ofNanos(nowNanos.get()).toMillis();
    }

    /**
     * Moves the clock forward to {@code deadlineNanos}. A deadline already
     * passed leaves the clock where it is.
     */
    public void advanceTo(long deadlineNanos) {
        nowNanos.accumulateAndGet(deadlineNanos, Math::max);
    }
}
