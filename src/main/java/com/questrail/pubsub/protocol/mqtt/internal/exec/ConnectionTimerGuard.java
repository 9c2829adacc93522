package com.questrail.pubsub.protocol.mqtt.internal.exec;

import com.questrail.pubsub.protocol.mqtt.internal.events.ConnectionEvent;
import com.questrail.pubsub.protocol.mqtt.internal.events.TimerEvent;
import com.questrail.pubsub.protocol.mqtt.internal.time.Cancellable;
import com.questrail.pubsub.protocol.mqtt.internal.time.MonotonicClock;
import com.questrail.pubsub.protocol.mqtt.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * ConnectionTimerGuard
 * =============================================================================
 * Owner of every timer a client runs: the handshake timeout, the repeating
 * heartbeat and the reconnect backoff.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>At most one handshake timer; arming while armed is a no-op.</li>
 *   <li>At most one heartbeat timer; starting replaces the previous one.</li>
 *   <li>Handshake and heartbeat are mutually exclusive: arming one cancels
 *       the other.</li>
 *   <li>At most one reconnect timer.</li>
 *   <li>A cancelled timer never injects its event, even if the scheduler had
 *       already started running it.</li>
 * </ul>
 *
 * The last guarantee uses sequence numbers: every arm takes a fresh sequence
 * and every cancel invalidates it, so a stale task finds a mismatch and
 * returns without effect.
 *
 * <h2>Threading</h2>
 * Arm and cancel calls come from the event loop; expirations run on the
 * scheduler's thread. All bookkeeping is guarded by this object's monitor.
 * Events are handed to the sink outside the monitor.
 */
public final class ConnectionTimerGuard
{
    private static final long NONE = 0L;

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Consumer<ConnectionEvent> eventSink;

    private long sequence = NONE;

    private long handshakeSeq = NONE;
    private Cancellable handshakeTimer;

    private long heartbeatSeq = NONE;
    private Cancellable heartbeatTimer;

    private long reconnectSeq = NONE;
    private Cancellable reconnectTimer;

    public ConnectionTimerGuard(MonotonicClock clock,
                                MonotonicScheduler scheduler,
                                Consumer<ConnectionEvent> eventSink)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
    }

    // ---------------------------------------------------------------------
    // Handshake
    // ---------------------------------------------------------------------

    /**
     * Arms the handshake timer for {@code generation} and stops the heartbeat.
     *
     * @return {@code false} if a handshake timer was already armed
     */
    public synchronized boolean armHandshake(long generation, boolean reconnectPhase, Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (handshakeSeq != NONE) {
            return false;
        }
        stopHeartbeat();

        long seq = ++sequence;
        handshakeSeq = seq;
        handshakeTimer = scheduler.scheduleAfter(timeout, clock,
                () -> onHandshakeExpired(seq, generation, reconnectPhase));
        return true;
    }

    public synchronized void cancelHandshake()
    {
        handshakeSeq = NONE;
        if (handshakeTimer != null) {
            handshakeTimer.cancel();
            handshakeTimer = null;
        }
    }

    public synchronized boolean isHandshakeArmed()
    {
        return handshakeSeq != NONE;
    }

    private void onHandshakeExpired(long seq, long generation, boolean reconnectPhase)
    {
        synchronized (this) {
            if (seq != handshakeSeq) {
                return;
            }
            handshakeSeq = NONE;
            handshakeTimer = null;
        }
        eventSink.accept(new TimerEvent.HandshakeTimeout(clock.nowNanos(), generation, reconnectPhase));
    }

    // ---------------------------------------------------------------------
    // Heartbeat
    // ---------------------------------------------------------------------

    /**
     * Starts a fixed-rate heartbeat for {@code generation} and cancels the handshake timer.
     */
    public synchronized void startHeartbeat(long generation, Duration interval)
    {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        cancelHandshake();
        stopHeartbeat();

        long seq = ++sequence;
        heartbeatSeq = seq;
        scheduleTick(seq, generation, clock.nowNanos() + interval.toNanos(), interval.toNanos());
    }

    public synchronized void stopHeartbeat()
    {
        heartbeatSeq = NONE;
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel();
            heartbeatTimer = null;
        }
    }

    public synchronized boolean isHeartbeatActive()
    {
        return heartbeatSeq != NONE;
    }

    private void scheduleTick(long seq, long generation, long deadlineNanos, long intervalNanos)
    {
        heartbeatTimer = scheduler.scheduleAtNanos(deadlineNanos,
                () -> onHeartbeatTick(seq, generation, deadlineNanos, intervalNanos));
    }

    private void onHeartbeatTick(long seq, long generation, long deadlineNanos, long intervalNanos)
    {
        synchronized (this) {
            if (seq != heartbeatSeq) {
                return;
            }
            scheduleTick(seq, generation, deadlineNanos + intervalNanos, intervalNanos);
        }
        eventSink.accept(new TimerEvent.HeartbeatTick(clock.nowNanos(), generation));
    }

    // ---------------------------------------------------------------------
    // Reconnect
    // ---------------------------------------------------------------------

    /**
     * Schedules a reconnect after {@code delay}, replacing any pending one.
     */
    public synchronized void scheduleReconnect(Duration delay)
    {
        Objects.requireNonNull(delay, "delay");
        cancelReconnect();

        long seq = ++sequence;
        reconnectSeq = seq;
        reconnectTimer = scheduler.scheduleAfter(delay, clock, () -> onReconnectDue(seq));
    }

    public synchronized void cancelReconnect()
    {
        reconnectSeq = NONE;
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    public synchronized boolean isReconnectScheduled()
    {
        return reconnectSeq != NONE;
    }

    private void onReconnectDue(long seq)
    {
        synchronized (this) {
            if (seq != reconnectSeq) {
                return;
            }
            reconnectSeq = NONE;
            reconnectTimer = null;
        }
        eventSink.accept(new TimerEvent.ReconnectDue(clock.nowNanos()));
    }

    /**
     * Cancels every timer.
     */
    public synchronized void cancelAll()
    {
        cancelHandshake();
        stopHeartbeat();
        cancelReconnect();
    }
}
