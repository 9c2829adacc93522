package com.questrail.pubsub.protocol.mqtt.internal.state;

import java.time.Duration;
import java.util.Objects;

/**
 * ReconnectBackoff
 * -----------------------------------------------------------------------------
 * Capped exponential backoff for reconnect scheduling.
 *
 * <pre>
 *   nextDelay(ZERO)     = initialDelay
 *   nextDelay(previous) = min(previous * 2, maxDelay)
 * </pre>
 *
 * After {@code k} consecutive failures the scheduled delay is
 * {@code min(initialDelay * 2^(k-1), maxDelay)}.
 */
public final class ReconnectBackoff
{
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final BackoffResetPolicy resetPolicy;

    public ReconnectBackoff(Duration initialDelay, Duration maxDelay, BackoffResetPolicy resetPolicy)
    {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        this.resetPolicy = Objects.requireNonNull(resetPolicy, "resetPolicy");

        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be > 0");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
    }

    /**
     * Returns the delay to wait before the next reconnect attempt.
     *
     * @param previous the previously scheduled delay, or {@link Duration#ZERO} if none
     */
    public Duration nextDelay(Duration previous)
    {
        Objects.requireNonNull(previous, "previous");
        if (previous.isZero() || previous.isNegative()) {
            return initialDelay;
        }
        if (previous.compareTo(maxDelay.dividedBy(2)) > 0) {
            return maxDelay;
        }
        Duration doubled = previous.multipliedBy(2);
        return doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
    }

    /**
     * Returns the delay to carry forward after a successful handshake.
     */
    public Duration afterSuccess(Duration current)
    {
        Objects.requireNonNull(current, "current");
        return resetPolicy == BackoffResetPolicy.RESET_ON_SUCCESS ? Duration.ZERO : current;
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public BackoffResetPolicy resetPolicy() {
        return resetPolicy;
    }
}
