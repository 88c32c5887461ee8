package com.questrail.relaybridge.protocol.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * One-shot timers for the caller session: the connect window, per-request
 * deadlines, and the keepalive ping and deadline. Periodic work re-arms
 * itself from its own callback.
 *
 * <p>Deadlines are monotonic ticks, never {@code Instant}s, so a wall-clock
 * jump cannot expire or extend an in-flight request.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} once, no earlier than {@code deadlineNanos} on the
     * scheduler's clock.
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once after {@code delay} has elapsed on {@code clock}.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Timer delay must not be negative: " + delay);
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
