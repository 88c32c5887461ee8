package com.questrail.relaybridge.protocol.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every relay deadline.
 *
 * <h2>Binding invariant</h2>
 * Request timeouts, the connect window and the keepalive deadline MUST be
 * computed from a monotonic source. Wall-clock time ({@code Instant.now()}) is
 * permitted only for diagnostics and log timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();

    /**
     * Elapsed milliseconds since an earlier tick of this clock.
     */
    default long millisSince(long startNanos)
    {
        return (nowNanos() - startNanos) / 1_000_000L;
    }
}
