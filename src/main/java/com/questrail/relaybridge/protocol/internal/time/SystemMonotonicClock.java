package com.questrail.relaybridge.protocol.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 * For deterministic tests use {@code ManualMonotonicClock} instead.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
