package com.questrail.relaybridge.protocol.session;

import com.questrail.relaybridge.protocol.internal.time.WallClock;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded history of {@link SessionDebugEvent}s; the oldest entry is evicted
 * once capacity is reached. Written on the session executor, readable from any
 * thread.
 */
final class DebugEventLog
{
    private final int capacity;
    private final WallClock wallClock;
    private final Deque<SessionDebugEvent> events = new ArrayDeque<>();

    DebugEventLog(int capacity, WallClock wallClock)
    {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative");
        }
        this.capacity = capacity;
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    synchronized void record(String event, String detail)
    {
        if (capacity == 0) {
            return;
        }
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(new SessionDebugEvent(wallClock.now(), event, detail));
    }

    synchronized List<SessionDebugEvent> snapshot()
    {
        return List.copyOf(events);
    }
}
