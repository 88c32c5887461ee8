package com.questrail.relaybridge.protocol.broker;

import com.questrail.relaybridge.protocol.transport.RelayPeer;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable membership of one channel. Confined to the broker event loop.
 */
final class RelayChannel
{
    private final String id;
    private final Instant createdAt;
    private final Set<RelayPeer> callers = new LinkedHashSet<>();

    private RelayPeer executor;
    private String executorSessionTag;

    RelayChannel(String id, Instant createdAt)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    String id()
    {
        return id;
    }

    Instant createdAt()
    {
        return createdAt;
    }

    RelayPeer executor()
    {
        return executor;
    }

    String executorSessionTag()
    {
        return executorSessionTag;
    }

    boolean hasOpenExecutor()
    {
        return executor != null && executor.isOpen();
    }

    void installExecutor(RelayPeer peer, String sessionTag)
    {
        this.executor = Objects.requireNonNull(peer, "peer");
        this.executorSessionTag = sessionTag;
    }

    void clearExecutor()
    {
        this.executor = null;
        this.executorSessionTag = null;
    }

    void addCaller(RelayPeer peer)
    {
        callers.add(peer);
    }

    boolean removeCaller(RelayPeer peer)
    {
        return callers.remove(peer);
    }

    Set<RelayPeer> callers()
    {
        return Collections.unmodifiableSet(callers);
    }

    boolean isEmpty()
    {
        return executor == null && callers.isEmpty();
    }

    ChannelSnapshot snapshot()
    {
        return new ChannelSnapshot(id, createdAt, executor != null, callers.size(), executorSessionTag);
    }
}
