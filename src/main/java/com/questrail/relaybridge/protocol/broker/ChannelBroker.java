package com.questrail.relaybridge.protocol.broker;

import com.questrail.relaybridge.protocol.codec.RelayEnvelopeCodec;
import com.questrail.relaybridge.protocol.config.RelayBrokerConfig;
import com.questrail.relaybridge.protocol.internal.time.WallClock;
import com.questrail.relaybridge.protocol.model.ControlEnvelope;
import com.questrail.relaybridge.protocol.model.RelayCloseCodes;
import com.questrail.relaybridge.protocol.model.RelayRole;
import com.questrail.relaybridge.protocol.observability.RelayChannelEvent;
import com.questrail.relaybridge.protocol.observability.RelayObservabilitySink;
import com.questrail.relaybridge.protocol.transport.RelayPeer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * ChannelBroker
 * =============================================================================
 * Transport-neutral relay core: groups peers into channels and forwards text
 * between a channel's single executor and its callers.
 *
 * <h2>Execution model</h2>
 * Not thread-safe. Every call must come from one execution context (the
 * Netty server runs all child channels on a single event loop). Under that
 * model the channel table needs no locks.
 *
 * <h2>Admission</h2>
 * <pre>
 *   wrong path                 → close 4004
 *   unknown type               → close 4002
 *   executor, no channel       → mint [A-Z0-9]{8}
 *   caller, no channel         → close 4000
 * </pre>
 *
 * <h2>Forwarding</h2>
 * <ul>
 *   <li>executor text → every open caller, verbatim, no buffering</li>
 *   <li>caller text → the open executor, verbatim; otherwise an {@code error}
 *       control envelope goes back to the sender</li>
 *   <li>binary messages follow the same routes and stay binary</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>At most one executor per channel. A new executor displaces the old
 *       one, which is closed before the new one is installed.</li>
 *   <li>A channel with no executor and no callers does not exist.</li>
 *   <li>Disconnect bookkeeping is idempotent and ignores displaced executors.</li>
 * </ul>
 */
public final class ChannelBroker
{
    private static final int MAX_MINT_ATTEMPTS = 32;

    private record Membership(RelayRole role, String channelId) {}

    private final String mountPath;
    private final ChannelIdGenerator idGenerator;
    private final RelayEnvelopeCodec codec;
    private final RelayObservabilitySink sink;
    private final WallClock wallClock;

    private final Map<String, RelayChannel> channels = new HashMap<>();
    private final Map<RelayPeer, Membership> memberships = new IdentityHashMap<>();

    public ChannelBroker(String mountPath,
                         ChannelIdGenerator idGenerator,
                         RelayEnvelopeCodec codec,
                         RelayObservabilitySink sink,
                         WallClock wallClock)
    {
        this.mountPath = RelayBrokerConfig.normalizePath(mountPath);
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public String mountPath()
    {
        return mountPath;
    }

    /**
     * Validate a freshly opened connection and, if valid, join it to its channel.
     *
     * @return {@code true} if admitted; {@code false} if the peer was closed
     */
    public boolean admit(RelayPeer peer, ConnectionRequest request)
    {
        Objects.requireNonNull(peer, "peer");
        Objects.requireNonNull(request, "request");

        if (!mountPath.equals(request.path())) {
            reject(peer, RelayCloseCodes.INVALID_PATH, "Invalid relay path. Expected: " + mountPath);
            return false;
        }

        Optional<RelayRole> role = RelayRole.fromQuery(request.type());
        if (role.isEmpty()) {
            reject(peer, RelayCloseCodes.UNKNOWN_CONNECTION_TYPE, "Unknown connection type: " + request.type());
            return false;
        }

        String channelId = blankToNull(request.channel());
        if (channelId == null && role.get() == RelayRole.EXECUTOR) {
            channelId = mintChannelId();
            emit(channelId, RelayChannelEvent.Kind.CHANNEL_MINTED, "for executor " + peer.id());
        }
        if (channelId == null) {
            reject(peer, RelayCloseCodes.CHANNEL_REQUIRED, "Channel ID required");
            return false;
        }

        RelayChannel channel = channels.get(channelId);
        if (channel == null) {
            channel = new RelayChannel(channelId, wallClock.now());
            channels.put(channelId, channel);
            emit(channelId, RelayChannelEvent.Kind.CHANNEL_CREATED, "");
        }

        memberships.put(peer, new Membership(role.get(), channelId));

        if (role.get() == RelayRole.EXECUTOR) {
            joinExecutor(channel, peer, blankToNull(request.session()));
        }
        else {
            joinCaller(channel, peer);
        }
        return true;
    }

    /**
     * Relay one text message from an admitted peer.
     */
    public void onMessage(RelayPeer peer, String text)
    {
        Objects.requireNonNull(text, "text");
        relay(peer, target -> target.send(text));
    }

    /**
     * Relay one binary message from an admitted peer without decoding it.
     */
    public void onBinary(RelayPeer peer, byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        relay(peer, target -> target.sendBinary(payload));
    }

    private void relay(RelayPeer peer, Consumer<RelayPeer> forward)
    {
        Objects.requireNonNull(peer, "peer");

        Membership membership = memberships.get(peer);
        if (membership == null) {
            // Displaced executor or a peer that never got admitted.
            return;
        }
        RelayChannel channel = channels.get(membership.channelId());
        if (channel == null) {
            return;
        }

        if (membership.role() == RelayRole.EXECUTOR) {
            if (channel.executor() != peer) {
                return;
            }
            forEachOpenCaller(channel, forward);
            return;
        }

        if (channel.hasOpenExecutor()) {
            forward.accept(channel.executor());
        }
        else {
            peer.send(codec.encode(ControlEnvelope.error(channel.id(), "Executor not connected")));
            emit(channel.id(), RelayChannelEvent.Kind.EXECUTOR_UNAVAILABLE, "caller " + peer.id());
        }
    }

    /**
     * Release a peer's membership after close or socket error.
     * Safe to call more than once.
     */
    public void onDisconnect(RelayPeer peer)
    {
        Objects.requireNonNull(peer, "peer");

        Membership membership = memberships.remove(peer);
        if (membership == null) {
            return;
        }
        RelayChannel channel = channels.get(membership.channelId());
        if (channel == null) {
            return;
        }

        if (membership.role() == RelayRole.EXECUTOR) {
            if (channel.executor() == peer) {
                String tag = channel.executorSessionTag();
                channel.clearExecutor();
                emit(channel.id(), RelayChannelEvent.Kind.EXECUTOR_LEFT, peer.id());
                broadcastToCallers(channel, codec.encode(ControlEnvelope.executorDisconnected(channel.id(), tag)));
            }
        }
        else if (channel.removeCaller(peer)) {
            emit(channel.id(), RelayChannelEvent.Kind.CALLER_LEFT, peer.id());
        }

        removeIfEmpty(channel);
    }

    public Optional<ChannelSnapshot> snapshot(String channelId)
    {
        RelayChannel channel = channels.get(channelId);
        return channel == null ? Optional.empty() : Optional.of(channel.snapshot());
    }

    public int channelCount()
    {
        return channels.size();
    }

    /**
     * Drop every peer without a close handshake and forget all channels.
     */
    public void shutdown()
    {
        List<RelayPeer> peers = new ArrayList<>(memberships.keySet());
        memberships.clear();
        channels.clear();
        for (RelayPeer peer : peers) {
            peer.terminate();
        }
    }

    // -------------------------------------------------------------------------
    // Membership
    // -------------------------------------------------------------------------

    private void joinExecutor(RelayChannel channel, RelayPeer peer, String sessionTag)
    {
        RelayPeer previous = channel.executor();
        if (previous != null && previous != peer) {
            // Forget the old executor before closing it so its close event is a no-op.
            memberships.remove(previous);
            channel.clearExecutor();
            emit(channel.id(), RelayChannelEvent.Kind.EXECUTOR_REPLACED, previous.id() + " -> " + peer.id());
            previous.close(RelayCloseCodes.NORMAL, "Executor replaced");
        }
        channel.installExecutor(peer, sessionTag);
        emit(channel.id(), RelayChannelEvent.Kind.EXECUTOR_JOINED, peer.id());

        peer.send(codec.encode(ControlEnvelope.executorWelcome(channel.id(), sessionTag)));
        broadcastToCallers(channel, codec.encode(ControlEnvelope.executorConnected(channel.id(), sessionTag)));
    }

    private void joinCaller(RelayChannel channel, RelayPeer peer)
    {
        channel.addCaller(peer);
        emit(channel.id(), RelayChannelEvent.Kind.CALLER_JOINED, peer.id());

        peer.send(codec.encode(ControlEnvelope.callerWelcome(
                channel.id(), channel.hasOpenExecutor(), channel.executorSessionTag())));
    }

    private void broadcastToCallers(RelayChannel channel, String text)
    {
        forEachOpenCaller(channel, caller -> caller.send(text));
    }

    private static void forEachOpenCaller(RelayChannel channel, Consumer<RelayPeer> action)
    {
        for (RelayPeer caller : List.copyOf(channel.callers())) {
            if (caller.isOpen()) {
                action.accept(caller);
            }
        }
    }

    private void removeIfEmpty(RelayChannel channel)
    {
        if (channel.isEmpty() && channels.get(channel.id()) == channel) {
            channels.remove(channel.id());
            emit(channel.id(), RelayChannelEvent.Kind.CHANNEL_REMOVED, "");
        }
    }

    private String mintChannelId()
    {
        for (int attempt = 0; attempt < MAX_MINT_ATTEMPTS; attempt++) {
            String candidate = idGenerator.next();
            if (!channels.containsKey(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not mint an unused channel id");
    }

    private void reject(RelayPeer peer, int code, String reason)
    {
        emit(null, RelayChannelEvent.Kind.CONNECTION_REJECTED, code + " " + reason);
        peer.close(code, reason);
    }

    private void emit(String channelId, RelayChannelEvent.Kind kind, String detail)
    {
        sink.onChannelEvent(new RelayChannelEvent(wallClock.now(), channelId, kind, detail));
    }

    private static String blankToNull(String value)
    {
        return value == null || value.isBlank() ? null : value;
    }
}
