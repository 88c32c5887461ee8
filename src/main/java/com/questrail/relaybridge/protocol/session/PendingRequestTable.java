package com.questrail.relaybridge.protocol.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.relaybridge.protocol.internal.time.Cancellable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PendingRequestTable
 * =============================================================================
 * In-flight requests of one caller session, keyed by correlation id.
 *
 * <h2>Ownership</h2>
 * Mutated only on the session executor. The backing map is concurrent so that
 * {@link #size()} and {@link #contains(String)} may be read from other threads
 * for status reporting.
 *
 * <h2>Invariant</h2>
 * An entry leaves the table exactly once: on its response, its deadline, a
 * write failure or a bulk rejection. Whoever removes it settles its future.
 */
final class PendingRequestTable
{
    /**
     * One in-flight request.
     */
    static final class Entry
    {
        private final String id;
        private final String channelId;
        private final CompletableFuture<JsonNode> future;
        private final long sentAtNanos;
        private Cancellable deadline;

        private Entry(String id, String channelId, CompletableFuture<JsonNode> future, long sentAtNanos)
        {
            this.id = id;
            this.channelId = channelId;
            this.future = future;
            this.sentAtNanos = sentAtNanos;
        }

        String id()
        {
            return id;
        }

        /**
         * Channel the request was written to.
         */
        String channelId()
        {
            return channelId;
        }

        CompletableFuture<JsonNode> future()
        {
            return future;
        }

        long sentAtNanos()
        {
            return sentAtNanos;
        }

        void armDeadline(Cancellable deadline)
        {
            this.deadline = deadline;
        }

        void cancelDeadline()
        {
            Cancellable d = deadline;
            if (d != null) {
                d.cancel();
            }
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    Entry register(String id, String channelId, CompletableFuture<JsonNode> future, long sentAtNanos)
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(future, "future");

        Entry entry = new Entry(id, channelId, future, sentAtNanos);
        if (entries.putIfAbsent(id, entry) != null) {
            throw new IllegalStateException("Request id already pending: " + id);
        }
        return entry;
    }

    /**
     * Remove the entry for {@code id}, if any, and cancel its deadline.
     */
    Entry remove(String id)
    {
        Entry entry = entries.remove(id);
        if (entry != null) {
            entry.cancelDeadline();
        }
        return entry;
    }

    /**
     * Remove {@code entry} only if it is still the one registered under its id.
     */
    boolean remove(Entry entry)
    {
        if (entries.remove(entry.id(), entry)) {
            entry.cancelDeadline();
            return true;
        }
        return false;
    }

    /**
     * Remove every entry, cancelling deadlines, and return them for rejection.
     */
    List<Entry> drain()
    {
        List<Entry> drained = new ArrayList<>(entries.values());
        for (Entry entry : drained) {
            entries.remove(entry.id(), entry);
            entry.cancelDeadline();
        }
        return drained;
    }

    boolean contains(String id)
    {
        return entries.containsKey(id);
    }

    int size()
    {
        return entries.size();
    }
}
