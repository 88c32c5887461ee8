package com.questrail.relaybridge.protocol.observability;

import java.time.Instant;

/**
 * Broker-side channel membership and routing event.
 *
 * @param channelId channel concerned; null for connections rejected before a channel was resolved
 */
public record RelayChannelEvent(
    Instant timestamp,
    String channelId,
    Kind kind,
    String detail
) {
    public enum Kind {
        CHANNEL_CREATED,
        CHANNEL_REMOVED,
        CHANNEL_MINTED,
        EXECUTOR_JOINED,
        EXECUTOR_REPLACED,
        EXECUTOR_LEFT,
        CALLER_JOINED,
        CALLER_LEFT,
        CONNECTION_REJECTED,
        EXECUTOR_UNAVAILABLE
    }
}
