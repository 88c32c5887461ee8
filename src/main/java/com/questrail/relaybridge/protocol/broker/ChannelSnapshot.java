package com.questrail.relaybridge.protocol.broker;

import java.time.Instant;

/**
 * Read-only view of a channel at one instant.
 */
public record ChannelSnapshot(
        String channelId,
        Instant createdAt,
        boolean executorPresent,
        int callerCount,
        String executorSessionTag
) {
}
