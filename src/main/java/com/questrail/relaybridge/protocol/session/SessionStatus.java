package com.questrail.relaybridge.protocol.session;

import java.net.URI;

/**
 * Point-in-time view of a {@link CallerSession}.
 *
 * @param connectedToRelay whether the relay socket is open
 * @param executorPresent  whether the channel currently has an executor
 * @param channelId        channel of the latest connect, or null
 * @param relayAddress     relay address of the latest connect, or null
 * @param pendingRequests  in-flight requests awaiting a response
 * @param sessionTag       executor session tag recorded from control envelopes, or null
 * @param connectAttempt   number of {@code connect} calls made so far
 */
public record SessionStatus(
        boolean connectedToRelay,
        boolean executorPresent,
        String channelId,
        URI relayAddress,
        int pendingRequests,
        String sessionTag,
        long connectAttempt
) {
}
