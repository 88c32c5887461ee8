package com.questrail.relaybridge.protocol.observability;

import java.time.Instant;

/**
 * Caller-session lifecycle event.
 *
 * @param connectAttempt sequence number of the {@code connect} call the event belongs to
 */
public record RelaySessionEvent(
    Instant timestamp,
    String channelId,
    long connectAttempt,
    Kind kind,
    String detail
) {
    public enum Kind {
        CONNECTING,
        SOCKET_OPEN,
        EXECUTOR_PRESENT,
        EXECUTOR_ABSENT,
        RELAY_ERROR,
        KEEPALIVE_TIMEOUT,
        SOCKET_CLOSED,
        SOCKET_ERROR,
        STALE_ENVELOPE_DROPPED,
        REQUEST_TIMED_OUT,
        SESSION_CLOSED
    }
}
