package com.questrail.relaybridge.protocol.session;

import java.time.Instant;

/**
 * One entry of a session's diagnostic history, e.g.
 * {@code keepalive_ping connect#3}.
 */
public record SessionDebugEvent(
        Instant timestamp,
        String event,
        String detail
) {
}
