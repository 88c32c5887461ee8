package com.questrail.relaybridge.protocol.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the relay stack.
 */
public record RelayErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
