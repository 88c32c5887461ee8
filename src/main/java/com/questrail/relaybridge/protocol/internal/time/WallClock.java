package com.questrail.relaybridge.protocol.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for observability timestamps, channel creation times and
 * lock records. It MUST NOT drive any deadline.
 */
public interface WallClock
{
    Instant now();
}
