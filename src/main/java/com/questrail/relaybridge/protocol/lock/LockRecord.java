package com.questrail.relaybridge.protocol.lock;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Contents of a lock file: {@code {"pid","host","port","createdAt"}}.
 *
 * @param createdAt ISO-8601 instant the lock was taken
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LockRecord(
        long pid,
        String host,
        int port,
        String createdAt
) {
}
