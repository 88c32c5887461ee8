package com.questrail.relaybridge.protocol.broker;

import java.util.Objects;

/**
 * Admission parameters taken from a connection's request URI.
 *
 * @param path    request path, compared verbatim against the mount path
 * @param type    {@code type} query parameter; may be null
 * @param channel {@code channel} query parameter; may be null
 * @param session {@code session} query parameter (executor session tag); may be null
 */
public record ConnectionRequest(
        String path,
        String type,
        String channel,
        String session
) {
    public ConnectionRequest {
        Objects.requireNonNull(path, "path");
    }

    public static ConnectionRequest executor(String path, String channel, String session) {
        return new ConnectionRequest(path, "executor", channel, session);
    }

    public static ConnectionRequest caller(String path, String channel) {
        return new ConnectionRequest(path, "caller", channel, null);
    }
}
