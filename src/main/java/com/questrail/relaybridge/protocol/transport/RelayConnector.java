package com.questrail.relaybridge.protocol.transport;

import java.net.URI;

/**
 * Opens outbound relay sockets.
 */
public interface RelayConnector
{
    /**
     * Begin connecting to {@code uri}. Returns immediately; the outcome is
     * reported to {@code listener} ({@code onOpen}, or {@code onError} followed
     * by {@code onClose}).
     */
    RelaySocket open(URI uri, RelaySocketListener listener);
}
