package com.questrail.relaybridge.protocol.transport;

import java.util.concurrent.CompletableFuture;

/**
 * RelaySocket
 * -----------------------------------------------------------------------------
 * Client-side handle for one outbound relay connection, created by a
 * {@link RelayConnector}. Lifecycle and inbound traffic are reported to the
 * {@link RelaySocketListener} supplied at open time.
 */
public interface RelaySocket
{
    boolean isOpen();

    /**
     * Write one text message.
     *
     * @return completes when the write is flushed; completes exceptionally with
     *         the write error otherwise
     */
    CompletableFuture<Void> send(String text);

    /**
     * Write one binary message, byte for byte.
     */
    CompletableFuture<Void> sendBinary(byte[] payload);

    /**
     * Send a WebSocket ping. Pongs arrive via {@link RelaySocketListener#onPong()}.
     */
    void ping();

    /**
     * Graceful close (close frame, then socket close).
     */
    void close();

    /**
     * Abrupt close with no close handshake.
     */
    void terminate();
}
