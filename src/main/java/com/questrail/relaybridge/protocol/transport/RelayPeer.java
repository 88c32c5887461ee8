package com.questrail.relaybridge.protocol.transport;

/**
 * RelayPeer
 * -----------------------------------------------------------------------------
 * Broker-side view of one accepted relay socket.
 *
 * <p>All methods are non-blocking. Implementations must tolerate calls after
 * the underlying socket has gone away (they become no-ops).</p>
 */
public interface RelayPeer
{
    /**
     * Short identifier for logs.
     */
    String id();

    /**
     * {@code true} while the socket is open and can accept writes.
     */
    boolean isOpen();

    /**
     * Write one text message. Fire-and-forget: a slow peer never blocks the caller.
     */
    void send(String text);

    /**
     * Write one binary message. The payload is sent as-is.
     */
    void sendBinary(byte[] payload);

    /**
     * Close with a WebSocket close frame carrying {@code code} and {@code reason}.
     */
    void close(int code, String reason);

    /**
     * Drop the connection without a close handshake.
     */
    void terminate();
}
