package com.questrail.relaybridge.protocol.transport;

/**
 * RelaySocketListener
 * -----------------------------------------------------------------------------
 * Callback sink for a {@link RelaySocket}.
 *
 * <p>Callbacks for one socket are delivered serially, in arrival order, on the
 * transport's I/O thread. Consumers that own state on another thread must hop
 * before touching it.</p>
 */
public interface RelaySocketListener
{
    /**
     * The WebSocket handshake completed.
     */
    void onOpen();

    /**
     * One complete text message arrived.
     */
    void onText(String text);

    /**
     * One complete binary message arrived.
     */
    void onBinary(byte[] payload);

    /**
     * A pong frame arrived.
     */
    void onPong();

    /**
     * The socket closed. Delivered at most once.
     *
     * @param code   close code received from the peer, or 1006 when none was received
     * @param reason close reason; may be empty
     */
    void onClose(int code, String reason);

    /**
     * A transport error occurred. {@link #onClose(int, String)} normally follows.
     */
    void onError(Throwable cause);
}
