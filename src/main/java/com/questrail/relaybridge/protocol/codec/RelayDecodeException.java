package com.questrail.relaybridge.protocol.codec;

/**
 * Indicates that text received on a relay socket could not be translated into
 * a {@link com.questrail.relaybridge.protocol.model.RelayEnvelope}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Text that is not JSON, or not a JSON object</li>
 *   <li>A {@code system} envelope with an unknown event</li>
 *   <li>Fields of the wrong JSON type</li>
 * </ul>
 */
public final class RelayDecodeException extends RuntimeException
{
    public RelayDecodeException(String message) {
        super(message);
    }

    public RelayDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
