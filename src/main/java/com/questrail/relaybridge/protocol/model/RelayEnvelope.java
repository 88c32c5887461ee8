package com.questrail.relaybridge.protocol.model;

import java.util.Optional;

/**
 * RelayEnvelope
 * =============================================================================
 * Unit exchanged over a relay socket once it has joined a channel.
 *
 * <p>{@link ControlEnvelope}s are produced by the broker and never forwarded.
 * {@link RequestEnvelope}s and {@link ResponseEnvelope}s are application
 * envelopes: the broker relays their text verbatim and only the caller
 * session and the executor interpret them.</p>
 *
 * <p>Every envelope may carry the executor's session tag; see
 * {@code SessionTagFilter}.</p>
 */
public sealed interface RelayEnvelope
        permits ControlEnvelope, RequestEnvelope, ResponseEnvelope
{
    /**
     * Executor session tag, if the sender attached one.
     */
    Optional<String> sessionTag();
}
