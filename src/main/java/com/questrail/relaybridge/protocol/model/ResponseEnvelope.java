package com.questrail.relaybridge.protocol.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Executor-to-caller application response {@code {"id","result"?,"error"?}}.
 *
 * <p>{@code id} may be null for executor-originated traffic that answers no
 * request; the caller session drops such envelopes.</p>
 */
public record ResponseEnvelope(
        String id,
        JsonNode result,
        String error,
        String sessionId
) implements RelayEnvelope
{
    public static ResponseEnvelope success(String id, JsonNode result)
    {
        return new ResponseEnvelope(id, result, null, null);
    }

    public static ResponseEnvelope failure(String id, String error)
    {
        return new ResponseEnvelope(id, null, error, null);
    }

    public boolean isError()
    {
        return error != null;
    }

    @Override
    public Optional<String> sessionTag()
    {
        return Optional.ofNullable(sessionId).filter(s -> !s.isEmpty());
    }
}
