package com.questrail.relaybridge.protocol.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Caller-to-executor application request {@code {"id","type","payload"?}}.
 *
 * @param id        correlation id; null or blank lets the caller session assign one
 * @param type      operation name, opaque to the relay
 * @param payload   operation arguments, may be null
 * @param sessionId session tag, may be null
 */
public record RequestEnvelope(
        String id,
        String type,
        JsonNode payload,
        String sessionId
) implements RelayEnvelope
{
    public RequestEnvelope {
        Objects.requireNonNull(type, "type");
    }

    public static RequestEnvelope of(String id, String type, JsonNode payload)
    {
        return new RequestEnvelope(id, type, payload, null);
    }

    public boolean hasId()
    {
        return id != null && !id.isBlank();
    }

    public RequestEnvelope withId(String newId)
    {
        return new RequestEnvelope(newId, type, payload, sessionId);
    }

    @Override
    public Optional<String> sessionTag()
    {
        return Optional.ofNullable(sessionId).filter(s -> !s.isEmpty());
    }
}
