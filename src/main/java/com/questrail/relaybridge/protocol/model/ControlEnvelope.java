package com.questrail.relaybridge.protocol.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Broker-to-peer status message:
 * {@code {"kind":"system","event":...,"channel":...,"figmaExecutorPresent"?,"error"?,"sessionId"?}}.
 *
 * @param event           control event
 * @param channel         channel id; may be null on {@code error} envelopes
 * @param executorPresent executor presence; null when the envelope has no opinion
 * @param error           human-readable error for {@link ControlEvent#ERROR}
 * @param sessionId       executor session tag known to the broker, or null
 */
public record ControlEnvelope(
        ControlEvent event,
        String channel,
        Boolean executorPresent,
        String error,
        String sessionId
) implements RelayEnvelope
{
    public ControlEnvelope {
        Objects.requireNonNull(event, "event");
    }

    /** Reply to an executor that has joined {@code channel}. */
    public static ControlEnvelope executorWelcome(String channel, String sessionId)
    {
        return new ControlEnvelope(ControlEvent.CONNECTED, channel, null, null, sessionId);
    }

    /** Reply to a caller that has joined {@code channel}. */
    public static ControlEnvelope callerWelcome(String channel, boolean executorPresent, String sessionId)
    {
        return new ControlEnvelope(ControlEvent.CONNECTED, channel, executorPresent, null, sessionId);
    }

    public static ControlEnvelope executorConnected(String channel, String sessionId)
    {
        return new ControlEnvelope(ControlEvent.EXECUTOR_CONNECTED, channel, null, null, sessionId);
    }

    public static ControlEnvelope executorDisconnected(String channel, String sessionId)
    {
        return new ControlEnvelope(ControlEvent.EXECUTOR_DISCONNECTED, channel, null, null, sessionId);
    }

    public static ControlEnvelope error(String channel, String error)
    {
        return new ControlEnvelope(ControlEvent.ERROR, channel, null, error, null);
    }

    @Override
    public Optional<String> sessionTag()
    {
        return Optional.ofNullable(sessionId).filter(s -> !s.isEmpty());
    }
}
