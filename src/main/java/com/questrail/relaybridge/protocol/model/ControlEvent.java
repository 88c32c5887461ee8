package com.questrail.relaybridge.protocol.model;

import java.util.Optional;

/**
 * Events carried by broker-originated {@link ControlEnvelope}s.
 */
public enum ControlEvent
{
    CONNECTED("connected"),
    EXECUTOR_CONNECTED("executor_connected"),
    EXECUTOR_DISCONNECTED("executor_disconnected"),
    ERROR("error");

    private final String wireName;

    ControlEvent(String wireName)
    {
        this.wireName = wireName;
    }

    public String wireName()
    {
        return wireName;
    }

    public static Optional<ControlEvent> fromWire(String value)
    {
        for (ControlEvent event : values()) {
            if (event.wireName.equals(value)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }
}
