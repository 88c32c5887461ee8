package com.questrail.relaybridge.protocol.model;

import java.util.Optional;

/**
 * RelayRole
 * -----------------------------------------------------------------------------
 * Role a socket declares when it joins the relay. Fixed for the lifetime of
 * the socket.
 */
public enum RelayRole
{
    /** Performs the requested work. At most one per channel. */
    EXECUTOR("executor"),

    /** Issues requests and waits for correlated responses. */
    CALLER("caller");

    private final String wireName;

    RelayRole(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Value of the {@code type} query parameter for this role.
     */
    public String wireName()
    {
        return wireName;
    }

    /**
     * Resolve the {@code type} query parameter. An absent or blank value means
     * {@link #CALLER}; an unrecognised value yields empty.
     */
    public static Optional<RelayRole> fromQuery(String type)
    {
        if (type == null || type.isBlank()) {
            return Optional.of(CALLER);
        }
        for (RelayRole role : values()) {
            if (role.wireName.equals(type)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
