package com.questrail.relaybridge.protocol.session;

import com.questrail.relaybridge.protocol.model.RelayRole;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds relay socket URIs carrying the admission query parameters
 * ({@code type}, {@code channel}, {@code session}).
 */
public final class RelayUris
{
    private RelayUris() {
    }

    public static URI forCaller(URI relayAddress, String channelId)
    {
        Objects.requireNonNull(channelId, "channelId");
        return withQuery(relayAddress, RelayRole.CALLER, channelId, null);
    }

    /**
     * @param channelId  may be null to let the broker mint one
     * @param sessionTag may be null when the executor does not tag its session
     */
    public static URI forExecutor(URI relayAddress, String channelId, String sessionTag)
    {
        return withQuery(relayAddress, RelayRole.EXECUTOR, channelId, sessionTag);
    }

    private static URI withQuery(URI relayAddress, RelayRole role, String channelId, String sessionTag)
    {
        Objects.requireNonNull(relayAddress, "relayAddress");

        StringBuilder query = new StringBuilder("type=").append(role.wireName());
        if (channelId != null && !channelId.isBlank()) {
            query.append("&channel=").append(encode(channelId));
        }
        if (sessionTag != null && !sessionTag.isBlank()) {
            query.append("&session=").append(encode(sessionTag));
        }

        String base = relayAddress.toString();
        int fragment = base.indexOf('#');
        if (fragment >= 0) {
            base = base.substring(0, fragment);
        }
        String separator = relayAddress.getRawQuery() == null ? "?" : "&";
        return URI.create(base + separator + query);
    }

    private static String encode(String value)
    {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
