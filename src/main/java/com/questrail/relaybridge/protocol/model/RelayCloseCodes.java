package com.questrail.relaybridge.protocol.model;

/**
 * WebSocket close codes used by the broker.
 */
public final class RelayCloseCodes
{
    public static final int NORMAL = 1000;
    public static final int ABNORMAL = 1006;
    public static final int SETUP_FAILED = 1011;

    public static final int CHANNEL_REQUIRED = 4000;
    public static final int UNKNOWN_CONNECTION_TYPE = 4002;
    public static final int INVALID_PATH = 4004;

    private RelayCloseCodes() {}
}
