package com.questrail.relaybridge.protocol.observability;

/**
 * No-op implementation of RelayObservabilitySink.
 */
public final class NullObservabilitySink implements RelayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onChannelEvent(RelayChannelEvent event) {}

    @Override
    public void onSessionEvent(RelaySessionEvent event) {}

    @Override
    public void onError(RelayErrorEvent event) {}
}
