package com.questrail.relaybridge.protocol.observability;

/**
 * Receives relay observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface RelayObservabilitySink {
    /**
     * Called when broker channel membership changes or routing fails.
     * Invoked on the broker event loop.
     */
    void onChannelEvent(RelayChannelEvent event);

    /**
     * Called when a caller session changes connection state.
     * Invoked on the session executor.
     */
    void onSessionEvent(RelaySessionEvent event);

    /**
     * Called when an error or anomaly occurs.
     */
    void onError(RelayErrorEvent event);
}
