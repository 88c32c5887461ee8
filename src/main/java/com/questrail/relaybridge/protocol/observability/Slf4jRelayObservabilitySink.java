package com.questrail.relaybridge.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RelayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRelayObservabilitySink implements RelayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRelayObservabilitySink.class);

    @Override
    public void onChannelEvent(RelayChannelEvent event) {
        switch (event.kind()) {
            case CHANNEL_CREATED, CHANNEL_REMOVED, CALLER_LEFT ->
                log.debug("[{}] {} {}", event.channelId(), event.kind(), event.detail());
            case EXECUTOR_REPLACED, EXECUTOR_LEFT, CONNECTION_REJECTED ->
                log.warn("[{}] {} {}", event.channelId(), event.kind(), event.detail());
            default ->
                log.info("[{}] {} {}", event.channelId(), event.kind(), event.detail());
        }
    }

    @Override
    public void onSessionEvent(RelaySessionEvent event) {
        switch (event.kind()) {
            case STALE_ENVELOPE_DROPPED ->
                log.debug("[connect#{}] [{}] {} {}", event.connectAttempt(), event.channelId(), event.kind(), event.detail());
            case KEEPALIVE_TIMEOUT, SOCKET_CLOSED, SOCKET_ERROR, EXECUTOR_ABSENT, RELAY_ERROR, REQUEST_TIMED_OUT ->
                log.warn("[connect#{}] [{}] {} {}", event.connectAttempt(), event.channelId(), event.kind(), event.detail());
            default ->
                log.info("[connect#{}] [{}] {} {}", event.connectAttempt(), event.channelId(), event.kind(), event.detail());
        }
    }

    @Override
    public void onError(RelayErrorEvent event) {
        log.error("Relay error: {}", event.message(), event.cause());
    }
}
