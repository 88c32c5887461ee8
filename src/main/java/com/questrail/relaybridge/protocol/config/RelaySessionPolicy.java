package com.questrail.relaybridge.protocol.config;

import java.time.Duration;
import java.util.Objects;

/**
 * RelaySessionPolicy
 * -----------------------------------------------------------------------------
 * Timing and admission limits for a caller session.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: window in which an executor must be reported
 *       present after {@code connect} is called.</li>
 *   <li><b>requestTimeout</b>: deadline applied by {@code send} when the caller
 *       does not supply one.</li>
 *   <li><b>pingInterval</b>: cadence of WebSocket pings once the socket is open.</li>
 *   <li><b>keepaliveTimeout</b>: silence after which the socket is terminated.
 *       Any inbound traffic pushes this deadline forward.</li>
 *   <li><b>maxPendingRequests</b>: ceiling on in-flight requests; further
 *       sends fail with {@code TOO_MANY_PENDING}.</li>
 *   <li><b>debugEventCapacity</b>: size of the diagnostic ring buffer.</li>
 * </ul>
 */
public record RelaySessionPolicy(
        Duration connectTimeout,
        Duration requestTimeout,
        Duration pingInterval,
        Duration keepaliveTimeout,
        int maxPendingRequests,
        int debugEventCapacity
) {
    public RelaySessionPolicy {
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(requestTimeout, "requestTimeout");
        requirePositive(pingInterval, "pingInterval");
        requirePositive(keepaliveTimeout, "keepaliveTimeout");

        if (maxPendingRequests <= 0) {
            throw new IllegalArgumentException("maxPendingRequests must be positive");
        }
        if (debugEventCapacity < 0) {
            throw new IllegalArgumentException("debugEventCapacity must be non-negative");
        }
    }

    /**
     * Defaults:
     * <ul>
     *   <li>connectTimeout: 30s</li>
     *   <li>requestTimeout: 120s</li>
     *   <li>pingInterval: 20s</li>
     *   <li>keepaliveTimeout: 45s</li>
     *   <li>maxPendingRequests: 200</li>
     *   <li>debugEventCapacity: 80</li>
     * </ul>
     */
    public static RelaySessionPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofSeconds(120);
        private Duration pingInterval = Duration.ofSeconds(20);
        private Duration keepaliveTimeout = Duration.ofSeconds(45);
        private int maxPendingRequests = 200;
        private int debugEventCapacity = 80;

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder withPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        public Builder withKeepaliveTimeout(Duration keepaliveTimeout) {
            this.keepaliveTimeout = keepaliveTimeout;
            return this;
        }

        public Builder withMaxPendingRequests(int maxPendingRequests) {
            this.maxPendingRequests = maxPendingRequests;
            return this;
        }

        public Builder withDebugEventCapacity(int debugEventCapacity) {
            this.debugEventCapacity = debugEventCapacity;
            return this;
        }

        public RelaySessionPolicy build() {
            return new RelaySessionPolicy(connectTimeout, requestTimeout, pingInterval,
                    keepaliveTimeout, maxPendingRequests, debugEventCapacity);
        }
    }
}
