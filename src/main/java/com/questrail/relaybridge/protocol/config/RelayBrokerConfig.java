package com.questrail.relaybridge.protocol.config;

import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a relay broker host.
 *
 * @param host          bind host
 * @param port          bind port; 0 binds an ephemeral port
 * @param path          WebSocket mount path, normalised by {@link #normalizePath(String)}
 * @param maxFrameBytes largest text message accepted from a peer
 */
public record RelayBrokerConfig(
    String host,
    int port,
    String path,
    int maxFrameBytes
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8888;
    public static final String DEFAULT_PATH = "/";
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    public RelayBrokerConfig {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid relay port: " + port);
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        path = normalizePath(path);
    }

    public static RelayBrokerConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@code RELAY_HOST}, {@code RELAY_PORT} and {@code RELAY_PATH};
     * unset variables keep their defaults.
     */
    public static RelayBrokerConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder builder = builder();

        String host = env.get("RELAY_HOST");
        if (host != null && !host.isBlank()) {
            builder.withHost(host.trim());
        }
        String port = env.get("RELAY_PORT");
        if (port != null && !port.isBlank()) {
            try {
                builder.withPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid relay port: " + port, e);
            }
        }
        String path = env.get("RELAY_PATH");
        if (path != null && !path.isBlank()) {
            builder.withPath(path.trim());
        }
        return builder.build();
    }

    /**
     * {@code null}, empty and {@code /} map to {@code /}; otherwise a leading
     * slash is added and one trailing slash removed.
     */
    public static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty() || rawPath.equals("/")) {
            return "/";
        }
        String withLeading = rawPath.startsWith("/") ? rawPath : "/" + rawPath;
        return withLeading.endsWith("/") ? withLeading.substring(0, withLeading.length() - 1) : withLeading;
    }

    /**
     * Host literal suitable for a URI authority (IPv6 addresses bracketed).
     */
    public String displayHost() {
        return host.contains(":") ? "[" + host + "]" : host;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String path = DEFAULT_PATH;
        private int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withPath(String path) {
            this.path = path;
            return this;
        }

        public Builder withMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public RelayBrokerConfig build() {
            return new RelayBrokerConfig(host, port, path, maxFrameBytes);
        }
    }
}
