package com.questrail.relaybridge.protocol.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayBrokerConfigTest {

    @Test
    void defaults() {
        RelayBrokerConfig config = RelayBrokerConfig.defaults();

        assertEquals("127.0.0.1", config.host());
        assertEquals(8888, config.port());
        assertEquals("/", config.path());
        assertEquals(16 * 1024 * 1024, config.maxFrameBytes());
    }

    @Test
    void pathIsNormalised() {
        assertEquals("/", RelayBrokerConfig.normalizePath(null));
        assertEquals("/", RelayBrokerConfig.normalizePath(""));
        assertEquals("/", RelayBrokerConfig.normalizePath("/"));
        assertEquals("/relay", RelayBrokerConfig.normalizePath("relay"));
        assertEquals("/relay", RelayBrokerConfig.normalizePath("/relay/"));
        assertEquals("/a/b", RelayBrokerConfig.normalizePath("a/b/"));
    }

    @Test
    void environmentOverridesDefaults() {
        RelayBrokerConfig config = RelayBrokerConfig.fromEnvironment(Map.of(
                "RELAY_HOST", " 0.0.0.0 ",
                "RELAY_PORT", "9001",
                "RELAY_PATH", "bridge/"));

        assertEquals("0.0.0.0", config.host());
        assertEquals(9001, config.port());
        assertEquals("/bridge", config.path());
    }

    @Test
    void blankEnvironmentKeepsDefaults() {
        RelayBrokerConfig config = RelayBrokerConfig.fromEnvironment(Map.of("RELAY_PORT", "  "));

        assertEquals(RelayBrokerConfig.DEFAULT_PORT, config.port());
    }

    @Test
    void invalidPortIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RelayBrokerConfig.fromEnvironment(Map.of("RELAY_PORT", "eighty")));
        assertThrows(IllegalArgumentException.class,
                () -> RelayBrokerConfig.builder().withPort(70000).build());
    }

    @Test
    void ipv6HostIsBracketedForDisplay() {
        RelayBrokerConfig config = RelayBrokerConfig.builder().withHost("::1").build();

        assertEquals("[::1]", config.displayHost());
    }
}
