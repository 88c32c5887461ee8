package com.questrail.relaybridge.protocol.runtime;

import com.questrail.relaybridge.protocol.config.RelayBrokerConfig;
import com.questrail.relaybridge.protocol.observability.Slf4jRelayObservabilitySink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone relay broker. Configured from {@code RELAY_HOST}, {@code RELAY_PORT}
 * and {@code RELAY_PATH}; runs until the JVM is asked to exit.
 */
public final class RelayBrokerMain
{
    private static final Logger log = LoggerFactory.getLogger(RelayBrokerMain.class);

    private RelayBrokerMain() {
    }

    public static void main(String[] args) throws InterruptedException
    {
        RelayBrokerConfig config = RelayBrokerConfig.fromEnvironment(System.getenv());
        RelayHostRuntime runtime = RelayHostRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jRelayObservabilitySink())
                .build();

        RelayHostRuntime.Mode mode = runtime.start();
        if (mode != RelayHostRuntime.Mode.HOSTING) {
            log.error("Relay broker not started; another process serves {}", runtime.relayUri());
            System.exit(1);
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.stop();
            stopped.countDown();
        }, "relay-broker-shutdown"));
        stopped.await();
    }
}
