package com.questrail.relaybridge.protocol.runtime;

import com.questrail.relaybridge.protocol.codec.RelayEnvelopeCodec;
import com.questrail.relaybridge.protocol.config.RelayBrokerConfig;
import com.questrail.relaybridge.protocol.config.RelaySessionPolicy;
import com.questrail.relaybridge.protocol.internal.time.MonotonicClock;
import com.questrail.relaybridge.protocol.internal.time.ScheduledExecutorScheduler;
import com.questrail.relaybridge.protocol.internal.time.SystemMonotonicClock;
import com.questrail.relaybridge.protocol.internal.time.SystemWallClock;
import com.questrail.relaybridge.protocol.observability.NullObservabilitySink;
import com.questrail.relaybridge.protocol.observability.RelayObservabilitySink;
import com.questrail.relaybridge.protocol.session.CallerSession;
import com.questrail.relaybridge.protocol.transport.netty.NettyRelayConnector;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * CallerSessionRuntime
 * =============================================================================
 * Production wiring for a {@link CallerSession}: one single-threaded scheduled
 * executor serves as both the session executor and the timer source, and a
 * {@link NettyRelayConnector} provides the sockets.
 */
public final class CallerSessionRuntime implements AutoCloseable
{
    private final CallerSession session;
    private final NettyRelayConnector connector;
    private final ScheduledExecutorService sessionExecutor;

    private CallerSessionRuntime(CallerSession session,
                                 NettyRelayConnector connector,
                                 ScheduledExecutorService sessionExecutor)
    {
        this.session = session;
        this.connector = connector;
        this.sessionExecutor = sessionExecutor;
    }

    public CallerSession session()
    {
        return session;
    }

    @Override
    public void close()
    {
        session.close();
        connector.close();
        sessionExecutor.shutdown();
        try {
            if (!sessionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sessionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sessionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private RelaySessionPolicy policy = RelaySessionPolicy.defaults();
        private RelayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private int maxFrameBytes = RelayBrokerConfig.DEFAULT_MAX_FRAME_BYTES;

        public Builder withPolicy(RelaySessionPolicy policy)
        {
            this.policy = policy;
            return this;
        }

        public Builder withObservabilitySink(RelayObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMaxFrameBytes(int maxFrameBytes)
        {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public CallerSessionRuntime build()
        {
            Objects.requireNonNull(policy, "policy");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
                Thread t = new Thread(r, "relay-caller-session");
                t.setDaemon(true);
                return t;
            });
            // Outstanding deadlines must not hold up shutdown.
            executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            executor.setRemoveOnCancelPolicy(true);
            NettyRelayConnector connector = new NettyRelayConnector(maxFrameBytes, policy.connectTimeout());

            CallerSession session = new CallerSession(
                    connector,
                    executor,
                    new ScheduledExecutorScheduler(executor, clock),
                    clock,
                    SystemWallClock.INSTANCE,
                    policy,
                    new RelayEnvelopeCodec(),
                    observabilitySink);
            return new CallerSessionRuntime(session, connector, executor);
        }
    }
}
