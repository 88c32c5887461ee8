package com.questrail.relaybridge.protocol.runtime;

import com.questrail.relaybridge.protocol.broker.ChannelBroker;
import com.questrail.relaybridge.protocol.broker.ChannelIdGenerator;
import com.questrail.relaybridge.protocol.codec.RelayEnvelopeCodec;
import com.questrail.relaybridge.protocol.config.RelayBrokerConfig;
import com.questrail.relaybridge.protocol.internal.time.SystemWallClock;
import com.questrail.relaybridge.protocol.internal.time.WallClock;
import com.questrail.relaybridge.protocol.lock.LockAcquisition;
import com.questrail.relaybridge.protocol.lock.LockGuard;
import com.questrail.relaybridge.protocol.lock.ProcessLiveness;
import com.questrail.relaybridge.protocol.observability.NullObservabilitySink;
import com.questrail.relaybridge.protocol.observability.RelayErrorEvent;
import com.questrail.relaybridge.protocol.observability.RelayObservabilitySink;
import com.questrail.relaybridge.protocol.transport.netty.NettyRelayServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * RelayHostRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a locally hosted relay broker.
 *
 * <h2>Startup</h2>
 * <pre>
 *   lock acquired, bind ok      → HOSTING           (this process runs the broker)
 *   lock held by live process   → REUSING_EXISTING  (dial the other broker)
 *   lock acquired, bind fails   → lock released, REUSING_EXISTING
 * </pre>
 *
 * In every mode {@link #relayUri()} names the endpoint callers should dial.
 */
public final class RelayHostRuntime implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(RelayHostRuntime.class);

    public enum Mode
    {
        NOT_STARTED,
        HOSTING,
        REUSING_EXISTING
    }

    private final RelayBrokerConfig config;
    private final LockGuard lockGuard;
    private final RelayObservabilitySink sink;
    private final WallClock wallClock;
    private final ChannelIdGenerator idGenerator;

    private Mode mode = Mode.NOT_STARTED;
    private NettyRelayServer server;
    private OptionalLong existingOwnerPid = OptionalLong.empty();

    private RelayHostRuntime(RelayBrokerConfig config,
                             LockGuard lockGuard,
                             RelayObservabilitySink sink,
                             WallClock wallClock,
                             ChannelIdGenerator idGenerator)
    {
        this.config = config;
        this.lockGuard = lockGuard;
        this.sink = sink;
        this.wallClock = wallClock;
        this.idGenerator = idGenerator;
    }

    public synchronized Mode start()
    {
        if (mode != Mode.NOT_STARTED) {
            return mode;
        }

        LockAcquisition lock = lockGuard.acquire();
        if (!lock.acquired()) {
            existingOwnerPid = lock.ownerPid();
            log.warn("Relay lock already held by PID {}. Reusing existing relay endpoint {}",
                    lock.ownerPid().isPresent() ? String.valueOf(lock.ownerPid().getAsLong()) : "unknown",
                    relayUri());
            mode = Mode.REUSING_EXISTING;
            return mode;
        }

        ChannelBroker broker = new ChannelBroker(
                config.path(), idGenerator, new RelayEnvelopeCodec(), sink, wallClock);
        NettyRelayServer candidate = new NettyRelayServer(config, broker, sink, wallClock);
        try {
            candidate.start();
        }
        catch (IllegalStateException e) {
            lockGuard.release();
            sink.onError(new RelayErrorEvent(wallClock.now(), "Failed to start relay broker", e));
            log.warn("Failed to start relay broker ({}). Falling back to existing relay endpoint {}",
                    e.getMessage(), relayUri());
            mode = Mode.REUSING_EXISTING;
            return mode;
        }

        server = candidate;
        mode = Mode.HOSTING;
        return mode;
    }

    public synchronized void stop()
    {
        if (server != null) {
            server.stop();
            server = null;
        }
        if (lockGuard.ownsLock()) {
            lockGuard.release();
        }
        mode = Mode.NOT_STARTED;
    }

    @Override
    public void close()
    {
        stop();
    }

    public synchronized Mode mode()
    {
        return mode;
    }

    /**
     * Pid of the process hosting the broker when this runtime reuses one.
     */
    public synchronized OptionalLong existingOwnerPid()
    {
        return existingOwnerPid;
    }

    /**
     * The hosted server, present only in {@link Mode#HOSTING}.
     */
    public synchronized Optional<NettyRelayServer> server()
    {
        return Optional.ofNullable(server);
    }

    /**
     * Endpoint callers should dial: the bound address when hosting, otherwise
     * the configured one.
     */
    public synchronized URI relayUri()
    {
        if (server != null) {
            return server.webSocketUri();
        }
        return URI.create("ws://" + config.displayHost() + ":" + config.port() + config.path());
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private RelayBrokerConfig config = RelayBrokerConfig.defaults();
        private RelayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ChannelIdGenerator idGenerator = ChannelIdGenerator.secureRandom();
        private Path lockDirectory = Paths.get(System.getProperty("java.io.tmpdir"));
        private ProcessLiveness liveness = ProcessLiveness.system();
        private long selfPid = ProcessHandle.current().pid();

        public Builder withConfig(RelayBrokerConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(RelayObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withChannelIdGenerator(ChannelIdGenerator idGenerator)
        {
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder withLockDirectory(Path lockDirectory)
        {
            this.lockDirectory = lockDirectory;
            return this;
        }

        public Builder withProcessLiveness(ProcessLiveness liveness)
        {
            this.liveness = liveness;
            return this;
        }

        public Builder withSelfPid(long selfPid)
        {
            this.selfPid = selfPid;
            return this;
        }

        public RelayHostRuntime build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(idGenerator, "idGenerator");
            Objects.requireNonNull(lockDirectory, "lockDirectory");
            Objects.requireNonNull(liveness, "liveness");

            LockGuard lockGuard = new LockGuard(
                    config.host(), config.port(), lockDirectory, selfPid, liveness, wallClock);
            return new RelayHostRuntime(config, lockGuard, observabilitySink, wallClock, idGenerator);
        }
    }
}
