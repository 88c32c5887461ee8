package com.questrail.relaybridge.protocol.transport.netty;

import com.questrail.relaybridge.protocol.broker.ChannelBroker;
import com.questrail.relaybridge.protocol.broker.ChannelSnapshot;
import com.questrail.relaybridge.protocol.config.RelayBrokerConfig;
import com.questrail.relaybridge.protocol.internal.time.WallClock;
import com.questrail.relaybridge.protocol.observability.RelayObservabilitySink;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * NettyRelayServer
 * =============================================================================
 * Netty WebSocket host for a {@link ChannelBroker}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>transport adapter</strong>. Channel membership and
 * forwarding rules live in the broker; this class only moves text frames.
 *
 * <h2>Threading</h2>
 * The worker group has exactly one event loop, so every accepted connection
 * and every broker call run on the same thread. Reads from other threads
 * ({@link #snapshot(String)}, {@link #channelCount()}) hop onto that loop.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds synchronously and fails fast if the port is taken.
 * - {@link #stop()} drops every peer and shuts down both event loop groups.
 *   A stopped server cannot be restarted.
 */
public final class NettyRelayServer implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyRelayServer.class);

    private static final int MAX_HANDSHAKE_BYTES = 64 * 1024;

    private final RelayBrokerConfig config;
    private final ChannelBroker broker;
    private final RelayObservabilitySink sink;
    private final WallClock wallClock;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final EventLoop brokerLoop;

    private volatile Channel serverChannel;
    private volatile boolean stopped;

    public NettyRelayServer(RelayBrokerConfig config,
                            ChannelBroker broker,
                            RelayObservabilitySink sink,
                            WallClock wallClock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.brokerLoop = workerGroup.next();
    }

    /**
     * Bind the listening socket.
     *
     * @return the bound address (useful when the configured port is 0)
     * @throws IllegalStateException if the port is in use or the bind fails
     */
    public synchronized InetSocketAddress start()
    {
        if (stopped) {
            throw new IllegalStateException("Relay server has been stopped");
        }
        if (serverChannel != null) {
            return (InetSocketAddress) serverChannel.localAddress();
        }

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, false)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_BYTES));
                        p.addLast(new WebSocketFrameAggregator(config.maxFrameBytes()));
                        p.addLast(new RelayServerHandler(broker, config, sink, wallClock));
                    }
                });

        ChannelFuture bind = bootstrap.bind(config.host(), config.port()).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            Throwable cause = bind.cause();
            shutdownGroups();
            stopped = true;
            if (cause instanceof BindException) {
                throw new IllegalStateException("Relay port " + config.port() + " is already in use", cause);
            }
            throw new IllegalStateException(
                    "Failed to bind relay on " + config.displayHost() + ":" + config.port(), cause);
        }

        serverChannel = bind.channel();
        InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();
        log.info("Relay broker listening on {}", webSocketUri(bound));
        return bound;
    }

    /**
     * WebSocket URI peers should dial, e.g. {@code ws://127.0.0.1:8888/}.
     */
    public URI webSocketUri()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("Relay server is not started");
        }
        return webSocketUri((InetSocketAddress) ch.localAddress());
    }

    public Optional<ChannelSnapshot> snapshot(String channelId)
    {
        Objects.requireNonNull(channelId, "channelId");
        return onBrokerLoop(() -> broker.snapshot(channelId));
    }

    public int channelCount()
    {
        return onBrokerLoop(broker::channelCount);
    }

    public boolean isRunning()
    {
        Channel ch = serverChannel;
        return ch != null && ch.isActive();
    }

    public synchronized void stop()
    {
        if (stopped) {
            return;
        }
        stopped = true;

        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
            brokerLoop.submit(broker::shutdown).awaitUninterruptibly();
        }
        shutdownGroups();
        log.info("Relay broker stopped");
    }

    @Override
    public void close()
    {
        stop();
    }

    private URI webSocketUri(InetSocketAddress bound)
    {
        return URI.create("ws://" + config.displayHost() + ":" + bound.getPort() + config.path());
    }

    private <T> T onBrokerLoop(Callable<T> task)
    {
        if (brokerLoop.inEventLoop()) {
            try {
                return task.call();
            }
            catch (Exception e) {
                throw new IllegalStateException("Broker query failed", e);
            }
        }
        io.netty.util.concurrent.Future<T> future = brokerLoop.submit(task).awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new IllegalStateException("Broker query failed", future.cause());
        }
        return future.getNow();
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }
}
