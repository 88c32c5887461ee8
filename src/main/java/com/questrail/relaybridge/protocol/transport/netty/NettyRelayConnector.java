package com.questrail.relaybridge.protocol.transport.netty;

import com.questrail.relaybridge.protocol.transport.RelayConnector;
import com.questrail.relaybridge.protocol.transport.RelaySocket;
import com.questrail.relaybridge.protocol.transport.RelaySocketListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyRelayConnector
 * =============================================================================
 * Netty WebSocket client implementing the {@link RelayConnector} port.
 *
 * <p>Supports {@code ws://} and {@code wss://}. One event loop serves every
 * socket this connector opens; socket callbacks run on it and consumers hop
 * to their own executor.</p>
 *
 * <p>Close frames are surfaced to the listener rather than handled by Netty,
 * so the close code and reason reach the caller session. Pong frames are kept
 * for the keepalive monitor.</p>
 */
public final class NettyRelayConnector implements RelayConnector, AutoCloseable
{
    private static final int MAX_HANDSHAKE_BYTES = 64 * 1024;

    private final EventLoopGroup group;
    private final int maxFrameBytes;
    private final Duration handshakeTimeout;

    private volatile SslContext sslContext;

    public NettyRelayConnector(int maxFrameBytes, Duration handshakeTimeout)
    {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        this.maxFrameBytes = maxFrameBytes;
        this.handshakeTimeout = Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public RelaySocket open(URI uri, RelaySocketListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("Unsupported relay URI scheme: " + uri);
        }
        boolean secure = scheme.equals("wss");
        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("Relay URI has no host: " + uri);
        }
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
        SslContext ssl = secure ? sslContext() : null;

        WebSocketClientProtocolConfig protocolConfig = WebSocketClientProtocolConfig.newBuilder()
                .webSocketUri(uri)
                .version(WebSocketVersion.V13)
                .allowExtensions(false)
                .maxFramePayloadLength(maxFrameBytes)
                .handleCloseFrames(false)
                .dropPongFrames(false)
                .handshakeTimeoutMillis(handshakeTimeout.toMillis())
                .build();

        NettyRelaySocket socket = new NettyRelaySocket(listener);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) handshakeTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast(ssl.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_BYTES));
                        p.addLast(new WebSocketClientProtocolHandler(protocolConfig));
                        p.addLast(new WebSocketFrameAggregator(maxFrameBytes));
                        p.addLast(socket.handler());
                    }
                });

        bootstrap.connect(host, port).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                socket.attach(future.channel());
            }
            else {
                socket.connectFailed(future.cause());
            }
        });
        return socket;
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private SslContext sslContext()
    {
        SslContext ctx = sslContext;
        if (ctx == null) {
            synchronized (this) {
                ctx = sslContext;
                if (ctx == null) {
                    try {
                        ctx = SslContextBuilder.forClient().build();
                    }
                    catch (SSLException e) {
                        throw new UncheckedIOException("Failed to initialise TLS client context", e);
                    }
                    sslContext = ctx;
                }
            }
        }
        return ctx;
    }
}
