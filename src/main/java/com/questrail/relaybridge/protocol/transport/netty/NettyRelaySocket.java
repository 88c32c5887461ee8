package com.questrail.relaybridge.protocol.transport.netty;

import com.questrail.relaybridge.protocol.model.RelayCloseCodes;
import com.questrail.relaybridge.protocol.transport.RelaySocket;
import com.questrail.relaybridge.protocol.transport.RelaySocketListener;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;

import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * NettyRelaySocket
 * =============================================================================
 * {@link RelaySocket} over a Netty WebSocket client channel.
 *
 * <p>The socket is created before the TCP connect completes; {@link #attach}
 * binds it to the channel once the connector has one. Calls made before then
 * are recorded ({@link #close()}, {@link #terminate()}) or fail fast
 * ({@link #send(String)}).</p>
 *
 * <p>{@link RelaySocketListener#onClose(int, String)} is delivered exactly once:
 * from {@code channelInactive}, or from {@link #connectFailed(Throwable)} when no
 * channel ever became active.</p>
 */
final class NettyRelaySocket implements RelaySocket
{
    private final RelaySocketListener listener;
    private final AtomicBoolean closeDelivered = new AtomicBoolean();

    private volatile Channel channel;
    private volatile boolean open;
    private volatile boolean closeRequested;

    private volatile int closeCode = RelayCloseCodes.ABNORMAL;
    private volatile String closeReason = "";

    NettyRelaySocket(RelaySocketListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public boolean isOpen()
    {
        Channel ch = channel;
        return open && ch != null && ch.isActive();
    }

    @Override
    public CompletableFuture<Void> send(String text)
    {
        Objects.requireNonNull(text, "text");
        return write(() -> new TextWebSocketFrame(text));
    }

    @Override
    public CompletableFuture<Void> sendBinary(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        return write(() -> new BinaryWebSocketFrame(Unpooled.wrappedBuffer(payload)));
    }

    private CompletableFuture<Void> write(Supplier<WebSocketFrame> frame)
    {
        CompletableFuture<Void> result = new CompletableFuture<>();
        Channel ch = channel;
        if (!isOpen()) {
            result.completeExceptionally(new ClosedChannelException());
            return result;
        }
        ch.writeAndFlush(frame.get()).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                result.complete(null);
            }
            else {
                result.completeExceptionally(f.cause());
            }
        });
        return result;
    }

    @Override
    public void ping()
    {
        if (isOpen()) {
            channel.writeAndFlush(new PingWebSocketFrame());
        }
    }

    @Override
    public void close()
    {
        closeRequested = true;
        Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (isOpen()) {
            ch.writeAndFlush(new CloseWebSocketFrame(RelayCloseCodes.NORMAL, ""))
                    .addListener(ChannelFutureListener.CLOSE);
        }
        else {
            ch.close();
        }
    }

    @Override
    public void terminate()
    {
        closeRequested = true;
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    // -------------------------------------------------------------------------
    // Connector callbacks
    // -------------------------------------------------------------------------

    void attach(Channel ch)
    {
        this.channel = ch;
        if (closeRequested) {
            ch.close();
        }
    }

    void connectFailed(Throwable cause)
    {
        listener.onError(cause);
        deliverClose();
    }

    Handler handler()
    {
        return new Handler();
    }

    private void deliverClose()
    {
        open = false;
        if (closeDelivered.compareAndSet(false, true)) {
            listener.onClose(closeCode, closeReason);
        }
    }

    /**
     * Last inbound handler in the client pipeline. Frames arrive aggregated;
     * pings are answered by {@link WebSocketClientProtocolHandler}.
     */
    final class Handler extends SimpleChannelInboundHandler<WebSocketFrame>
    {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                open = true;
                if (closeRequested) {
                    ctx.close();
                    return;
                }
                listener.onOpen();
                return;
            }
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                listener.onError(new WebSocketHandshakeException("WebSocket handshake timed out"));
                ctx.close();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
        {
            if (frame instanceof TextWebSocketFrame text) {
                listener.onText(text.text());
            }
            else if (frame instanceof BinaryWebSocketFrame) {
                listener.onBinary(ByteBufUtil.getBytes(frame.content()));
            }
            else if (frame instanceof PongWebSocketFrame) {
                listener.onPong();
            }
            else if (frame instanceof CloseWebSocketFrame close) {
                closeCode = close.statusCode() < 0 ? RelayCloseCodes.NORMAL : close.statusCode();
                closeReason = close.reasonText() == null ? "" : close.reasonText();
                open = false;
                ctx.writeAndFlush(new CloseWebSocketFrame(closeCode, ""))
                        .addListener(ChannelFutureListener.CLOSE);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            deliverClose();
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            listener.onError(cause);
            ctx.close();
        }
    }
}
