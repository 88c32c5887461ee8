package com.questrail.relaybridge.protocol.transport.netty;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.relaybridge.protocol.broker.ChannelBroker;
import com.questrail.relaybridge.protocol.broker.ChannelSnapshot;
import com.questrail.relaybridge.protocol.broker.ConnectionRequest;
import com.questrail.relaybridge.protocol.codec.Jsons;
import com.questrail.relaybridge.protocol.config.RelayBrokerConfig;
import com.questrail.relaybridge.protocol.internal.time.WallClock;
import com.questrail.relaybridge.protocol.model.RelayCloseCodes;
import com.questrail.relaybridge.protocol.observability.RelayErrorEvent;
import com.questrail.relaybridge.protocol.observability.RelayObservabilitySink;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * RelayServerHandler
 * =============================================================================
 * Per-connection inbound handler for {@link NettyRelayServer}.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Answer plain HTTP requests (status endpoint, 426 elsewhere)</li>
 *   <li>Perform the WebSocket handshake, then hand the peer to the broker</li>
 *   <li>Translate frames into broker calls</li>
 * </ul>
 *
 * It MUST NOT interpret application envelopes. All broker calls happen on
 * this channel's event loop, which the server shares across every child.
 */
final class RelayServerHandler extends SimpleChannelInboundHandler<Object>
{
    private static final Logger log = LoggerFactory.getLogger(RelayServerHandler.class);

    private final ChannelBroker broker;
    private final RelayBrokerConfig config;
    private final RelayObservabilitySink sink;
    private final WallClock wallClock;

    private WebSocketServerHandshaker handshaker;
    private NettyRelayPeer peer;

    RelayServerHandler(ChannelBroker broker,
                       RelayBrokerConfig config,
                       RelayObservabilitySink sink,
                       WallClock wallClock)
    {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg)
    {
        if (msg instanceof FullHttpRequest request) {
            handleHttpRequest(ctx, request);
        }
        else if (msg instanceof WebSocketFrame frame) {
            handleFrame(ctx, frame);
        }
    }

    // -------------------------------------------------------------------------
    // HTTP
    // -------------------------------------------------------------------------

    private void handleHttpRequest(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        if (!request.decoderResult().isSuccess()) {
            sendPlain(ctx, request, HttpResponseStatus.BAD_REQUEST, "Bad request");
            return;
        }
        if (!HttpMethod.GET.equals(request.method())) {
            sendPlain(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, "Method not allowed");
            return;
        }

        QueryStringDecoder query = new QueryStringDecoder(request.uri());
        boolean upgrade = request.headers().containsValue(
                HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true);

        if (!upgrade) {
            if (statusPath().equals(query.path())) {
                handleStatus(ctx, request, query);
            }
            else {
                sendPlain(ctx, request, HttpResponseStatus.UPGRADE_REQUIRED, "Expected websocket upgrade");
            }
            return;
        }

        String location = "ws://" + request.headers().get(HttpHeaderNames.HOST, config.displayHost()) + query.path();
        WebSocketServerHandshakerFactory factory =
                new WebSocketServerHandshakerFactory(location, null, true, config.maxFrameBytes());
        handshaker = factory.newHandshaker(request);
        if (handshaker == null) {
            WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
            return;
        }

        ConnectionRequest admission = new ConnectionRequest(
                query.path(),
                first(query, "type"),
                first(query, "channel"),
                first(query, "session"));

        handshaker.handshake(ctx.channel(), request).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.debug("WebSocket handshake failed for {}", ctx.channel().remoteAddress(), future.cause());
                ctx.close();
                return;
            }
            admit(ctx, admission);
        });
    }

    private void admit(ChannelHandlerContext ctx, ConnectionRequest admission)
    {
        NettyRelayPeer candidate = new NettyRelayPeer(ctx.channel());
        try {
            if (broker.admit(candidate, admission)) {
                peer = candidate;
            }
        }
        catch (RuntimeException e) {
            sink.onError(new RelayErrorEvent(wallClock.now(), "Relay connection setup failed", e));
            broker.onDisconnect(candidate);
            candidate.close(RelayCloseCodes.SETUP_FAILED, "Relay setup failed");
        }
    }

    private void handleStatus(ChannelHandlerContext ctx, FullHttpRequest request, QueryStringDecoder query)
    {
        String channelId = first(query, "channel");
        if (channelId == null || channelId.isBlank()) {
            sendJson(ctx, request, HttpResponseStatus.BAD_REQUEST, errorBody("channel is required"));
            return;
        }

        Optional<ChannelSnapshot> snapshot = broker.snapshot(channelId);
        if (snapshot.isEmpty()) {
            sendJson(ctx, request, HttpResponseStatus.NOT_FOUND, errorBody("Unknown channel: " + channelId));
            return;
        }

        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("channel", channelId);
        body.put("figmaExecutorPresent", snapshot.get().executorPresent());
        body.put("callers", snapshot.get().callerCount());
        sendJson(ctx, request, HttpResponseStatus.OK, body);
    }

    private String statusPath()
    {
        String mount = broker.mountPath();
        return "/".equals(mount) ? "/status" : mount + "/status";
    }

    // -------------------------------------------------------------------------
    // WebSocket
    // -------------------------------------------------------------------------

    private void handleFrame(ChannelHandlerContext ctx, WebSocketFrame frame)
    {
        if (frame instanceof CloseWebSocketFrame) {
            handshaker.close(ctx.channel(), (CloseWebSocketFrame) frame.retain());
            return;
        }
        if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
            return;
        }
        if (frame instanceof PongWebSocketFrame) {
            return;
        }

        NettyRelayPeer p = peer;
        if (p == null) {
            // Not admitted; the close frame is already on its way.
            return;
        }

        if (frame instanceof TextWebSocketFrame text) {
            broker.onMessage(p, text.text());
        }
        else if (frame instanceof BinaryWebSocketFrame) {
            broker.onBinary(p, ByteBufUtil.getBytes(frame.content()));
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        NettyRelayPeer p = peer;
        if (p != null) {
            broker.onDisconnect(p);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.debug("Relay connection error on {}", ctx.channel().remoteAddress(), cause);
        NettyRelayPeer p = peer;
        if (p != null) {
            broker.onDisconnect(p);
        }
        ctx.close();
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static String first(QueryStringDecoder query, String name)
    {
        Map<String, List<String>> params = query.parameters();
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static ObjectNode errorBody(String message)
    {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("error", message);
        return body;
    }

    private static void sendJson(ChannelHandlerContext ctx, FullHttpRequest request,
                                 HttpResponseStatus status, ObjectNode body)
    {
        ByteBuf content = Unpooled.copiedBuffer(Jsons.toJson(body), StandardCharsets.UTF_8);
        send(ctx, request, status, content, "application/json; charset=utf-8");
    }

    private static void sendPlain(ChannelHandlerContext ctx, FullHttpRequest request,
                                  HttpResponseStatus status, String text)
    {
        ByteBuf content = Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);
        send(ctx, request, status, content, "text/plain; charset=utf-8");
    }

    private static void send(ChannelHandlerContext ctx, FullHttpRequest request,
                             HttpResponseStatus status, ByteBuf content, String contentType)
    {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        HttpUtil.setContentLength(response, content.readableBytes());

        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        }
        else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
