package com.questrail.relaybridge.protocol.transport.netty;

import com.questrail.relaybridge.protocol.transport.RelayPeer;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.Objects;

/**
 * {@link RelayPeer} over an accepted Netty WebSocket channel.
 */
final class NettyRelayPeer implements RelayPeer
{
    private final Channel channel;
    private final String id;

    NettyRelayPeer(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.id = channel.id().asShortText();
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public void send(String text)
    {
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(new TextWebSocketFrame(text));
    }

    @Override
    public void sendBinary(byte[] payload)
    {
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(payload)));
    }

    @Override
    public void close(int code, String reason)
    {
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(new CloseWebSocketFrame(code, reason))
                .addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void terminate()
    {
        channel.close();
    }

    @Override
    public String toString()
    {
        return "NettyRelayPeer[" + id + " " + channel.remoteAddress() + "]";
    }
}
