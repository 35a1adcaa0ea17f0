package io.socketrelay.netty;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.util.AttributeKey;
import io.socketrelay.server.core.Connection;
import io.socketrelay.server.core.ConnectionChannel;

import java.util.Objects;

/**
 * {@link ConnectionChannel} over an upgraded Netty channel.
 */
public final class NettyConnectionChannel implements ConnectionChannel {
    static final AttributeKey<Connection> CONNECTION = AttributeKey.valueOf("socket-relay.connection");
    static final AttributeKey<NettyConnectionChannel> TRANSPORT = AttributeKey.valueOf("socket-relay.transport");

    private final Channel channel;
    private final WebSocketServerHandshaker handshaker;
    private final String path;

    /**
     * @param handshaker handshaker that upgraded the channel, or null when the channel was never upgraded over HTTP
     */
    public NettyConnectionChannel(Channel channel, WebSocketServerHandshaker handshaker, String path) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.handshaker = handshaker;
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public void send(String text) {
        if (channel.isActive()) channel.writeAndFlush(new TextWebSocketFrame(text));
    }

    @Override
    public void ping() {
        if (channel.isActive()) channel.writeAndFlush(new PingWebSocketFrame());
    }

    @Override
    public void close() {
        acknowledgeClose(new CloseWebSocketFrame());
    }

    @Override
    public void terminate() {
        channel.close();
    }

    /**
     * Answers (or starts) the close handshake and closes the channel once the frame is written.
     */
    void acknowledgeClose(CloseWebSocketFrame frame) {
        if (!channel.isActive()) {
            frame.release();
            return;
        }
        if (handshaker != null) {
            handshaker.close(channel, frame);
        } else {
            channel.writeAndFlush(frame).addListener(ChannelFutureListener.CLOSE);
        }
    }

    Channel channel() {
        return channel;
    }

    @Override
    public String toString() {
        return channel.id().asShortText() + path;
    }
}
