package io.socketrelay.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.util.CharsetUtil;
import io.socketrelay.server.core.Connection;
import io.socketrelay.server.core.RelayBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Feeds WebSocket frames of an upgraded channel into the broker.
 */
final class RelayFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {
    private static final Logger log = LoggerFactory.getLogger(RelayFrameHandler.class);

    private final RelayBroker broker;

    RelayFrameHandler(RelayBroker broker) {
        this.broker = Objects.requireNonNull(broker, "broker");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        Connection connection = ctx.channel().attr(NettyConnectionChannel.CONNECTION).get();
        if (connection == null) {
            log.debug("Dropped {} received before the connection was registered", frame.getClass().getSimpleName());
            return;
        }

        if (frame instanceof TextWebSocketFrame text) {
            broker.onText(connection, text.text());
        } else if (frame instanceof PongWebSocketFrame) {
            broker.onPong(connection);
        } else if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
        } else if (frame instanceof CloseWebSocketFrame close) {
            NettyConnectionChannel transport = ctx.channel().attr(NettyConnectionChannel.TRANSPORT).get();
            if (transport != null) {
                transport.acknowledgeClose(close.retain());
            } else {
                ctx.close();
            }
        } else if (frame instanceof BinaryWebSocketFrame) {
            broker.onText(connection, frame.content().toString(CharsetUtil.UTF_8));
        } else {
            log.debug("Ignored {} on {}", frame.getClass().getSimpleName(), connection);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Connection connection = ctx.channel().attr(NettyConnectionChannel.CONNECTION).get();
        if (connection != null) broker.onClose(connection);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Closing {} after transport error: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }
}
