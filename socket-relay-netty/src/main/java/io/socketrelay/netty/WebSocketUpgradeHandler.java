package io.socketrelay.netty;

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
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import io.netty.util.CharsetUtil;
import io.socketrelay.core.Protocol;
import io.socketrelay.server.core.Connection;
import io.socketrelay.server.core.RelayBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Upgrades HTTP requests to WebSocket and registers the upgraded channel with the broker. The request
 * path (without query) becomes the connection's logical path.
 */
final class WebSocketUpgradeHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final RelayBroker broker;
    private final int maxFrameBytes;

    WebSocketUpgradeHandler(RelayBroker broker, int maxFrameBytes) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        if (!req.decoderResult().isSuccess()) {
            sendHttpResponse(ctx, req, HttpResponseStatus.BAD_REQUEST);
            return;
        }
        if (!HttpMethod.GET.equals(req.method())) {
            sendHttpResponse(ctx, req, HttpResponseStatus.METHOD_NOT_ALLOWED);
            return;
        }
        if (!req.headers().containsValue(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)) {
            sendHttpResponse(ctx, req, HttpResponseStatus.UPGRADE_REQUIRED);
            return;
        }

        String path = pathOf(req.uri());
        WebSocketServerHandshakerFactory factory = new WebSocketServerHandshakerFactory(
                webSocketLocation(req, path), null, true, maxFrameBytes);
        WebSocketServerHandshaker handshaker = factory.newHandshaker(req);
        if (handshaker == null) {
            WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
            return;
        }

        handshaker.handshake(ctx.channel(), req).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.debug("WebSocket handshake failed for {}", future.channel().remoteAddress(), future.cause());
                future.channel().close();
                return;
            }
            NettyConnectionChannel transport = new NettyConnectionChannel(future.channel(), handshaker, path);
            future.channel().attr(NettyConnectionChannel.TRANSPORT).set(transport);
            Connection connection = broker.open(transport);
            future.channel().attr(NettyConnectionChannel.CONNECTION).set(connection);
        });
    }

    static String pathOf(String uri) {
        String path = new QueryStringDecoder(uri).path();
        return path.isEmpty() ? Protocol.PATH_DEFAULT : path;
    }

    private static String webSocketLocation(FullHttpRequest req, String path) {
        String host = req.headers().get(HttpHeaderNames.HOST, "localhost");
        return "ws://" + host + path;
    }

    private static void sendHttpResponse(ChannelHandlerContext ctx, FullHttpRequest req, HttpResponseStatus status) {
        FullHttpResponse res = new DefaultFullHttpResponse(req.protocolVersion(), status,
                Unpooled.copiedBuffer(status.toString(), CharsetUtil.UTF_8));
        res.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        HttpUtil.setContentLength(res, res.content().readableBytes());
        ctx.writeAndFlush(res).addListener(ChannelFutureListener.CLOSE);
    }
}
