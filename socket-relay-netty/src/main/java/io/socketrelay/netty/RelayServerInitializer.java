package io.socketrelay.netty;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.socketrelay.server.core.RelayBroker;

import java.util.Objects;

final class RelayServerInitializer extends ChannelInitializer<SocketChannel> {
    private static final int MAX_HANDSHAKE_BYTES = 64 * 1024;

    private final RelayBroker broker;
    private final int maxFrameBytes;

    RelayServerInitializer(RelayBroker broker, int maxFrameBytes) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();
        pipeline.addLast(new HttpServerCodec());
        pipeline.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_BYTES));
        pipeline.addLast(new WebSocketFrameAggregator(maxFrameBytes));
        pipeline.addLast(new WebSocketUpgradeHandler(broker, maxFrameBytes));
        pipeline.addLast(new RelayFrameHandler(broker));
    }
}
