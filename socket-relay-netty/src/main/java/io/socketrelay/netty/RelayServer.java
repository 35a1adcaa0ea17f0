package io.socketrelay.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.socketrelay.auth.jjwt.JwtCredentialVerifier;
import io.socketrelay.server.core.InMemoryChatStore;
import io.socketrelay.server.core.RelayBroker;
import io.socketrelay.server.core.RelayThreads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Netty WebSocket server in front of a {@link RelayBroker}.
 *
 * <pre>{@code
 * RelayServer server = new RelayServer(broker, RelayServerConfiguration.load()).start();
 * }</pre>
 */
public final class RelayServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayServer.class);

    private final RelayBroker broker;
    private final RelayServerConfiguration config;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RelayServer(RelayBroker broker, RelayServerConfiguration config) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Binds the listening socket and starts the broker's liveness monitor.
     */
    public synchronized RelayServer start() throws InterruptedException {
        if (serverChannel != null) return this;
        bossGroup = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        workerGroup = new MultiThreadIoEventLoopGroup(NioIoHandler.newFactory());
        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new RelayServerInitializer(broker, config.getMaxFrameBytes()));
            serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            log.error("Failed to start relay server on port {}", config.getPort(), e);
            close();
            throw e;
        }
        broker.start();
        log.info("Relay server listening on ws://{}:{}", config.getHost(), port());
        return this;
    }

    /** Bound port (useful when configured with port 0). */
    public int port() {
        Channel channel = serverChannel;
        if (channel == null) throw new IllegalStateException("server not started");
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    public void awaitTermination() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) channel.closeFuture().sync();
    }

    @Override
    public synchronized void close() {
        broker.close();
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        log.info("Relay server stopped");
    }

    /**
     * Standalone server over the in-memory reference store.
     */
    public static void main(String[] args) throws Exception {
        RelayServerConfiguration config = RelayServerConfiguration.load();
        if (config.getJwtSecret() == null) {
            throw new IllegalStateException("socket-relay.jwt-secret is not configured");
        }
        ExecutorService storeExecutor = RelayThreads.newStoreExecutor("socket-relay-store", config.getStoreThreads());
        RelayBroker broker = RelayBroker.builder(
                        new JwtCredentialVerifier(config.getJwtSecret()), new InMemoryChatStore(), storeExecutor)
                .livenessInterval(config.getLivenessInterval())
                .build();
        RelayServer server = new RelayServer(broker, config).start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            storeExecutor.shutdown();
        }, "socket-relay-shutdown"));
        server.awaitTermination();
    }
}
