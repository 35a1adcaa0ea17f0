package io.socketrelay.server.core;

import io.socketrelay.core.Identity;
import io.socketrelay.core.OutboundEnvelope;
import io.socketrelay.core.Protocol;
import io.socketrelay.core.Role;
import io.socketrelay.json.spi.JsonCodec;
import io.socketrelay.json.spi.JsonCodecs;
import io.socketrelay.server.core.handlers.AuthenticateHandler;
import io.socketrelay.server.core.handlers.CallSignalingHandler;
import io.socketrelay.server.core.handlers.ChatHandler;
import io.socketrelay.server.core.handlers.LocationHandler;
import io.socketrelay.server.spi.AsyncChatStore;
import io.socketrelay.server.spi.BlockingToAsyncChatStore;
import io.socketrelay.server.spi.ChatStore;
import io.socketrelay.server.spi.CredentialVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Transport-neutral real-time broker.
 *
 * <p>Owns the shared connection state (registry, location subscriptions, last positions) and wires
 * the message router and liveness monitor around it. A transport calls {@link #open}, then
 * {@link #onText} and {@link #onPong} for every frame, and {@link #onClose} once the socket is gone.
 *
 * <pre>{@code
 * RelayBroker broker = RelayBroker.builder(verifier, store)
 *     .livenessInterval(Duration.ofSeconds(30))
 *     .build();
 * broker.start();
 * }</pre>
 */
public final class RelayBroker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayBroker.class);

    public static final Duration DEFAULT_LIVENESS_INTERVAL = Duration.ofSeconds(30);

    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final LocationSubscriptions subscriptions = new LocationSubscriptions();
    private final LocationBook locations = new LocationBook();
    private final AtomicLong connectionIds = new AtomicLong();
    private final EnvelopeWriter writer;
    private final PresenceBroadcaster presence;
    private final MessageRouter router;
    private final LivenessMonitor liveness;

    /**
     * Creates a new builder.
     *
     * @param verifier credential verifier used by {@code authenticate}
     * @param store    non-blocking store adapter
     */
    public static Builder builder(CredentialVerifier verifier, AsyncChatStore store) {
        return new Builder(verifier, store);
    }

    /**
     * Creates a new builder over a blocking store. Store calls run on {@code storeExecutor}.
     */
    public static Builder builder(CredentialVerifier verifier, ChatStore store, Executor storeExecutor) {
        return new Builder(verifier, new BlockingToAsyncChatStore(store, storeExecutor));
    }

    private RelayBroker(Builder builder) {
        JsonCodec codec = builder.codec != null ? builder.codec : JsonCodecs.defaultCodec();
        Duration interval = builder.livenessInterval != null ? builder.livenessInterval : DEFAULT_LIVENESS_INTERVAL;
        Role callerRole = builder.callerRole != null ? builder.callerRole : Role.CLIENT;
        Role calleeRole = builder.calleeRole != null ? builder.calleeRole : Role.HOST;
        RouteTable routes = builder.routes != null ? builder.routes : RouteTable.defaults();

        this.writer = new EnvelopeWriter(codec);
        this.presence = new PresenceBroadcaster(registry, writer);
        this.router = new MessageRouter(
                new EnvelopeDecoder(codec),
                writer,
                routes,
                new AuthenticateHandler(builder.verifier, registry, presence, writer),
                new LocationHandler(locations, subscriptions, builder.store, writer),
                new CallSignalingHandler(registry, writer, callerRole, calleeRole),
                new ChatHandler(builder.store, registry, writer));
        this.liveness = new LivenessMonitor(registry, this::release, interval);
    }

    /**
     * Builder for {@link RelayBroker}.
     */
    public static final class Builder {
        private final CredentialVerifier verifier;
        private final AsyncChatStore store;
        private JsonCodec codec;
        private Duration livenessInterval;
        private Role callerRole;
        private Role calleeRole;
        private RouteTable routes;

        private Builder(CredentialVerifier verifier, AsyncChatStore store) {
            this.verifier = Objects.requireNonNull(verifier, "verifier");
            this.store = Objects.requireNonNull(store, "store");
        }

        /** Sets the envelope codec. Default: the codec found by {@link JsonCodecs#defaultCodec()}. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Sets the ping/pong sweep interval. Default: 30 seconds. */
        public Builder livenessInterval(Duration livenessInterval) {
            this.livenessInterval = livenessInterval;
            return this;
        }

        /** Role allowed to place calls. Default: {@link Role#CLIENT}. */
        public Builder callerRole(Role callerRole) {
            this.callerRole = callerRole;
            return this;
        }

        /** Role allowed to receive calls. Default: {@link Role#HOST}. */
        public Builder calleeRole(Role calleeRole) {
            this.calleeRole = calleeRole;
            return this;
        }

        /** Per-path event restrictions. Default: {@link RouteTable#defaults()}. */
        public Builder routes(RouteTable routes) {
            this.routes = routes;
            return this;
        }

        public RelayBroker build() {
            return new RelayBroker(this);
        }
    }

    /**
     * Accepts a new transport connection and greets it.
     */
    public Connection open(ConnectionChannel channel) {
        Connection connection = new Connection("c" + connectionIds.incrementAndGet(), channel);
        registry.attach(connection);
        log.info("Connection {} opened on path {}", connection, connection.path());
        writer.send(connection, OutboundEnvelope.info(Protocol.MSG_WELCOME));
        return connection;
    }

    /**
     * Handles one inbound frame. Frames of a released connection are ignored; a release requested
     * while a frame is being handled waits for it to finish.
     */
    public void onText(Connection connection, String text) {
        ReentrantLock guard = connection.guard();
        guard.lock();
        try {
            if (connection.isReleased()) return;
            router.route(connection, text);
        } finally {
            guard.unlock();
        }
    }

    public void onPong(Connection connection) {
        connection.markAlive();
    }

    /**
     * Releases everything held for the connection. Safe to call more than once.
     */
    public void onClose(Connection connection) {
        release(connection);
    }

    private void release(Connection connection) {
        ReentrantLock guard = connection.guard();
        guard.lock();
        try {
            if (!connection.release()) return;
            registry.detach(connection);
            int dropped = subscriptions.unsubscribeAll(connection);
            Identity identity = connection.identity().orElse(null);
            if (identity != null && registry.unregister(identity.id(), connection)) {
                presence.announce(identity.id(), false, connection);
            }
            log.info("Connection {} closed ({} subscription(s) dropped)", connection, dropped);
        } finally {
            guard.unlock();
        }
    }

    /** Starts the liveness monitor. */
    public void start() {
        liveness.start();
    }

    @Override
    public void close() {
        liveness.close();
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public LocationSubscriptions subscriptions() {
        return subscriptions;
    }

    public LocationBook locations() {
        return locations;
    }

    public LivenessMonitor liveness() {
        return liveness;
    }
}
