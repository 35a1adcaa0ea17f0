package io.socketrelay.server.core;

import io.socketrelay.core.Identity;
import io.socketrelay.core.Role;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Broker-side state of one connection: bound identity, liveness flag and release flag.
 *
 * <p>The transport owns the socket; the broker only holds this wrapper.
 */
public final class Connection {
    private final String id;
    private final ConnectionChannel channel;
    private final AtomicBoolean alive = new AtomicBoolean(true);
    private final AtomicBoolean released = new AtomicBoolean(false);
    // held while an inbound event is handled and while the connection is released
    private final ReentrantLock guard = new ReentrantLock();
    private volatile Identity identity;

    public Connection(String id, ConnectionChannel channel) {
        this.id = Objects.requireNonNull(id, "id");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public String id() {
        return id;
    }

    public String path() {
        return channel.path();
    }

    public Optional<Identity> identity() {
        return Optional.ofNullable(identity);
    }

    /** Bound identity id, or null before authentication. */
    public String identityId() {
        Identity current = identity;
        return current == null ? null : current.id();
    }

    /** Bound role, or null before authentication. */
    public Role role() {
        Identity current = identity;
        return current == null ? null : current.role();
    }

    public boolean isAuthenticated() {
        return identity != null;
    }

    /**
     * Binds an identity to this connection.
     *
     * @return the previously bound identity, or null
     */
    public Identity bind(Identity newIdentity) {
        Identity previous = identity;
        identity = Objects.requireNonNull(newIdentity, "newIdentity");
        return previous;
    }

    public boolean isOpen() {
        return !released.get() && channel.isOpen();
    }

    void sendText(String text) {
        channel.send(text);
    }

    /**
     * Starts a liveness cycle: returns false if the previous probe was never answered, otherwise
     * marks the connection pending and sends a new probe.
     */
    boolean probe() {
        if (!alive.getAndSet(false)) return false;
        channel.ping();
        return true;
    }

    void markAlive() {
        alive.set(true);
    }

    public boolean isAlive() {
        return alive.get();
    }

    void close() {
        channel.close();
    }

    void terminate() {
        channel.terminate();
    }

    /**
     * Claims the one-time cleanup of this connection.
     *
     * @return true for the first caller only
     */
    boolean release() {
        return released.compareAndSet(false, true);
    }

    ReentrantLock guard() {
        return guard;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public String toString() {
        Identity current = identity;
        return current == null ? id : id + "(" + current.id() + ")";
    }
}
