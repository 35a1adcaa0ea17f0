package io.socketrelay.server.core;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Who is online: every open connection, and the authenticated ones keyed by identity id.
 *
 * <p>At most one connection is registered per identity. A second registration on the same path
 * closes the earlier connection; a registration on a different path replaces the entry without
 * closing the earlier socket.
 */
public final class ConnectionRegistry {
    private final Map<String, Connection> byIdentity = new ConcurrentHashMap<>();
    private final Set<Connection> open = ConcurrentHashMap.newKeySet();

    void attach(Connection connection) {
        open.add(Objects.requireNonNull(connection, "connection"));
    }

    boolean detach(Connection connection) {
        return open.remove(connection);
    }

    /** Snapshot of every attached connection, authenticated or not. */
    public Collection<Connection> openConnections() {
        return List.copyOf(open);
    }

    /**
     * Registers {@code connection} for {@code identityId}.
     *
     * @return the connection that was evicted (and closed), if any
     */
    public Optional<Connection> register(String identityId, Connection connection) {
        Objects.requireNonNull(identityId, "identityId");
        Objects.requireNonNull(connection, "connection");
        Connection[] evicted = new Connection[1];
        byIdentity.compute(identityId, (id, existing) -> {
            if (existing != null && existing != connection && existing.path().equals(connection.path())) {
                evicted[0] = existing;
            }
            return connection;
        });
        if (evicted[0] == null) return Optional.empty();
        evicted[0].close();
        return Optional.of(evicted[0]);
    }

    public Optional<Connection> lookup(String identityId) {
        if (identityId == null) return Optional.empty();
        return Optional.ofNullable(byIdentity.get(identityId));
    }

    public void unregister(String identityId) {
        byIdentity.remove(identityId);
    }

    /**
     * Removes the entry only while it still points at {@code connection}.
     *
     * @return true if the entry was removed
     */
    public boolean unregister(String identityId, Connection connection) {
        if (identityId == null) return false;
        return byIdentity.remove(identityId, connection);
    }

    public boolean isOnline(String identityId) {
        return lookup(identityId).map(Connection::isOpen).orElse(false);
    }

    public Set<String> onlineIdentities() {
        return Set.copyOf(byIdentity.keySet());
    }

    public int size() {
        return byIdentity.size();
    }
}
