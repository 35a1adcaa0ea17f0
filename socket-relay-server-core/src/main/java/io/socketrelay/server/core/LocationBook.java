package io.socketrelay.server.core;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last position reported by each identity during this process lifetime.
 */
public final class LocationBook {
    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    public void update(String userId, double lat, double lng) {
        positions.put(Objects.requireNonNull(userId, "userId"), new Position(lat, lng));
    }

    public Optional<Position> lookup(String userId) {
        if (userId == null) return Optional.empty();
        return Optional.ofNullable(positions.get(userId));
    }

    public record Position(double lat, double lng) {}
}
