package io.socketrelay.server.core;

import io.socketrelay.core.Protocol;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Which events each logical path accepts. Paths without an entry accept every event;
 * {@code authenticate} is accepted everywhere.
 */
public final class RouteTable {
    private final Map<String, Set<String>> restricted;

    private RouteTable(Map<String, Set<String>> restricted) {
        this.restricted = Map.copyOf(restricted);
    }

    /** {@code /driver-location} limited to location events; every other path unrestricted. */
    public static RouteTable defaults() {
        return permitAll().restrict(Protocol.PATH_DRIVER_LOCATION,
                Set.of(Protocol.EVENT_LOCATION_UPDATE, Protocol.EVENT_SUBSCRIBE_TO_LOCATION));
    }

    public static RouteTable permitAll() {
        return new RouteTable(Map.of());
    }

    public RouteTable restrict(String path, Set<String> events) {
        Objects.requireNonNull(path, "path");
        Map<String, Set<String>> copy = new HashMap<>(restricted);
        copy.put(path, Set.copyOf(events));
        return new RouteTable(copy);
    }

    public boolean permits(String path, String event) {
        if (Protocol.EVENT_AUTHENTICATE.equals(event)) return true;
        Set<String> allowed = path == null ? null : restricted.get(path);
        if (allowed == null) return true;
        return event != null && allowed.contains(event);
    }
}
