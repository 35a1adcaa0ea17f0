package io.socketrelay.server.core;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Target identity id to the connections following its location.
 *
 * <p>Subscriptions are dropped when the subscriber goes away. A target going offline keeps its
 * subscribers, so updates resume once it reconnects.
 */
public final class LocationSubscriptions {
    private final Map<String, Set<Connection>> byTarget = new ConcurrentHashMap<>();

    public void subscribe(String targetUserId, Connection subscriber) {
        Objects.requireNonNull(targetUserId, "targetUserId");
        Objects.requireNonNull(subscriber, "subscriber");
        byTarget.compute(targetUserId, (target, subscribers) -> {
            Set<Connection> set = subscribers == null ? ConcurrentHashMap.newKeySet() : subscribers;
            set.add(subscriber);
            return set;
        });
    }

    /** Snapshot of the current subscribers of {@code targetUserId}. */
    public Set<Connection> subscribersOf(String targetUserId) {
        Set<Connection> subscribers = byTarget.get(targetUserId);
        return subscribers == null ? Set.of() : Set.copyOf(subscribers);
    }

    public boolean isSubscribed(String targetUserId, Connection subscriber) {
        Set<Connection> subscribers = byTarget.get(targetUserId);
        return subscribers != null && subscribers.contains(subscriber);
    }

    /**
     * Removes {@code subscriber} from every target. Targets left without subscribers are dropped.
     *
     * @return number of targets the subscriber was removed from
     */
    public int unsubscribeAll(Connection subscriber) {
        int[] removed = new int[1];
        for (String target : Set.copyOf(byTarget.keySet())) {
            byTarget.computeIfPresent(target, (key, subscribers) -> {
                if (subscribers.remove(subscriber)) removed[0]++;
                return subscribers.isEmpty() ? null : subscribers;
            });
        }
        return removed[0];
    }

    public Set<String> targets() {
        return Set.copyOf(byTarget.keySet());
    }
}
