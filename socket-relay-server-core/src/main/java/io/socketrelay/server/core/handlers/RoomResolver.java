package io.socketrelay.server.core.handlers;

import io.socketrelay.server.spi.AsyncChatStore;
import io.socketrelay.server.spi.Room;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Find-or-create of the room of an unordered pair. Concurrent requests for the same pair share one
 * store round trip, so two first messages never create two rooms.
 */
final class RoomResolver {
    private final AsyncChatStore store;
    private final ConcurrentMap<PairKey, CompletableFuture<Room>> inFlight = new ConcurrentHashMap<>();

    RoomResolver(AsyncChatStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    CompletableFuture<Room> resolveOrCreate(String senderId, String receiverId) {
        PairKey key = PairKey.of(senderId, receiverId);
        CompletableFuture<Room> pending = new CompletableFuture<>();
        CompletableFuture<Room> existing = inFlight.putIfAbsent(key, pending);
        if (existing != null) return existing;

        CompletableFuture<Room> lookup;
        try {
            lookup = store.findRoom(senderId, receiverId).thenCompose(found -> found
                    .map(CompletableFuture::completedFuture)
                    .orElseGet(() -> store.createRoom(senderId, receiverId)));
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        lookup.whenComplete((room, error) -> {
            inFlight.remove(key, pending);
            if (error != null) {
                pending.completeExceptionally(error);
            } else {
                pending.complete(room);
            }
        });
        return pending;
    }

    int inFlight() {
        return inFlight.size();
    }

    record PairKey(String low, String high) {
        static PairKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }
    }
}
