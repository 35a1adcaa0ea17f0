package io.socketrelay.server.spi;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous counterpart of {@link ChatStore}.
 *
 * <p>All operations return {@link CompletableFuture} and must not block the calling thread: the
 * broker calls them from transport threads shared by many connections. A failed future is reported
 * to the requesting connection only; it never affects other connections.
 *
 * @see ChatStore
 * @see BlockingToAsyncChatStore
 */
public interface AsyncChatStore {

    CompletableFuture<Optional<Room>> findRoom(String userA, String userB);

    CompletableFuture<Room> createRoom(String senderId, String receiverId);

    CompletableFuture<Chat> createChat(Room room, String senderId, String receiverId, String message, List<String> images);

    CompletableFuture<List<Chat>> listChats(Room room);

    CompletableFuture<Integer> markRead(Room room, String receiverId);

    CompletableFuture<List<Chat>> listUnread(Room room, String receiverId);

    CompletableFuture<Void> updateUserLocation(String userId, double lat, double lng);

    CompletableFuture<List<RoomWithLastChat>> listRoomsFor(String userId);

    CompletableFuture<List<UserSummary>> userSummaries(Collection<String> userIds);
}
