package io.socketrelay.server.spi;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for rooms, chats, user profiles and last-known locations.
 *
 * <p>This SPI is intentionally minimal and blocking. The broker never calls it on a transport thread;
 * wrap it in {@link BlockingToAsyncChatStore} (or implement {@link AsyncChatStore} directly).
 */
public interface ChatStore {

    /**
     * Find the room of an unordered pair.
     */
    Optional<Room> findRoom(String userA, String userB) throws Exception;

    /**
     * Create a room for a pair that has none.
     */
    Room createRoom(String senderId, String receiverId) throws Exception;

    /**
     * Persist a chat message. New chats are unread.
     *
     * @param images image references (never null, may be empty)
     */
    Chat createChat(Room room, String senderId, String receiverId, String message, List<String> images) throws Exception;

    /**
     * Chat history of a room, oldest first.
     */
    List<Chat> listChats(Room room) throws Exception;

    /**
     * Mark every chat of the room addressed to {@code receiverId} as read.
     *
     * @return number of chats that changed state
     */
    int markRead(Room room, String receiverId) throws Exception;

    /**
     * Unread chats of the room addressed to {@code receiverId}, oldest first.
     */
    List<Chat> listUnread(Room room, String receiverId) throws Exception;

    /**
     * Persist the last known position of a user.
     */
    void updateUserLocation(String userId, double lat, double lng) throws Exception;

    /**
     * Every room the user takes part in, each with its most recent chat.
     */
    List<RoomWithLastChat> listRoomsFor(String userId) throws Exception;

    /**
     * Profile summaries for the given ids. Unknown ids are skipped.
     */
    List<UserSummary> userSummaries(Collection<String> userIds) throws Exception;
}
