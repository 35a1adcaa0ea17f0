package io.socketrelay.server.core;

import io.socketrelay.server.core.LocationBook.Position;
import io.socketrelay.server.spi.Chat;
import io.socketrelay.server.spi.ChatStore;
import io.socketrelay.server.spi.Room;
import io.socketrelay.server.spi.RoomWithLastChat;
import io.socketrelay.server.spi.UserSummary;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference in-memory {@link ChatStore}.
 *
 * <p>Good for unit tests and examples. Not intended for production.
 *
 * <p>{@link #createRoom} is idempotent per unordered pair: a second call returns the existing room.
 * {@link #listRoomsFor} lists rooms in creation order.
 */
public final class InMemoryChatStore implements ChatStore {

    private final Map<String, RoomState> roomsByPair = new ConcurrentHashMap<>();
    private final Map<String, UserSummary> users = new ConcurrentHashMap<>();
    private final Map<String, Position> userLocations = new ConcurrentHashMap<>();
    private final AtomicLong roomSequence = new AtomicLong();
    private final Clock clock;

    public InMemoryChatStore() {
        this(Clock.systemUTC());
    }

    public InMemoryChatStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Adds or replaces a user profile. */
    public void putUser(UserSummary user) {
        users.put(user.id(), user);
    }

    public Optional<Position> userLocation(String userId) {
        return Optional.ofNullable(userLocations.get(userId));
    }

    public int roomCount() {
        return roomsByPair.size();
    }

    @Override
    public Optional<Room> findRoom(String userA, String userB) {
        RoomState state = roomsByPair.get(pairKey(userA, userB));
        return state == null ? Optional.empty() : Optional.of(state.room);
    }

    @Override
    public Room createRoom(String senderId, String receiverId) {
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(receiverId, "receiverId");
        return roomsByPair.computeIfAbsent(pairKey(senderId, receiverId),
                key -> new RoomState(new Room(UUID.randomUUID().toString(), senderId, receiverId, clock.instant()),
                        roomSequence.incrementAndGet())).room;
    }

    @Override
    public Chat createChat(Room room, String senderId, String receiverId, String message, List<String> images) {
        RoomState state = stateOf(room);
        Instant now = clock.instant();
        Chat chat = new Chat(UUID.randomUUID().toString(), room.id(), senderId, receiverId, message, images, false, now);
        state.lock.lock();
        try {
            state.chats.add(chat);
        } finally {
            state.lock.unlock();
        }
        return chat;
    }

    @Override
    public List<Chat> listChats(Room room) {
        RoomState state = stateOf(room);
        state.lock.lock();
        try {
            return List.copyOf(state.chats);
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    public int markRead(Room room, String receiverId) {
        RoomState state = stateOf(room);
        state.lock.lock();
        try {
            int changed = 0;
            for (int i = 0; i < state.chats.size(); i++) {
                Chat chat = state.chats.get(i);
                if (!chat.isRead() && chat.receiverId().equals(receiverId)) {
                    state.chats.set(i, chat.read());
                    changed++;
                }
            }
            return changed;
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    public List<Chat> listUnread(Room room, String receiverId) {
        RoomState state = stateOf(room);
        state.lock.lock();
        try {
            List<Chat> unread = new ArrayList<>();
            for (Chat chat : state.chats) {
                if (!chat.isRead() && chat.receiverId().equals(receiverId)) unread.add(chat);
            }
            return unread;
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    public void updateUserLocation(String userId, double lat, double lng) {
        userLocations.put(Objects.requireNonNull(userId, "userId"), new Position(lat, lng));
    }

    @Override
    public List<RoomWithLastChat> listRoomsFor(String userId) {
        List<RoomState> involved = new ArrayList<>();
        for (RoomState state : roomsByPair.values()) {
            if (state.room.involves(userId)) involved.add(state);
        }
        involved.sort(Comparator.comparingLong(state -> state.sequence));

        List<RoomWithLastChat> result = new ArrayList<>(involved.size());
        for (RoomState state : involved) {
            state.lock.lock();
            try {
                Chat last = state.chats.isEmpty() ? null : state.chats.get(state.chats.size() - 1);
                result.add(new RoomWithLastChat(state.room, last));
            } finally {
                state.lock.unlock();
            }
        }
        return result;
    }

    @Override
    public List<UserSummary> userSummaries(Collection<String> userIds) {
        List<UserSummary> result = new ArrayList<>();
        for (String id : userIds) {
            UserSummary user = users.get(id);
            if (user != null) result.add(user);
        }
        return result;
    }

    private RoomState stateOf(Room room) {
        Objects.requireNonNull(room, "room");
        RoomState state = roomsByPair.get(pairKey(room.senderId(), room.receiverId()));
        if (state == null || !state.room.id().equals(room.id())) {
            throw new IllegalArgumentException("unknown room: " + room.id());
        }
        return state;
    }

    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + '\u0000' + b : b + '\u0000' + a;
    }

    private static final class RoomState {
        final Room room;
        final List<Chat> chats = new ArrayList<>();
        final ReentrantLock lock = new ReentrantLock();
        final long sequence;

        RoomState(Room room, long sequence) {
            this.room = room;
            this.sequence = sequence;
        }
    }
}
