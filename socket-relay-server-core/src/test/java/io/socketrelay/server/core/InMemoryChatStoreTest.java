package io.socketrelay.server.core;

import io.socketrelay.server.spi.Chat;
import io.socketrelay.server.spi.Room;
import io.socketrelay.server.spi.RoomWithLastChat;
import io.socketrelay.server.spi.UserSummary;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryChatStoreTest {

    @Test
    void roomsAreKeyedByUnorderedPair() {
        InMemoryChatStore store = new InMemoryChatStore();

        Room room = store.createRoom("alice", "bob");

        assertThat(store.findRoom("bob", "alice")).contains(room);
        assertThat(store.createRoom("bob", "alice")).isEqualTo(room);
        assertThat(store.findRoom("alice", "carol")).isEmpty();
        assertThat(store.roomCount()).isEqualTo(1);
    }

    @Test
    void chatsAreListedInInsertionOrderAndStartUnread() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        InMemoryChatStore store = new InMemoryChatStore(clock);
        Room room = store.createRoom("alice", "bob");

        Chat first = store.createChat(room, "alice", "bob", "one", null);
        store.createChat(room, "bob", "alice", "two", List.of("img.png"));

        List<Chat> chats = store.listChats(room);
        assertThat(chats).extracting(Chat::message).containsExactly("one", "two");
        assertThat(chats).allMatch(chat -> !chat.isRead());
        assertThat(first.images()).isEmpty();
        assertThat(first.createdAt()).isEqualTo(clock.instant());
        assertThat(room.createdAt()).isEqualTo(clock.instant());
    }

    @Test
    void markReadOnlyTouchesChatsForReceiver() {
        InMemoryChatStore store = new InMemoryChatStore();
        Room room = store.createRoom("alice", "bob");
        store.createChat(room, "alice", "bob", "one", List.of());
        store.createChat(room, "alice", "bob", "two", List.of());
        store.createChat(room, "bob", "alice", "three", List.of());

        assertThat(store.listUnread(room, "bob")).hasSize(2);
        assertThat(store.markRead(room, "bob")).isEqualTo(2);
        assertThat(store.markRead(room, "bob")).isZero();

        assertThat(store.listUnread(room, "bob")).isEmpty();
        assertThat(store.listUnread(room, "alice")).extracting(Chat::message).containsExactly("three");
    }

    @Test
    void listRoomsForReturnsLastChatPerRoom() {
        InMemoryChatStore store = new InMemoryChatStore();
        Room withBob = store.createRoom("alice", "bob");
        Room withCarol = store.createRoom("carol", "alice");
        store.createRoom("bob", "carol");
        store.createChat(withBob, "alice", "bob", "one", List.of());
        store.createChat(withBob, "bob", "alice", "two", List.of());

        List<RoomWithLastChat> rooms = store.listRoomsFor("alice");

        assertThat(rooms).extracting(RoomWithLastChat::room).containsExactly(withBob, withCarol);
        assertThat(rooms.get(0).lastChat().message()).isEqualTo("two");
        assertThat(rooms.get(1).lastChat()).isNull();
    }

    @Test
    void userSummariesSkipUnknownIds() {
        InMemoryChatStore store = new InMemoryChatStore();
        store.putUser(new UserSummary("bob", "Bob", "Builder", null));

        assertThat(store.userSummaries(List.of("bob", "ghost")))
                .extracting(UserSummary::id)
                .containsExactly("bob");
    }

    @Test
    void locationsAreOverwritten() {
        InMemoryChatStore store = new InMemoryChatStore();

        store.updateUserLocation("driver-1", 1.0, 2.0);
        store.updateUserLocation("driver-1", 3.0, 4.0);

        assertThat(store.userLocation("driver-1")).contains(new LocationBook.Position(3.0, 4.0));
    }

    @Test
    void foreignRoomsAreRejected() {
        InMemoryChatStore store = new InMemoryChatStore();
        Room foreign = new Room("nope", "alice", "bob", Instant.now());

        assertThatThrownBy(() -> store.listChats(foreign)).isInstanceOf(IllegalArgumentException.class);
    }
}
