package io.socketrelay.server.spi;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockingToAsyncChatStoreTest {

    private static final Room ROOM = new Room("r1", "alice", "bob", Instant.parse("2025-01-01T00:00:00Z"));

    @Test
    void runsBlockingCallsOnTheExecutor() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "store-worker"));
        try {
            RecordingStore blocking = new RecordingStore();
            BlockingToAsyncChatStore store = new BlockingToAsyncChatStore(blocking, executor);

            assertThat(store.findRoom("alice", "bob").get()).contains(ROOM);
            assertThat(blocking.lastThread).isEqualTo("store-worker");
            assertThat(store.markRead(ROOM, "bob").get()).isEqualTo(3);
            assertThat(store.updateUserLocation("alice", 1.0, 2.0).get()).isNull();
            assertThat(store.delegate()).isSameAs(blocking);
            assertThat(store.executor()).isSameAs(executor);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void checkedFailuresAreWrapped() {
        BlockingToAsyncChatStore store = new BlockingToAsyncChatStore(new RecordingStore(), Runnable::run);

        CompletableFuture<List<Chat>> chats = store.listChats(ROOM);

        assertThatThrownBy(chats::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(BlockingToAsyncChatStore.AsyncStorageException.class)
                .hasRootCauseInstanceOf(IOException.class);
    }

    @Test
    void uncheckedFailuresPassThrough() {
        BlockingToAsyncChatStore store = new BlockingToAsyncChatStore(new RecordingStore(), Runnable::run);

        assertThatThrownBy(() -> store.createRoom("alice", "bob").get())
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    private static final class RecordingStore implements ChatStore {
        volatile String lastThread;

        @Override
        public Optional<Room> findRoom(String userA, String userB) {
            lastThread = Thread.currentThread().getName();
            return Optional.of(ROOM);
        }

        @Override
        public Room createRoom(String senderId, String receiverId) {
            throw new IllegalStateException("read only");
        }

        @Override
        public Chat createChat(Room room, String senderId, String receiverId, String message, List<String> images) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<Chat> listChats(Room room) throws IOException {
            throw new IOException("disk gone");
        }

        @Override
        public int markRead(Room room, String receiverId) {
            return 3;
        }

        @Override
        public List<Chat> listUnread(Room room, String receiverId) {
            return List.of();
        }

        @Override
        public void updateUserLocation(String userId, double lat, double lng) {
        }

        @Override
        public List<RoomWithLastChat> listRoomsFor(String userId) {
            return List.of();
        }

        @Override
        public List<UserSummary> userSummaries(Collection<String> userIds) {
            return List.of();
        }
    }
}
