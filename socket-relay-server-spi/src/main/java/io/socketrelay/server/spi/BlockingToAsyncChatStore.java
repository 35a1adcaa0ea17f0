package io.socketrelay.server.spi;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Adapter that wraps a blocking {@link ChatStore} to provide the {@link AsyncChatStore} interface.
 *
 * <p>This adapter runs all blocking operations on the provided {@link Executor}. Use a pool sized for
 * the store's connection limit; a slow store call then only occupies one pool thread and never a
 * transport thread.
 *
 * <p>Example usage:
 * <pre>{@code
 * ChatStore blocking = new InMemoryChatStore();
 * AsyncChatStore async = new BlockingToAsyncChatStore(blocking, Executors.newFixedThreadPool(8));
 * }</pre>
 *
 * @see AsyncChatStore
 * @see ChatStore
 */
public final class BlockingToAsyncChatStore implements AsyncChatStore {

    private final ChatStore delegate;
    private final Executor executor;

    /**
     * Creates an async adapter for the given blocking store.
     *
     * @param delegate the blocking store to wrap
     * @param executor executor to run blocking operations on
     */
    public BlockingToAsyncChatStore(ChatStore delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<Optional<Room>> findRoom(String userA, String userB) {
        return call(() -> delegate.findRoom(userA, userB));
    }

    @Override
    public CompletableFuture<Room> createRoom(String senderId, String receiverId) {
        return call(() -> delegate.createRoom(senderId, receiverId));
    }

    @Override
    public CompletableFuture<Chat> createChat(Room room, String senderId, String receiverId, String message, List<String> images) {
        return call(() -> delegate.createChat(room, senderId, receiverId, message, images));
    }

    @Override
    public CompletableFuture<List<Chat>> listChats(Room room) {
        return call(() -> delegate.listChats(room));
    }

    @Override
    public CompletableFuture<Integer> markRead(Room room, String receiverId) {
        return call(() -> delegate.markRead(room, receiverId));
    }

    @Override
    public CompletableFuture<List<Chat>> listUnread(Room room, String receiverId) {
        return call(() -> delegate.listUnread(room, receiverId));
    }

    @Override
    public CompletableFuture<Void> updateUserLocation(String userId, double lat, double lng) {
        return call(() -> {
            delegate.updateUserLocation(userId, lat, lng);
            return null;
        });
    }

    @Override
    public CompletableFuture<List<RoomWithLastChat>> listRoomsFor(String userId) {
        return call(() -> delegate.listRoomsFor(userId));
    }

    @Override
    public CompletableFuture<List<UserSummary>> userSummaries(Collection<String> userIds) {
        return call(() -> delegate.userSummaries(userIds));
    }

    /**
     * Returns the underlying blocking store.
     */
    public ChatStore delegate() {
        return delegate;
    }

    /**
     * Returns the executor used for async operations.
     */
    public Executor executor() {
        return executor;
    }

    private <T> CompletableFuture<T> call(StoreCall<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.run();
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
    }

    private static RuntimeException wrapException(Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        return new AsyncStorageException(e);
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T run() throws Exception;
    }

    /**
     * Exception wrapper for checked exceptions from blocking store operations.
     */
    public static final class AsyncStorageException extends RuntimeException {
        public AsyncStorageException(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }
}
