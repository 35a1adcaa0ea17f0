package io.socketrelay.server.core.handlers;

import io.socketrelay.core.InboundEvent;
import io.socketrelay.core.OutboundEnvelope;
import io.socketrelay.core.Protocol;
import io.socketrelay.server.core.Connection;
import io.socketrelay.server.core.ConnectionRegistry;
import io.socketrelay.server.core.EnvelopeWriter;
import io.socketrelay.server.core.Payloads;
import io.socketrelay.server.spi.AsyncChatStore;
import io.socketrelay.server.spi.Room;
import io.socketrelay.server.spi.RoomWithLastChat;
import io.socketrelay.server.spi.UserSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Chat events backed by the {@link AsyncChatStore}. Replies are sent when the store completes; store
 * failures reach the requesting connection as a generic error and nobody else.
 */
public final class ChatHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatHandler.class);

    private final AsyncChatStore store;
    private final ConnectionRegistry registry;
    private final EnvelopeWriter writer;
    private final RoomResolver rooms;

    public ChatHandler(AsyncChatStore store, ConnectionRegistry registry, EnvelopeWriter writer) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.rooms = new RoomResolver(store);
    }

    /**
     * Persists the chat, delivers it to the receiver when connected and echoes it to the sender.
     */
    public void handleMessage(Connection sender, InboundEvent.SendMessage event) {
        String senderId = sender.identityId();
        rooms.resolveOrCreate(senderId, event.receiverId())
                .thenCompose(room -> store.createChat(room, senderId, event.receiverId(), event.message(), event.images()))
                .whenComplete((chat, error) -> {
                    if (error != null) {
                        log.warn("Failed to store message from {} to {}: {}", senderId, event.receiverId(),
                                Failures.describe(error));
                        writer.error(sender, Protocol.MSG_SEND_FAILED);
                        return;
                    }
                    OutboundEnvelope envelope = OutboundEnvelope.of(Protocol.EVENT_MESSAGE, chat);
                    registry.lookup(event.receiverId())
                            .filter(receiver -> receiver != sender)
                            .ifPresent(receiver -> writer.send(receiver, envelope));
                    writer.send(sender, envelope);
                    log.debug("Message {} from {} stored in room {}", chat.id(), senderId, chat.roomId());
                });
    }

    /**
     * Room history, oldest first. Everything addressed to the requester is marked read before the
     * history is sent.
     */
    public void handleFetchChats(Connection requester, InboundEvent.FetchChats event) {
        String me = requester.identityId();
        call(() -> store.findRoom(me, event.receiverId()).thenCompose(room -> {
            if (room.isEmpty()) return CompletableFuture.completedFuture(OutboundEnvelope.bare(Protocol.EVENT_NO_ROOM_FOUND));
            Room found = room.get();
            return store.listChats(found).thenCompose(chats -> store.markRead(found, me)
                    .thenApply(changed -> OutboundEnvelope.of(Protocol.EVENT_FETCH_CHATS, chats)));
        })).whenComplete(reply(requester, Protocol.EVENT_FETCH_CHATS, Protocol.MSG_FETCH_CHATS_FAILED));
    }

    public void handleUnreadMessages(Connection requester, InboundEvent.UnreadMessages event) {
        String me = requester.identityId();
        call(() -> store.findRoom(me, event.receiverId()).thenCompose(room -> {
            if (room.isEmpty()) {
                return CompletableFuture.completedFuture(OutboundEnvelope.of(Protocol.EVENT_NO_UNREAD_MESSAGES, List.of()));
            }
            return store.listUnread(room.get(), me).thenApply(unread -> OutboundEnvelope.of(
                    Protocol.EVENT_UNREAD_MESSAGES, new Payloads.UnreadMessages(unread, unread.size())));
        })).whenComplete(reply(requester, Protocol.EVENT_UNREAD_MESSAGES, Protocol.MSG_FETCH_UNREAD_FAILED));
    }

    /**
     * One preview per room of the requester: the counterpart's profile and the most recent chat.
     */
    public void handleMessageList(Connection requester, InboundEvent.MessageList event) {
        String me = requester.identityId();
        call(() -> store.listRoomsFor(me).thenCompose(rooms -> {
            List<String> counterparts = rooms.stream()
                    .map(entry -> entry.room().counterpartOf(me))
                    .distinct()
                    .collect(Collectors.toList());
            return store.userSummaries(counterparts).thenApply(users -> {
                Map<String, UserSummary> byId = users.stream()
                        .collect(Collectors.toMap(UserSummary::id, Function.identity(), (a, b) -> a));
                List<Payloads.ConversationPreview> previews = new ArrayList<>(rooms.size());
                for (RoomWithLastChat entry : rooms) {
                    previews.add(new Payloads.ConversationPreview(
                            byId.get(entry.room().counterpartOf(me)), entry.lastChat()));
                }
                return OutboundEnvelope.of(Protocol.EVENT_MESSAGE_LIST, previews);
            });
        })).whenComplete(reply(requester, Protocol.EVENT_MESSAGE_LIST, Protocol.MSG_MESSAGE_LIST_FAILED));
    }

    private static CompletableFuture<OutboundEnvelope> call(Supplier<CompletableFuture<OutboundEnvelope>> work) {
        try {
            return work.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private BiConsumer<OutboundEnvelope, Throwable> reply(Connection requester, String event, String failureMessage) {
        return (envelope, error) -> {
            if (error != null) {
                log.warn("{} failed for {}: {}", event, requester, Failures.describe(error));
                writer.error(requester, failureMessage);
                return;
            }
            writer.send(requester, envelope);
        };
    }
}
