package io.socketrelay.server.spi;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One persisted chat message.
 */
public record Chat(
        String id,
        String roomId,
        String senderId,
        String receiverId,
        String message,
        List<String> images,
        boolean isRead,
        Instant createdAt
) {

    public Chat {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(roomId, "roomId");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(receiverId, "receiverId");
        Objects.requireNonNull(createdAt, "createdAt");
        images = images == null ? List.of() : List.copyOf(images);
    }

    public Chat read() {
        return isRead ? this : new Chat(id, roomId, senderId, receiverId, message, images, true, createdAt);
    }
}
