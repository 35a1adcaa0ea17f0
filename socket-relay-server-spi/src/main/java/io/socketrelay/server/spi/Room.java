package io.socketrelay.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable pairing of two identities that groups their chat messages.
 *
 * <p>The pair is unordered: {@code senderId} is only whoever wrote first.
 */
public record Room(String id, String senderId, String receiverId, Instant createdAt) {

    public Room {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(receiverId, "receiverId");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean involves(String userId) {
        return senderId.equals(userId) || receiverId.equals(userId);
    }

    public boolean connects(String userA, String userB) {
        return (senderId.equals(userA) && receiverId.equals(userB))
                || (senderId.equals(userB) && receiverId.equals(userA));
    }

    /** The other participant, as seen from {@code userId}. */
    public String counterpartOf(String userId) {
        return senderId.equals(userId) ? receiverId : senderId;
    }
}
