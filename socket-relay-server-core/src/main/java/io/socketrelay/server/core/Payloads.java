package io.socketrelay.server.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.socketrelay.server.spi.Chat;
import io.socketrelay.server.spi.UserSummary;

import java.util.List;

/**
 * {@code data} shapes of the outbound events.
 */
public final class Payloads {
    private Payloads() {}

    public record Authenticated(String userId, String role, boolean success) {}

    public record UserStatus(String userId, boolean isOnline) {}

    public record LocationBroadcast(String userId, double lat, double lng) {}

    public record IncomingCall(String fromUserId, Object offer, String callType) {}

    public record CallAnswered(String fromUserId, Object answer) {}

    public record IceCandidateRelay(String fromUserId, Object candidate) {}

    public record CallDisconnected(String fromUserId, String message) {}

    public record UnreadMessages(List<Chat> messages, int count) {}

    /** Both keys are always written; a missing profile or message is sent as null. */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record ConversationPreview(UserSummary user, Chat lastMessage) {}
}
