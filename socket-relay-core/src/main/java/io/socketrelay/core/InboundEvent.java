package io.socketrelay.core;

import java.util.List;

/**
 * Typed, validated inbound event.
 *
 * <p>Each variant only exists once its required fields are present. Envelopes that name a known event
 * but miss a required field become {@link Rejected}; envelopes with an unrecognised tag become
 * {@link Unknown}. Both still carry their event name so the authentication gate can be applied
 * before any validation outcome is reported.
 */
public sealed interface InboundEvent permits
        InboundEvent.Authenticate,
        InboundEvent.LocationUpdate,
        InboundEvent.SubscribeToLocation,
        InboundEvent.SendMessage,
        InboundEvent.FetchChats,
        InboundEvent.UnreadMessages,
        InboundEvent.MessageList,
        InboundEvent.CallUser,
        InboundEvent.AnswerCall,
        InboundEvent.IceCandidate,
        InboundEvent.DisconnectCall,
        InboundEvent.Unknown,
        InboundEvent.Rejected {

    /** Event tag as sent by the client (may be null for {@link Unknown}). */
    String name();

    record Authenticate(String token) implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_AUTHENTICATE;
        }
    }

    record LocationUpdate(double lat, double lng) implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_LOCATION_UPDATE;
        }
    }

    record SubscribeToLocation(String targetUserId) implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_SUBSCRIBE_TO_LOCATION;
        }
    }

    record SendMessage(String receiverId, String message, List<String> images) implements InboundEvent {
        public SendMessage {
            images = images == null ? List.of() : List.copyOf(images);
        }

        @Override
        public String name() {
            return Protocol.EVENT_MESSAGE;
        }
    }

    record FetchChats(String receiverId) implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_FETCH_CHATS;
        }
    }

    record UnreadMessages(String receiverId) implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_UNREAD_MESSAGES;
        }
    }

    record MessageList() implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_MESSAGE_LIST;
        }
    }

    /**
     * Call offer. {@code toUserId} and {@code callType} are nullable: the caller's role is checked
     * before either of them, so their absence is reported by the call handler, not here.
     */
    record CallUser(String toUserId, Object offer, CallType callType) implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_CALL_USER;
        }
    }

    record AnswerCall(String toUserId, Object answer) implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_ANSWER_CALL;
        }
    }

    record IceCandidate(String toUserId, Object candidate) implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_ICE_CANDIDATE;
        }
    }

    record DisconnectCall(String toUserId) implements InboundEvent {
        @Override
        public String name() {
            return Protocol.EVENT_DISCONNECT_CALL;
        }
    }

    record Unknown(String name) implements InboundEvent {}

    /**
     * Known event with a missing or invalid required field.
     *
     * @param name event tag
     * @param errorMessage client-facing error text, or null when the event is dropped silently
     */
    record Rejected(String name, String errorMessage) implements InboundEvent {
        public boolean silent() {
            return errorMessage == null;
        }
    }

    /**
     * Validates a wire envelope and narrows it to its typed variant.
     */
    static InboundEvent from(WireEnvelope wire) {
        String event = wire.event();
        if (event == null) return new Unknown(null);

        switch (event) {
            case Protocol.EVENT_AUTHENTICATE:
                if (isBlank(wire.token())) return new Rejected(event, Protocol.MSG_TOKEN_REQUIRED);
                return new Authenticate(wire.token());
            case Protocol.EVENT_LOCATION_UPDATE:
                if (wire.lat() == null || wire.lng() == null) return new Rejected(event, null);
                return new LocationUpdate(wire.lat(), wire.lng());
            case Protocol.EVENT_SUBSCRIBE_TO_LOCATION:
                if (isBlank(wire.targetUserId())) return new Rejected(event, null);
                return new SubscribeToLocation(wire.targetUserId());
            case Protocol.EVENT_MESSAGE:
                if (isBlank(wire.receiverId()) || isBlank(wire.message()) || hasNull(wire.images())) {
                    return new Rejected(event, Protocol.MSG_INVALID_MESSAGE_PAYLOAD);
                }
                return new SendMessage(wire.receiverId(), wire.message(), wire.images());
            case Protocol.EVENT_FETCH_CHATS:
                if (isBlank(wire.receiverId())) return new Rejected(event, null);
                return new FetchChats(wire.receiverId());
            case Protocol.EVENT_UNREAD_MESSAGES:
                if (isBlank(wire.receiverId())) return new Rejected(event, null);
                return new UnreadMessages(wire.receiverId());
            case Protocol.EVENT_MESSAGE_LIST:
                return new MessageList();
            case Protocol.EVENT_CALL_USER:
                return new CallUser(blankToNull(wire.toUserId()), wire.offer(),
                        CallType.fromWire(wire.callType()).orElse(null));
            case Protocol.EVENT_ANSWER_CALL:
                if (isBlank(wire.toUserId())) return new Rejected(event, null);
                return new AnswerCall(wire.toUserId(), wire.answer());
            case Protocol.EVENT_ICE_CANDIDATE:
                if (isBlank(wire.toUserId())) return new Rejected(event, null);
                return new IceCandidate(wire.toUserId(), wire.candidate());
            case Protocol.EVENT_DISCONNECT_CALL:
                if (isBlank(wire.toUserId())) return new Rejected(event, null);
                return new DisconnectCall(wire.toUserId());
            default:
                return new Unknown(event);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static boolean hasNull(List<String> values) {
        return values != null && values.contains(null);
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s;
    }
}
