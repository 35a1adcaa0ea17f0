package io.socketrelay.core;

/**
 * Socket Relay protocol constants (event tags, logical paths and client-facing error texts).
 *
 * <p>Every envelope is a JSON object tagged by its {@code event} field. Inbound envelopes carry
 * event-specific fields at the top level; outbound envelopes carry either {@code data} or, for
 * {@code error} and {@code info}, a {@code message}.
 */
public final class Protocol {
    private Protocol() {}

    // Inbound events
    public static final String EVENT_AUTHENTICATE = "authenticate";
    public static final String EVENT_LOCATION_UPDATE = "locationUpdate";
    public static final String EVENT_SUBSCRIBE_TO_LOCATION = "subscribeToLocation";
    public static final String EVENT_MESSAGE = "message";
    public static final String EVENT_FETCH_CHATS = "fetchChats";
    public static final String EVENT_UNREAD_MESSAGES = "unReadMessages";
    public static final String EVENT_MESSAGE_LIST = "messageList";
    public static final String EVENT_CALL_USER = "callUser";
    public static final String EVENT_ANSWER_CALL = "answerCall";
    public static final String EVENT_ICE_CANDIDATE = "iceCandidate";
    public static final String EVENT_DISCONNECT_CALL = "disconnectCall";

    // Outbound-only events
    public static final String EVENT_INFO = "info";
    public static final String EVENT_ERROR = "error";
    public static final String EVENT_AUTHENTICATED = "authenticated";
    public static final String EVENT_USER_STATUS = "userStatus";
    public static final String EVENT_INCOMING_CALL = "incomingCall";
    public static final String EVENT_CALL_ANSWERED = "callAnswered";
    public static final String EVENT_CALL_DISCONNECTED = "callDisconnected";
    public static final String EVENT_NO_ROOM_FOUND = "noRoomFound";
    public static final String EVENT_NO_UNREAD_MESSAGES = "noUnreadMessages";

    // Logical paths
    public static final String PATH_DEFAULT = "/";
    public static final String PATH_DRIVER_LOCATION = "/driver-location";

    // Client-facing messages
    public static final String MSG_WELCOME = "Connected to server. Please authenticate.";
    public static final String MSG_AUTHENTICATE_FIRST = "Please authenticate first";
    public static final String MSG_TOKEN_REQUIRED = "Token is required for authentication";
    public static final String MSG_INVALID_TOKEN = "Invalid token";
    public static final String MSG_INVALID_FORMAT = "Invalid message format";
    public static final String MSG_UNKNOWN_EVENT = "Unknown event type";
    public static final String MSG_INVALID_CALL_TYPE = "Invalid or missing callType. Must be 'audio' or 'video'.";
    public static final String MSG_RECIPIENT_UNAVAILABLE = "Host not available or invalid recipient.";
    public static final String MSG_CALL_DISCONNECTED = "Call has been disconnected.";
    public static final String MSG_INVALID_MESSAGE_PAYLOAD = "Invalid message payload";
    public static final String MSG_SEND_FAILED = "Failed to send message";
    public static final String MSG_FETCH_CHATS_FAILED = "Failed to fetch chats";
    public static final String MSG_FETCH_UNREAD_FAILED = "Failed to fetch unread messages";
    public static final String MSG_MESSAGE_LIST_FAILED = "Failed to fetch message list";

    /** Error text sent when a connection whose role may not place calls sends {@code callUser}. */
    public static String onlyRoleMayCall(Role role) {
        return "Only " + role.wireName() + " can initiate a call.";
    }
}
