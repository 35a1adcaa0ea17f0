package io.socketrelay.server.core;

import io.socketrelay.core.InboundEvent;
import io.socketrelay.core.Protocol;
import io.socketrelay.core.RelayException;
import io.socketrelay.server.core.handlers.AuthenticateHandler;
import io.socketrelay.server.core.handlers.CallSignalingHandler;
import io.socketrelay.server.core.handlers.ChatHandler;
import io.socketrelay.server.core.handlers.LocationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decodes each inbound frame, applies the authentication gate and the path's route table, and
 * dispatches to the event handler.
 *
 * <p>Every failure is answered with an {@code error} envelope on the same connection; nothing is
 * thrown back to the transport.
 */
public final class MessageRouter {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final EnvelopeDecoder decoder;
    private final EnvelopeWriter writer;
    private final RouteTable routes;
    private final AuthenticateHandler authenticate;
    private final LocationHandler location;
    private final CallSignalingHandler calls;
    private final ChatHandler chats;

    public MessageRouter(EnvelopeDecoder decoder, EnvelopeWriter writer, RouteTable routes,
                         AuthenticateHandler authenticate, LocationHandler location,
                         CallSignalingHandler calls, ChatHandler chats) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.routes = Objects.requireNonNull(routes, "routes");
        this.authenticate = Objects.requireNonNull(authenticate, "authenticate");
        this.location = Objects.requireNonNull(location, "location");
        this.calls = Objects.requireNonNull(calls, "calls");
        this.chats = Objects.requireNonNull(chats, "chats");
    }

    public void route(Connection connection, String text) {
        InboundEvent event;
        try {
            event = decoder.decode(text);
        } catch (RelayException.MalformedEnvelope e) {
            log.debug("Malformed frame on {}: {}", connection, e.getMessage());
            writer.error(connection, Protocol.MSG_INVALID_FORMAT);
            return;
        }

        if (!connection.isAuthenticated() && !Protocol.EVENT_AUTHENTICATE.equals(event.name())) {
            writer.error(connection, Protocol.MSG_AUTHENTICATE_FIRST);
            return;
        }
        if (!routes.permits(connection.path(), event.name())) {
            log.debug("{} is not routed on path {}", event.name(), connection.path());
            writer.error(connection, Protocol.MSG_UNKNOWN_EVENT);
            return;
        }

        try {
            dispatch(connection, event);
        } catch (RuntimeException e) {
            log.error("Failed to handle {} on {}", event.name(), connection, e);
            writer.error(connection, Protocol.MSG_INVALID_FORMAT);
        }
    }

    private void dispatch(Connection connection, InboundEvent event) {
        if (event instanceof InboundEvent.Authenticate auth) {
            authenticate.handle(connection, auth);
        } else if (event instanceof InboundEvent.LocationUpdate update) {
            location.handleUpdate(connection, update);
        } else if (event instanceof InboundEvent.SubscribeToLocation subscribe) {
            location.handleSubscribe(connection, subscribe);
        } else if (event instanceof InboundEvent.SendMessage message) {
            chats.handleMessage(connection, message);
        } else if (event instanceof InboundEvent.FetchChats fetch) {
            chats.handleFetchChats(connection, fetch);
        } else if (event instanceof InboundEvent.UnreadMessages unread) {
            chats.handleUnreadMessages(connection, unread);
        } else if (event instanceof InboundEvent.MessageList list) {
            chats.handleMessageList(connection, list);
        } else if (event instanceof InboundEvent.CallUser call) {
            calls.handleCall(connection, call);
        } else if (event instanceof InboundEvent.AnswerCall answer) {
            calls.handleAnswer(connection, answer);
        } else if (event instanceof InboundEvent.IceCandidate candidate) {
            calls.handleIceCandidate(connection, candidate);
        } else if (event instanceof InboundEvent.DisconnectCall disconnect) {
            calls.handleDisconnect(connection, disconnect);
        } else if (event instanceof InboundEvent.Rejected rejected) {
            if (rejected.errorMessage() != null) {
                writer.error(connection, rejected.errorMessage());
            } else {
                log.debug("Dropped {} from {}: required field missing", rejected.name(), connection);
            }
        } else {
            log.info("Unknown event {} from {}", event.name(), connection);
            writer.error(connection, Protocol.MSG_UNKNOWN_EVENT);
        }
    }
}
