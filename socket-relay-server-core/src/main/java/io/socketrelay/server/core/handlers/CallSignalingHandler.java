package io.socketrelay.server.core.handlers;

import io.socketrelay.core.InboundEvent;
import io.socketrelay.core.OutboundEnvelope;
import io.socketrelay.core.Protocol;
import io.socketrelay.core.Role;
import io.socketrelay.server.core.Connection;
import io.socketrelay.server.core.ConnectionRegistry;
import io.socketrelay.server.core.EnvelopeWriter;
import io.socketrelay.server.core.Payloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Relays call signaling between two connected identities. Offers, answers and ICE candidates are
 * opaque and forwarded untouched.
 *
 * <p>Only {@code callerRole} may place calls and only {@code calleeRole} may receive them. Answers,
 * candidates and disconnects for peers that are offline are dropped without telling the sender.
 */
public final class CallSignalingHandler {
    private static final Logger log = LoggerFactory.getLogger(CallSignalingHandler.class);

    private final ConnectionRegistry registry;
    private final EnvelopeWriter writer;
    private final Role callerRole;
    private final Role calleeRole;

    public CallSignalingHandler(ConnectionRegistry registry, EnvelopeWriter writer, Role callerRole, Role calleeRole) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.callerRole = Objects.requireNonNull(callerRole, "callerRole");
        this.calleeRole = Objects.requireNonNull(calleeRole, "calleeRole");
    }

    public void handleCall(Connection caller, InboundEvent.CallUser event) {
        if (caller.role() != callerRole) {
            writer.error(caller, Protocol.onlyRoleMayCall(callerRole));
            return;
        }
        if (event.callType() == null) {
            writer.error(caller, Protocol.MSG_INVALID_CALL_TYPE);
            return;
        }
        Optional<Connection> callee = registry.lookup(event.toUserId())
                .filter(Connection::isOpen)
                .filter(candidate -> candidate.role() == calleeRole);
        if (callee.isEmpty()) {
            log.info("Call from {} to {} rejected: recipient not available", caller, event.toUserId());
            writer.error(caller, Protocol.MSG_RECIPIENT_UNAVAILABLE);
            return;
        }
        writer.send(callee.get(), OutboundEnvelope.of(Protocol.EVENT_INCOMING_CALL,
                new Payloads.IncomingCall(caller.identityId(), event.offer(), event.callType().wireName())));
        log.info("{} call from {} delivered to {}", event.callType().wireName(), caller, callee.get());
    }

    public void handleAnswer(Connection sender, InboundEvent.AnswerCall event) {
        relay(sender, event.toUserId(), OutboundEnvelope.of(Protocol.EVENT_CALL_ANSWERED,
                new Payloads.CallAnswered(sender.identityId(), event.answer())));
    }

    public void handleIceCandidate(Connection sender, InboundEvent.IceCandidate event) {
        relay(sender, event.toUserId(), OutboundEnvelope.of(Protocol.EVENT_ICE_CANDIDATE,
                new Payloads.IceCandidateRelay(sender.identityId(), event.candidate())));
    }

    public void handleDisconnect(Connection sender, InboundEvent.DisconnectCall event) {
        relay(sender, event.toUserId(), OutboundEnvelope.of(Protocol.EVENT_CALL_DISCONNECTED,
                new Payloads.CallDisconnected(sender.identityId(), Protocol.MSG_CALL_DISCONNECTED)));
    }

    private void relay(Connection sender, String toUserId, OutboundEnvelope envelope) {
        Optional<Connection> peer = registry.lookup(toUserId).filter(Connection::isOpen);
        if (peer.isEmpty()) {
            log.debug("{} from {} dropped: {} not connected", envelope.event(), sender, toUserId);
            return;
        }
        writer.send(peer.get(), envelope);
        log.debug("{} relayed from {} to {}", envelope.event(), sender, peer.get());
    }
}
