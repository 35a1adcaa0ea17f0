package io.socketrelay.server.core.handlers;

import io.socketrelay.core.Identity;
import io.socketrelay.core.InboundEvent;
import io.socketrelay.core.OutboundEnvelope;
import io.socketrelay.core.Protocol;
import io.socketrelay.core.RelayException;
import io.socketrelay.server.core.Connection;
import io.socketrelay.server.core.ConnectionRegistry;
import io.socketrelay.server.core.EnvelopeWriter;
import io.socketrelay.server.core.Payloads;
import io.socketrelay.server.core.PresenceBroadcaster;
import io.socketrelay.server.spi.CredentialVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Binds a verified identity to the connection, registers it and announces it online.
 *
 * <p>A failed verification leaves the connection open and unauthenticated.
 */
public final class AuthenticateHandler {
    private static final Logger log = LoggerFactory.getLogger(AuthenticateHandler.class);

    private final CredentialVerifier verifier;
    private final ConnectionRegistry registry;
    private final PresenceBroadcaster presence;
    private final EnvelopeWriter writer;

    public AuthenticateHandler(CredentialVerifier verifier, ConnectionRegistry registry,
                               PresenceBroadcaster presence, EnvelopeWriter writer) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public void handle(Connection connection, InboundEvent.Authenticate event) {
        Identity identity;
        try {
            identity = verifier.verify(event.token());
        } catch (RelayException.InvalidCredential e) {
            log.info("Authentication failed on {}: {}", connection, e.getMessage());
            writer.error(connection, Protocol.MSG_INVALID_TOKEN);
            return;
        } catch (RuntimeException e) {
            log.warn("Credential verifier failed on {}", connection, e);
            writer.error(connection, Protocol.MSG_INVALID_TOKEN);
            return;
        }

        Identity previous = connection.bind(identity);
        if (previous != null && !previous.id().equals(identity.id())
                && registry.unregister(previous.id(), connection)) {
            log.info("{} re-authenticated, releasing {}", connection, previous.id());
            presence.announce(previous.id(), false, connection);
        }

        registry.register(identity.id(), connection).ifPresent(evicted ->
                log.info("Closed {} in favour of {} on path {}", evicted, connection, connection.path()));
        if (connection.isReleased()) {
            // closed while authenticating; the close path already ran
            registry.unregister(identity.id(), connection);
            return;
        }

        presence.announce(identity.id(), true, connection);
        if (connection.isReleased()) {
            // the release may have announced offline before the online status above went out
            if (!registry.isOnline(identity.id())) presence.announce(identity.id(), false, connection);
            return;
        }
        writer.send(connection, OutboundEnvelope.of(Protocol.EVENT_AUTHENTICATED,
                new Payloads.Authenticated(identity.id(), identity.role().wireName(), true)));
        log.info("Authenticated {} as {} on path {}", connection, identity.role().wireName(), connection.path());
    }
}
