package io.socketrelay.server.core;

import io.socketrelay.core.OutboundEnvelope;
import io.socketrelay.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sends {@code userStatus} to every open connection except the one whose state changed.
 */
public final class PresenceBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(PresenceBroadcaster.class);

    private final ConnectionRegistry registry;
    private final EnvelopeWriter writer;

    public PresenceBroadcaster(ConnectionRegistry registry, EnvelopeWriter writer) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public int announce(String userId, boolean online, Connection origin) {
        List<Connection> targets = new ArrayList<>();
        for (Connection connection : registry.openConnections()) {
            if (connection != origin) targets.add(connection);
        }
        int delivered = writer.broadcast(targets,
                OutboundEnvelope.of(Protocol.EVENT_USER_STATUS, new Payloads.UserStatus(userId, online)));
        log.debug("Announced {} {} to {} connection(s)", userId, online ? "online" : "offline", delivered);
        return delivered;
    }
}
