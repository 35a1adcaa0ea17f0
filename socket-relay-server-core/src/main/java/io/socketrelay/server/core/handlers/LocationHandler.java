package io.socketrelay.server.core.handlers;

import io.socketrelay.core.InboundEvent;
import io.socketrelay.core.OutboundEnvelope;
import io.socketrelay.core.Protocol;
import io.socketrelay.server.core.Connection;
import io.socketrelay.server.core.EnvelopeWriter;
import io.socketrelay.server.core.LocationBook;
import io.socketrelay.server.core.LocationSubscriptions;
import io.socketrelay.server.core.Payloads;
import io.socketrelay.server.spi.AsyncChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

public final class LocationHandler {
    private static final Logger log = LoggerFactory.getLogger(LocationHandler.class);

    private final LocationBook locations;
    private final LocationSubscriptions subscriptions;
    private final AsyncChatStore store;
    private final EnvelopeWriter writer;

    public LocationHandler(LocationBook locations, LocationSubscriptions subscriptions,
                           AsyncChatStore store, EnvelopeWriter writer) {
        this.locations = Objects.requireNonNull(locations, "locations");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.store = Objects.requireNonNull(store, "store");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * Records the position, persists it in the background and fans it out to subscribers.
     * Fan-out does not wait for persistence.
     */
    public void handleUpdate(Connection connection, InboundEvent.LocationUpdate event) {
        String userId = connection.identityId();
        locations.update(userId, event.lat(), event.lng());
        store.updateUserLocation(userId, event.lat(), event.lng()).whenComplete((ignored, error) -> {
            if (error != null) log.warn("Failed to persist location of {}: {}", userId, Failures.describe(error));
        });

        Set<Connection> subscribers = subscriptions.subscribersOf(userId);
        int delivered = writer.broadcast(subscribers, OutboundEnvelope.of(Protocol.EVENT_LOCATION_UPDATE,
                new Payloads.LocationBroadcast(userId, event.lat(), event.lng())));
        log.debug("Location of {} relayed to {} subscriber(s)", userId, delivered);
    }

    /**
     * Subscribes the connection. A connection that is already released is never left in the index.
     */
    public void handleSubscribe(Connection connection, InboundEvent.SubscribeToLocation event) {
        if (connection.isReleased()) return;
        subscriptions.subscribe(event.targetUserId(), connection);
        if (connection.isReleased()) {
            subscriptions.unsubscribeAll(connection);
            return;
        }
        log.info("{} subscribed to location of {}", connection, event.targetUserId());
    }
}
