package io.socketrelay.core;

import java.util.List;

/**
 * Inbound envelope exactly as it arrives on the wire: the {@code event} tag plus the union of every
 * event-specific field. Fields not sent by the client are {@code null}.
 *
 * <p>This type only exists to be bound by a JSON codec; handlers consume {@link InboundEvent}
 * produced by {@link InboundEvent#from(WireEnvelope)}.
 */
public record WireEnvelope(
        String event,
        String token,
        Double lat,
        Double lng,
        String targetUserId,
        String receiverId,
        String message,
        List<String> images,
        String toUserId,
        Object offer,
        Object answer,
        Object candidate,
        String callType
) {
}
