package io.socketrelay.core;

import java.util.Objects;

/**
 * Outbound envelope: {@code {event, data}} for payload-bearing events, {@code {event, message}} for
 * {@code error}/{@code info}, or a bare {@code {event}}. Codecs omit null fields.
 */
public record OutboundEnvelope(String event, Object data, String message) {

    public OutboundEnvelope {
        Objects.requireNonNull(event, "event");
    }

    public static OutboundEnvelope of(String event, Object data) {
        return new OutboundEnvelope(event, Objects.requireNonNull(data, "data"), null);
    }

    public static OutboundEnvelope bare(String event) {
        return new OutboundEnvelope(event, null, null);
    }

    public static OutboundEnvelope error(String message) {
        return new OutboundEnvelope(Protocol.EVENT_ERROR, null, Objects.requireNonNull(message, "message"));
    }

    public static OutboundEnvelope info(String message) {
        return new OutboundEnvelope(Protocol.EVENT_INFO, null, Objects.requireNonNull(message, "message"));
    }
}
