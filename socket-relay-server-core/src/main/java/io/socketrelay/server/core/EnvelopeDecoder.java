package io.socketrelay.server.core;

import io.socketrelay.core.InboundEvent;
import io.socketrelay.core.RelayException;
import io.socketrelay.core.WireEnvelope;
import io.socketrelay.json.spi.JsonCodec;
import io.socketrelay.json.spi.JsonException;

import java.util.Objects;

/**
 * Text frame to {@link InboundEvent}.
 */
public final class EnvelopeDecoder {
    private final JsonCodec codec;

    public EnvelopeDecoder(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * @throws RelayException.MalformedEnvelope if the frame is not a JSON object with the expected field types
     */
    public InboundEvent decode(String text) {
        if (text == null || text.isBlank()) {
            throw new RelayException.MalformedEnvelope("empty frame", null);
        }
        WireEnvelope wire;
        try {
            wire = codec.readValue(text, WireEnvelope.class);
        } catch (JsonException e) {
            throw new RelayException.MalformedEnvelope(e.getMessage(), e);
        }
        if (wire == null) throw new RelayException.MalformedEnvelope("frame is not an object", null);
        try {
            return InboundEvent.from(wire);
        } catch (RuntimeException e) {
            throw new RelayException.MalformedEnvelope(String.valueOf(e.getMessage()), e);
        }
    }
}
