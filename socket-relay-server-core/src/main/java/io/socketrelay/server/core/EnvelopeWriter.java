package io.socketrelay.server.core;

import io.socketrelay.core.OutboundEnvelope;
import io.socketrelay.json.spi.JsonCodec;
import io.socketrelay.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;

/**
 * Encodes outbound envelopes and hands them to connections. Sends are best effort: closed
 * connections are skipped and transport failures are logged, never thrown.
 */
public final class EnvelopeWriter {
    private static final Logger log = LoggerFactory.getLogger(EnvelopeWriter.class);

    private final JsonCodec codec;

    public EnvelopeWriter(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public boolean send(Connection connection, OutboundEnvelope envelope) {
        String text = encode(envelope);
        return text != null && deliver(connection, text);
    }

    public boolean error(Connection connection, String message) {
        return send(connection, OutboundEnvelope.error(message));
    }

    /**
     * Encodes once and sends to every open target.
     *
     * @return number of connections the envelope was handed to
     */
    public int broadcast(Collection<Connection> targets, OutboundEnvelope envelope) {
        if (targets.isEmpty()) return 0;
        String text = encode(envelope);
        if (text == null) return 0;
        int delivered = 0;
        for (Connection target : targets) {
            if (deliver(target, text)) delivered++;
        }
        return delivered;
    }

    private String encode(OutboundEnvelope envelope) {
        try {
            return codec.writeString(envelope);
        } catch (JsonException e) {
            log.error("Failed to encode {} envelope", envelope.event(), e);
            return null;
        }
    }

    private boolean deliver(Connection connection, String text) {
        if (!connection.isOpen()) return false;
        try {
            connection.sendText(text);
            return true;
        } catch (RuntimeException e) {
            log.debug("Dropped frame for {}: {}", connection, e.toString());
            return false;
        }
    }
}
