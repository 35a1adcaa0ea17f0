package io.socketrelay.json.spi;

/**
 * Text codec for envelopes. Envelopes travel as WebSocket text frames, so only string forms are
 * needed; payloads are bound to records rather than a tree model.
 *
 * <p>Implementations must omit null-valued properties when writing and ignore unknown properties
 * when reading, since envelopes are unions of optional fields.
 */
public interface JsonCodec {

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    /**
     * Deserializes a JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the text is not valid JSON or does not bind to {@code type}
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;
}
