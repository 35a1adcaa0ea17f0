package io.socketrelay.server.core;

/**
 * Transport-side handle of one live socket.
 *
 * <p>Implementations must be safe to call from any thread and must never block on the network.
 */
public interface ConnectionChannel {

    /**
     * Logical channel namespace chosen at connect time (request path without query), e.g. {@code /driver-location}.
     */
    String path();

    boolean isOpen();

    /**
     * Queue one text frame. Frames sent to a closed channel are dropped.
     */
    void send(String text);

    /**
     * Queue a liveness probe. The transport reports the answer through {@link RelayBroker#onPong(Connection)}.
     */
    void ping();

    /**
     * Graceful close (close handshake).
     */
    void close();

    /**
     * Immediate close without handshake, for peers that stopped answering.
     */
    void terminate();
}
