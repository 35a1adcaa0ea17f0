package io.socketrelay.server.spi;

import java.util.Objects;

/**
 * A room together with its most recent chat ({@code null} when the room has no messages yet).
 */
public record RoomWithLastChat(Room room, Chat lastChat) {
    public RoomWithLastChat {
        Objects.requireNonNull(room, "room");
    }
}
