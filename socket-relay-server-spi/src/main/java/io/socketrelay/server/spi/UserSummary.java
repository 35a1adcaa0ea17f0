package io.socketrelay.server.spi;

import java.util.Objects;

/**
 * Profile fields shown next to a conversation in the message list.
 */
public record UserSummary(String id, String firstName, String lastName, String profileImage) {
    public UserSummary {
        Objects.requireNonNull(id, "id");
    }
}
