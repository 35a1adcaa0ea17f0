package io.socketrelay.core;

import java.util.Objects;

/**
 * Authenticated actor, as resolved from a bearer credential.
 *
 * @param id stable unique identifier
 * @param role role tag
 * @param email display name used in logs (may be null)
 */
public record Identity(String id, Role role, String email) {
    public Identity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
    }
}
