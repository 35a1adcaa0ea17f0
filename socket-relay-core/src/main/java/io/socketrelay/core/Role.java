package io.socketrelay.core;

import java.util.Locale;

/**
 * Role tag carried by an authenticated identity.
 *
 * <p>Wire names match the role claim issued by the account service ({@code Client}, {@code Host},
 * {@code Courier}); parsing is case-insensitive.
 */
public enum Role {
    CLIENT("Client"),
    HOST("Host"),
    COURIER("Courier");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses a role claim.
     *
     * @throws IllegalArgumentException if the value is null or not a known role
     */
    public static Role fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("role must not be null");
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.wireName.toLowerCase(Locale.ROOT).equals(normalized)) return role;
        }
        throw new IllegalArgumentException("unknown role: " + value);
    }
}
