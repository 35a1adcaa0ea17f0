package io.socketrelay.core;

import java.util.Optional;

/**
 * Media kind requested by {@code callUser}. Only signaling metadata is relayed, never media.
 */
public enum CallType {
    AUDIO("audio"),
    VIDEO("video");

    private final String wireName;

    CallType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Exact (case-sensitive) match against the wire names; empty for anything else. */
    public static Optional<CallType> fromWire(String value) {
        if (value == null) return Optional.empty();
        for (CallType type : values()) {
            if (type.wireName.equals(value)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
