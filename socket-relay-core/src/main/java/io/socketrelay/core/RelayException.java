package io.socketrelay.core;

/**
 * Base class for Socket Relay related exceptions.
 *
 * <p>None of these are fatal to the broker: each one is scoped to the single connection or event
 * that raised it.
 */
public abstract class RelayException extends RuntimeException {

    protected RelayException(String message) {
        super(message);
    }

    protected RelayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when an inbound frame cannot be read as an envelope (not JSON, not an object, wrong field types).
     */
    public static class MalformedEnvelope extends RelayException {
        public MalformedEnvelope(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a bearer credential is missing, malformed, expired or fails signature checks.
     */
    public static class InvalidCredential extends RelayException {
        public InvalidCredential(String message) {
            super(message);
        }

        public InvalidCredential(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised by store adapters when the durable store cannot serve a call.
     */
    public static class StoreUnavailable extends RelayException {
        public StoreUnavailable(String message) {
            super(message);
        }

        public StoreUnavailable(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
