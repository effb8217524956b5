package com.profilebridge.serializer;

/**
 * Typed failure of a profile serialization call.
 *
 * Callers are expected to log it and skip writing output; only
 * {@link Reason#NO_ACTIVE_CAPTURE} is the caller's own mistake.
 */
public class ProfileSerializationException extends RuntimeException {

    public enum Reason {
        /** Serialization was requested while no capture was running. */
        NO_ACTIVE_CAPTURE,
        /** A table invariant was broken; indicates a bug, not bad input. */
        INTERNAL_ERROR,
        /** The JVM ran out of memory while building or encoding the profile. */
        RESOURCE_EXHAUSTED
    }

    private final Reason reason;

    public ProfileSerializationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ProfileSerializationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
