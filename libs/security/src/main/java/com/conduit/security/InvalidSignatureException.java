package com.conduit.security;

/**
 * Thrown when an inbound webhook cannot be proven to come from the provider.
 * <p>
 * Always terminal: a rejected delivery is never retried or dispatched.
 */
public class InvalidSignatureException extends RuntimeException {

    /** Why verification failed. */
    public enum Reason {
        /** The signature header was absent or blank. */
        MISSING_HEADER,
        /** The header decoded neither as base64 nor as hex. */
        MALFORMED_HEADER,
        /** The header decoded but did not match the computed HMAC. */
        MISMATCH
    }

    private final Reason reason;

    public InvalidSignatureException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
