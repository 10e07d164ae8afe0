package com.conduit.security;

/**
 * Thrown when a secret cannot be encrypted or decrypted.
 * <p>
 * A decryption failure usually means the stored blob was produced under a different key or was
 * modified after it was written.
 */
public class CipherException extends RuntimeException {

    public CipherException(String message) {
        super(message);
    }

    public CipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
