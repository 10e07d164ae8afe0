package com.conduit.security;

/**
 * Symmetric encryption of tenant secrets at rest.
 * <p>
 * Callers treat this as a black box: {@link #encrypt(String)} produces a self-contained encoded
 * blob and {@link #decrypt(String)} is its exact inverse. Implementations are thread-safe.
 */
public interface CredentialCipher {

    /**
     * Encrypts a plaintext secret.
     *
     * @param plaintext the secret (must not be null)
     * @return encoded ciphertext, safe to store as text
     * @throws CipherException if encryption fails
     */
    String encrypt(String plaintext);

    /**
     * Decrypts a blob produced by {@link #encrypt(String)}.
     *
     * @param ciphertext encoded ciphertext
     * @return the original plaintext
     * @throws CipherException if the blob is malformed, truncated or was tampered with
     */
    String decrypt(String ciphertext);
}
