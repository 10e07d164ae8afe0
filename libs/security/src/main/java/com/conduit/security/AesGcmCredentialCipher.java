package com.conduit.security;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM implementation of {@link CredentialCipher}.
 * <p>
 * Output layout is {@code base64(nonce || ciphertext || tag)} with a fresh 12-byte nonce per call
 * and a 128-bit authentication tag. The key length is checked once, at construction.
 */
public final class AesGcmCredentialCipher implements CredentialCipher {

    /** Required key length in bytes (AES-256). */
    public static final int KEY_LENGTH = 32;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    /**
     * @param key raw key material, exactly {@value #KEY_LENGTH} bytes
     * @throws IllegalArgumentException if the key is null or has the wrong length
     */
    public AesGcmCredentialCipher(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("encryption key must be exactly %d bytes, got %d"
                    .formatted(KEY_LENGTH, key == null ? 0 : key.length));
        }
        this.key = new SecretKeySpec(Arrays.copyOf(key, KEY_LENGTH), "AES");
    }

    /**
     * Builds a cipher from a configured key string, using its UTF-8 bytes as key material.
     */
    public static AesGcmCredentialCipher fromString(String key) {
        if (key == null) {
            throw new IllegalArgumentException("encryption key must not be null");
        }
        return new AesGcmCredentialCipher(key.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] out = new byte[NONCE_LENGTH + sealed.length];
            System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH);
            System.arraycopy(sealed, 0, out, NONCE_LENGTH, sealed.length);
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new CipherException("failed to encrypt secret", e);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new CipherException("ciphertext must not be null or blank");
        }
        byte[] data;
        try {
            data = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new CipherException("failed to decode ciphertext", e);
        }
        if (data.length < NONCE_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new CipherException("ciphertext too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, data, 0, NONCE_LENGTH));
            byte[] plain = cipher.doFinal(data, NONCE_LENGTH, data.length - NONCE_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new CipherException("failed to decrypt secret", e);
        }
    }
}
