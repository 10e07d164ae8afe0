package com.conduit.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Verifies HMAC-SHA256 signatures of inbound webhook deliveries.
 * <p>
 * The MAC is computed over the exact raw request bytes, so callers must hand over the body
 * before any JSON parsing. The signature header is decoded as base64 first and as hex when that
 * does not yield a SHA-256 sized digest. Comparison is constant-time.
 */
public final class WebhookSignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

    private static final String ALGORITHM = "HmacSHA256";
    private static final int DIGEST_LENGTH = 32;

    /**
     * Checks a delivery's signature.
     *
     * @param rawBody         the unmodified request body
     * @param signatureHeader value of the signature header (may be null)
     * @param sharedSecret    tenant secret the provider signs with
     * @throws InvalidSignatureException if the header is missing, undecodable or does not match
     */
    public void verify(byte[] rawBody, String signatureHeader, String sharedSecret) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidSignatureException(InvalidSignatureException.Reason.MISSING_HEADER,
                    "missing webhook signature header");
        }
        byte[] received = decode(signatureHeader.strip());
        if (received == null) {
            throw new InvalidSignatureException(InvalidSignatureException.Reason.MALFORMED_HEADER,
                    "webhook signature is neither base64 nor hex");
        }
        byte[] expected = hmac(rawBody, sharedSecret);
        if (!MessageDigest.isEqual(expected, received)) {
            throw new InvalidSignatureException(InvalidSignatureException.Reason.MISMATCH,
                    "webhook signature verification failed");
        }
    }

    /**
     * Returns {@code true} when {@link #verify} would succeed.
     */
    public boolean isValid(byte[] rawBody, String signatureHeader, String sharedSecret) {
        try {
            verify(rawBody, signatureHeader, sharedSecret);
            return true;
        } catch (InvalidSignatureException e) {
            return false;
        }
    }

    /**
     * Computes the base64 signature the provider would send for this body.
     */
    public String sign(byte[] rawBody, String sharedSecret) {
        return Base64.getEncoder().encodeToString(hmac(rawBody, sharedSecret));
    }

    private static byte[] hmac(byte[] body, String secret) {
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("sharedSecret must not be null or empty");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    // A 64-char hex string is also valid base64, so a base64 result only wins at digest length.
    private static byte[] decode(String header) {
        byte[] base64 = decodeBase64(header);
        if (base64 != null && base64.length == DIGEST_LENGTH) {
            return base64;
        }
        byte[] hex = decodeHex(header);
        if (hex != null) {
            log.debug("Webhook signature header decoded as hex");
            return hex;
        }
        return base64;
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static byte[] decodeHex(String value) {
        try {
            return HexFormat.of().parseHex(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
