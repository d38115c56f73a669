package com.acme.autodoist.core;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 webhook signature check over the raw request body.
 * The header may carry the digest as base64 or lowercase hex.
 */
public final class SignatureVerifier {
    private static final String ALGORITHM = "HmacSHA256";

    private SignatureVerifier() {
    }

    public static boolean verify(byte[] rawBody, String headerSignature, String secret) {
        if (headerSignature == null || headerSignature.isBlank() || secret == null || secret.isEmpty()) {
            return false;
        }
        byte[] digest;
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            digest = mac.doFinal(rawBody == null ? new byte[0] : rawBody);
        } catch (GeneralSecurityException e) {
            return false;
        }
        byte[] header = headerSignature.trim().getBytes(StandardCharsets.UTF_8);
        byte[] expectedB64 = Base64.getEncoder().encode(digest);
        byte[] expectedHex = HexFormat.of().formatHex(digest).getBytes(StandardCharsets.US_ASCII);
        boolean b64 = MessageDigest.isEqual(header, expectedB64);
        boolean hex = MessageDigest.isEqual(header, expectedHex);
        return b64 || hex;
    }

    public static String sha256Hex(byte[] rawBody) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(rawBody));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
