package com.ctis.payments.provider;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

/**
 * HMAC helpers shared by the adapters' signature checks.
 */
public final class WebhookSignatures {

    public static final String HMAC_SHA256 = "HmacSHA256";
    public static final String HMAC_SHA1 = "HmacSHA1";

    private WebhookSignatures() {
    }

    public static byte[] hmac(String algorithm, String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm));
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC computation failed for " + algorithm, e);
        }
    }

    public static String hmacHex(String algorithm, String secret, String payload) {
        return HexFormat.of().formatHex(hmac(algorithm, secret, payload));
    }

    public static String hmacBase64(String algorithm, String secret, String payload) {
        return Base64.getEncoder().encodeToString(hmac(algorithm, secret, payload));
    }

    /** Compares without leaking the position of the first difference. */
    public static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }

    /** Drops the scheme prefixes some providers put in front of the digest. */
    public static String stripPrefix(String signature) {
        if (signature == null) {
            return null;
        }
        String trimmed = signature.trim();
        if (trimmed.regionMatches(true, 0, "sha256=", 0, 7)) {
            return trimmed.substring(7);
        }
        if (trimmed.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return trimmed.substring(7);
        }
        return trimmed;
    }
}
