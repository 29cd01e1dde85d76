package com.atrium.auth.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 hashing and timing-safe comparison for secrets that are stored or
 * configured only in hashed form (refresh secrets, break-glass passwords,
 * the admin API token).
 */
public final class Digests {

    private Digests() {
    }

    /**
     * @return lower-case hex SHA-256 of the UTF-8 bytes of {@code input}
     */
    public static String sha256Hex(String input) {
        return HexFormat.of().formatHex(sha256(input));
    }

    public static byte[] sha256(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return md.digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Compare two strings in time independent of where they first differ.
     * Null on either side never matches.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8));
    }
}
