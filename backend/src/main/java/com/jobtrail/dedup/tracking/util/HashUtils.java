package com.jobtrail.dedup.tracking.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtils {
    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        return toHex(newDigest().digest(value.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Hashes an ordered tuple. Every field is length-prefixed so that no two different
     * tuples share a byte encoding ("ab","c" vs "a","bc"); null and "" are distinct.
     */
    public static String sha256HexOfFields(String... fields) {
        MessageDigest digest = newDigest();
        for (String field : fields) {
            if (field == null) {
                digest.update("-1:".getBytes(StandardCharsets.UTF_8));
                continue;
            }
            byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
            digest.update((bytes.length + ":").getBytes(StandardCharsets.UTF_8));
            digest.update(bytes);
        }
        return toHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder out = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            out.append(String.format("%02x", b));
        }
        return out.toString();
    }
}
