package me.internalizable.platesight.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content hash used as the recognition cache key. Computed over decoded image
 * bytes so differently formatted encodings of the same image share a key.
 */
public final class ImageHasher {

    private ImageHasher() {
    }

    public static String sha256Hex(byte[] imageBytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(imageBytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Short form of a hash for log lines.
     */
    public static String abbreviate(String hash) {
        if (hash == null) return "";
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
