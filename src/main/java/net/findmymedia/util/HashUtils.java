package net.findmymedia.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers used for cache keys and cache file names.
 */
public final class HashUtils {

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes SHA-256 of a UTF-8 string and returns it as lowercase hex.
     *
     * @param data string to hash
     * @return 64 character hex digest
     * @throws IllegalStateException if the JVM offers no SHA-256 implementation
     *
     * @example
     * <pre>{@code
     * String hex = HashUtils.sha256Hex("wikidata:sparql:{\"title\":\"Dune\"}");
     * }</pre>
     */
    public static String sha256Hex(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", e);
        }
    }
}
