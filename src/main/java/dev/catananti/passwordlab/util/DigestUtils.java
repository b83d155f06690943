package dev.catananti.passwordlab.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Unsalted message-digest helpers for the fast-hash demonstrations.
 */
public final class DigestUtils {

    private static final HexFormat HEX = HexFormat.of();

    private DigestUtils() {
        // utility class
    }

    /**
     * Compute the MD5 hash of the UTF-8 bytes of the input.
     *
     * @param input text to hash
     * @return lowercase hex-encoded MD5 digest
     */
    public static String md5Hex(String input) {
        Objects.requireNonNull(input, "Input must not be null");
        return HEX.formatHex(digest("MD5", input.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Compute the SHA-256 hash of the UTF-8 bytes of the input.
     *
     * @param input text to hash
     * @return lowercase hex-encoded SHA-256 digest
     */
    public static String sha256Hex(String input) {
        Objects.requireNonNull(input, "Input must not be null");
        return HEX.formatHex(digest("SHA-256", input.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] digest(String algorithm, byte[] data) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            // every Java platform ships MD5 and SHA-256
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
