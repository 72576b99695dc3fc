package net.plantmatch.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers used to fingerprint catalog content.
 */
public final class HashUtils {

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes the SHA-256 digest of the given bytes.
     *
     * @param data bytes to hash
     * @return the 32 byte digest
     * @throws NoSuchAlgorithmException if SHA-256 is not available
     */
    public static byte[] computeSha256(byte[] data) throws NoSuchAlgorithmException {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        return MessageDigest.getInstance("SHA-256").digest(data);
    }

    /**
     * Computes the SHA-256 digest and renders it as 64 lowercase hex characters.
     *
     * <pre>{@code
     * String version = HashUtils.sha256Hex(catalogBytes);
     * }</pre>
     */
    public static String sha256Hex(byte[] data) throws NoSuchAlgorithmException {
        byte[] hash = computeSha256(data);
        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
