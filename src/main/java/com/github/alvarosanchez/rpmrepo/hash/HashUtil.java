package com.github.alvarosanchez.rpmrepo.hash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Digest helpers shared by artifact extraction and index generation.
 */
public final class HashUtil {

    /**
     * Checksum type name used in repository metadata.
     */
    public static final String SHA256_TYPE = "sha256";

    private static final String SHA256 = "SHA-256";
    private static final String SHA1 = "SHA-1";

    private HashUtil() {
    }

    /**
     * Creates a fresh SHA-256 digest for incremental updates.
     *
     * @return new digest
     */
    public static MessageDigest newSha256() {
        return newDigest(SHA256);
    }

    /**
     * Computes the hex-encoded SHA-256 of a byte array.
     *
     * @param data input bytes
     * @return lowercase hex digest
     */
    public static String sha256(byte[] data) {
        return hex(newDigest(SHA256).digest(data));
    }

    /**
     * Computes the hex-encoded SHA-1 of a byte array.
     *
     * @param data input bytes
     * @return lowercase hex digest
     */
    public static String sha1(byte[] data) {
        return hex(newDigest(SHA1).digest(data));
    }

    /**
     * Hex-encodes bytes.
     *
     * @param bytes raw bytes
     * @return lowercase hex string
     */
    public static String hex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-1 and SHA-256
            throw new AssertionError(algorithm + " not available", e);
        }
    }
}
