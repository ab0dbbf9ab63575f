package com.schemaid.hash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Message digest helpers. Every JDK ships SHA-256, so a missing algorithm is a broken runtime.
 */
public final class Digests {

    public static final String SHA_256 = "SHA-256";

    private Digests() {}

    public static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest algorithm not available: " + algorithm, e);
        }
    }

    public static byte[] sha256(byte[] input) {
        return newDigest(SHA_256).digest(input);
    }
}
