package com.schemaid.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Version of the canonicalization plus hashing scheme. Bumping the version is the only
 * sanctioned way to change the identifier of an unchanged schema.
 */
public enum AlgorithmVersion {
    V1("v1", "SHA-256");

    private final String tag;
    private final String digestAlgorithm;

    AlgorithmVersion(String tag, String digestAlgorithm) {
        this.tag = tag;
        this.digestAlgorithm = digestAlgorithm;
    }

    public String getTag() {
        return tag;
    }

    public String getDigestAlgorithm() {
        return digestAlgorithm;
    }

    public static AlgorithmVersion current() {
        return V1;
    }

    public static Optional<AlgorithmVersion> fromTag(String tag) {
        return Arrays.stream(values()).filter(v -> v.tag.equals(tag)).findFirst();
    }
}
