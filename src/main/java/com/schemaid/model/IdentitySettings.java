package com.schemaid.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.TreeMap;

/**
 * What participates in an identifier beyond pure structure.
 *
 * Every flag and every extra-data entry is written into the canonical header, so identifiers
 * computed under different settings never collide.
 */
@Value
@Builder(toBuilder = true)
public class IdentitySettings {

    public static final int FULL_DIGEST = 64;
    public static final int MIN_DIGEST_LENGTH = 8;
    public static final int DEFAULT_MAX_NODES = 10_000;

    private static final IdentitySettings DEFAULTS = IdentitySettings.builder().build();

    /**
     * Fingerprint model and field descriptions.
     */
    boolean trackDescriptions;

    /**
     * Keep model fields in declaration order instead of sorting them by name.
     */
    boolean trackFieldOrder;

    /**
     * Keep union members and enumeration values in declaration order.
     */
    boolean trackTypeOrder;

    /**
     * Free-form data folded into every identifier, e.g. a deployment or tenant name.
     */
    @NonNull
    @Singular("extraData")
    Map<String, String> trackedExtraData;

    /**
     * Hex characters kept from the digest, {@value #MIN_DIGEST_LENGTH} to {@value #FULL_DIGEST}.
     */
    @Builder.Default
    int digestLength = FULL_DIGEST;

    @Builder.Default
    int maxNodes = DEFAULT_MAX_NODES;

    public static IdentitySettings defaults() {
        return DEFAULTS;
    }

    /**
     * Extra data in key order.
     */
    public Map<String, String> getSortedExtraData() {
        return new TreeMap<>(trackedExtraData);
    }

    /**
     * Checks the numeric settings.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public IdentitySettings validate() {
        if (digestLength < MIN_DIGEST_LENGTH || digestLength > FULL_DIGEST) {
            throw new IllegalArgumentException("digestLength must be between " + MIN_DIGEST_LENGTH
                    + " and " + FULL_DIGEST + ": " + digestLength);
        }
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        return this;
    }
}
