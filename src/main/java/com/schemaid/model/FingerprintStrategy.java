package com.schemaid.model;

/**
 * How a behavior was turned into stable bytes, strongest first.
 */
public enum FingerprintStrategy {
    /**
     * Fully qualified declared name. Blind to changes inside a same-named function.
     */
    BY_NAME(1, "by-name"),

    /**
     * Hash of the compiled class definition of an anonymous or local class.
     */
    BY_SOURCE_HASH(2, "by-source-hash"),

    /**
     * Parameter and return types only. Weakest guarantee.
     */
    BY_SIGNATURE(3, "by-signature");

    private final int code;
    private final String label;

    FingerprintStrategy(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }
}
