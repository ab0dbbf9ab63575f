package com.schemaid.model;

import lombok.Getter;

import java.util.HexFormat;

/**
 * Ordered, cycle-free byte encoding of a whole schema graph. Byte-identical for structurally
 * equivalent graphs.
 */
public final class CanonicalForm {

    private final byte[] bytes;

    /**
     * Nodes in the extracted graph, before deduplication.
     */
    @Getter
    private final int nodeCount;

    /**
     * Entries in the deduplicated node table.
     */
    @Getter
    private final int tableSize;

    public CanonicalForm(byte[] bytes, int nodeCount, int tableSize) {
        this.bytes = bytes.clone();
        this.nodeCount = nodeCount;
        this.tableSize = tableSize;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public String toHex() {
        return HexFormat.of().formatHex(bytes);
    }
}
