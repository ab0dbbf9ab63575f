package com.schemaid.exception;

/**
 * Thrown when a schema graph grows past the configured node bound.
 * Legitimate recursive schemas never hit this; they are closed by recursive-reference nodes.
 */
public class CycleDepthExceededException extends SchemaIdentityException {

    private static final long serialVersionUID = 1L;

    private final int maxNodes;

    public CycleDepthExceededException(int maxNodes, String location) {
        super("Schema graph exceeded " + maxNodes + " nodes while expanding " + location);
        this.maxNodes = maxNodes;
    }

    public int getMaxNodes() {
        return maxNodes;
    }
}
