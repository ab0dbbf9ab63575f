package com.schemaid.model;

/**
 * Kind of a type position in the schema graph.
 * Codes are written into the canonical form and must never be renumbered.
 */
public enum NodeKind {
    SCALAR(1),
    CONTAINER(2),
    UNION(3),
    LITERAL(4),
    MODEL(5),
    RECURSIVE_REFERENCE(6);

    private final int code;

    NodeKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
