package com.schemaid.model;

/**
 * Outcome of comparing two identifiers.
 */
public enum SchemaComparison {
    SAME,
    DIFFERENT,
    /**
     * The identifiers come from different algorithm versions and say nothing about each other.
     */
    INCOMPARABLE
}
