package com.schemaid.model;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Root node plus every node reachable from it, in creation order.
 * Transient: built by the extractor and discarded after canonicalization.
 */
@Value
public class SchemaGraph {

    @NonNull
    SchemaNode root;

    @NonNull
    List<SchemaNode> nodes;

    public int size() {
        return nodes.size();
    }
}
