package com.schemaid.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One type position in the schema graph.
 *
 * Nodes form a graph, not a tree: a {@link NodeKind#RECURSIVE_REFERENCE} node points back at an
 * ancestor {@link NodeKind#MODEL} node through {@link #target}, and the field nodes of a model
 * used at several positions are shared by the model nodes of those positions. Equality is identity.
 */
@Getter
@Setter
@NoArgsConstructor
public class SchemaNode {

    private NodeKind kind;

    /**
     * Concrete construct within the kind, e.g. "int32", "list", "enum", "sealed".
     */
    private String tag;

    private final List<Constraint> constraints = new ArrayList<>();

    private final List<SchemaNode> children = new ArrayList<>();

    /**
     * Present only when this node is a named field of a model.
     */
    private String fieldName;

    /**
     * Serialization name declared for the field, if any.
     */
    private String alias;

    private String description;

    private boolean defaultPresent;

    /**
     * Behaviors as listed by the provider; turned into {@link #behaviorRefs} by the resolver.
     */
    private final List<BehaviorHandle> behaviors = new ArrayList<>();

    private List<BehaviorRef> behaviorRefs;

    /**
     * Ancestor model node, set only on recursive references.
     */
    private SchemaNode target;

    /**
     * Where this node came from (e.g. "com.acme.Order.lines[]"). Diagnostics only.
     */
    private String origin;

    public SchemaNode(NodeKind kind, String tag) {
        this.kind = kind;
        this.tag = tag;
    }

    public void addChild(SchemaNode child) {
        children.add(child);
    }

    public void addConstraints(List<Constraint> more) {
        constraints.addAll(more);
    }

    public void addBehaviors(List<BehaviorHandle> more) {
        behaviors.addAll(more);
    }

    public List<BehaviorRef> getBehaviorRefs() {
        return behaviorRefs == null ? null : Collections.unmodifiableList(behaviorRefs);
    }

    public boolean isBehaviorsResolved() {
        return behaviorRefs != null || behaviors.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind == null ? "?" : kind.name());
        if (tag != null) {
            sb.append('(').append(tag).append(')');
        }
        if (fieldName != null) {
            sb.append(' ').append(fieldName);
        }
        if (origin != null) {
            sb.append(" @ ").append(origin);
        }
        return sb.toString();
    }
}
