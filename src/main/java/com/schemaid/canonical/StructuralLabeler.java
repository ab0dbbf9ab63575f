package com.schemaid.canonical;

import com.schemaid.exception.SchemaIdentityException;
import com.schemaid.hash.Digests;
import com.schemaid.model.IdentitySettings;
import com.schemaid.model.NodeKind;
import com.schemaid.model.SchemaGraph;
import com.schemaid.model.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Assigns every node a structural label by iterative refinement.
 *
 * Round 0 labels each node by its kind. Each following round hashes the node's previous label,
 * its own attributes and the previous labels of its children (a recursive reference sees its
 * target). Refinement stops once a round no longer splits any group of equally labelled nodes,
 * which takes at most N + 1 rounds for N nodes. Structurally equivalent nodes end with equal
 * labels regardless of field order, union member order or where a cycle was closed.
 */
public class StructuralLabeler {

    private static final Logger log = LoggerFactory.getLogger(StructuralLabeler.class);

    private static final HexFormat HEX = HexFormat.of();

    private final IdentitySettings settings;

    public StructuralLabeler(IdentitySettings settings) {
        this.settings = settings;
    }

    /**
     * @return final label per node, as lower-case hex
     */
    public Map<SchemaNode, String> label(SchemaGraph graph) {
        List<SchemaNode> nodes = graph.getNodes();
        int n = nodes.size();

        Map<SchemaNode, Integer> index = new IdentityHashMap<>(n);
        for (int i = 0; i < n; i++) {
            index.put(nodes.get(i), i);
        }

        byte[][] attributes = new byte[n][];
        String[] labels = new String[n];
        for (int i = 0; i < n; i++) {
            SchemaNode node = nodes.get(i);
            attributes[i] = new CanonicalWriter(settings).writeAttributes(node).toByteArray();
            labels[i] = HEX.formatHex(Digests.sha256(new byte[] {(byte) node.getKind().getCode()}));
        }

        int distinct = countDistinct(labels);
        int rounds = 0;
        while (rounds <= n) {
            String[] next = new String[n];
            for (int i = 0; i < n; i++) {
                next[i] = refine(nodes.get(i), labels[i], attributes[i], labels, index);
            }
            rounds++;
            int nextDistinct = countDistinct(next);
            labels = next;
            if (nextDistinct == distinct) {
                break;
            }
            distinct = nextDistinct;
        }
        log.debug("Labelled {} nodes into {} classes after {} rounds", n, distinct, rounds);

        Map<SchemaNode, String> result = new IdentityHashMap<>(n);
        for (int i = 0; i < n; i++) {
            result.put(nodes.get(i), labels[i]);
        }
        return result;
    }

    private String refine(SchemaNode node, String previous, byte[] attributes, String[] labels,
                          Map<SchemaNode, Integer> index) {
        MessageDigest digest = Digests.newDigest(Digests.SHA_256);
        digest.update(HEX.parseHex(previous));
        digest.update(attributes);

        if (node.getKind() == NodeKind.RECURSIVE_REFERENCE) {
            digest.update(HEX.parseHex(labels[indexOf(node.getTarget(), index)]));
        } else {
            List<SchemaNode> children = orderedChildren(node, child -> labels[indexOf(child, index)]);
            digest.update(intBytes(children.size()));
            for (SchemaNode child : children) {
                digest.update(HEX.parseHex(labels[indexOf(child, index)]));
            }
        }
        return HEX.formatHex(digest.digest());
    }

    /**
     * Children in canonical order: union members by label, model fields by name, container
     * elements positionally. Settings can keep declaration order instead.
     */
    List<SchemaNode> orderedChildren(SchemaNode node, Function<SchemaNode, String> labelOf) {
        List<SchemaNode> children = new ArrayList<>(node.getChildren());
        if (node.getKind() == NodeKind.UNION && !settings.isTrackTypeOrder()) {
            children.sort(Comparator.comparing(labelOf));
        } else if (node.getKind() == NodeKind.MODEL && !settings.isTrackFieldOrder()) {
            children.sort(Comparator
                    .comparing((SchemaNode child) -> child.getFieldName() == null ? "" : child.getFieldName())
                    .thenComparing(labelOf));
        }
        return children;
    }

    private static int indexOf(SchemaNode node, Map<SchemaNode, Integer> index) {
        Integer i = index.get(node);
        if (i == null) {
            throw new SchemaIdentityException("Node " + node + " is referenced but not part of the graph");
        }
        return i;
    }

    private static int countDistinct(String[] labels) {
        Set<String> distinct = new HashSet<>();
        for (String label : labels) {
            distinct.add(label);
        }
        return distinct.size();
    }

    private static byte[] intBytes(int value) {
        return new byte[] {(byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) value};
    }
}
