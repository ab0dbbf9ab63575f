package com.schemaid.canonical;

import com.schemaid.model.AlgorithmVersion;
import com.schemaid.model.CanonicalForm;
import com.schemaid.model.IdentitySettings;
import com.schemaid.model.NodeKind;
import com.schemaid.model.SchemaGraph;
import com.schemaid.model.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a schema graph (with resolved behaviors) into its canonical byte form.
 *
 * Nodes with equal structural labels collapse into one table entry. The table is laid out in
 * depth-first pre-order from the root, visiting children in canonical order, so the root is always
 * entry 0 and the layout depends only on structure.
 */
public class Canonicalizer {

    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    private final IdentitySettings settings;
    private final AlgorithmVersion version;
    private final StructuralLabeler labeler;

    public Canonicalizer(IdentitySettings settings) {
        this(settings, AlgorithmVersion.current());
    }

    public Canonicalizer(IdentitySettings settings, AlgorithmVersion version) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.version = Objects.requireNonNull(version, "version");
        this.labeler = new StructuralLabeler(settings);
    }

    public CanonicalForm canonicalize(SchemaGraph graph) {
        Map<SchemaNode, String> labels = labeler.label(graph);
        Table table = new Table(labels);
        int root = table.visit(graph.getRoot());

        CanonicalWriter writer = new CanonicalWriter(settings).writeHeader(version);
        writer.writeInt(root);
        writer.writeInt(table.entries.size());
        for (Entry entry : table.entries) {
            writer.writeAttributes(entry.node);
            writer.writeIndexes(entry.children);
            if (entry.node.getKind() == NodeKind.RECURSIVE_REFERENCE) {
                writer.writeInt(entry.target);
            }
        }

        byte[] bytes = writer.toByteArray();
        log.debug("Canonical form: {} nodes, {} table entries, {} bytes", graph.size(), table.entries.size(), bytes.length);
        return new CanonicalForm(bytes, graph.size(), table.entries.size());
    }

    private static final class Entry {
        private final SchemaNode node;
        private final List<Integer> children = new ArrayList<>();
        private int target = -1;

        private Entry(SchemaNode node) {
            this.node = node;
        }
    }

    /**
     * Deduplicated node table, filled in depth-first pre-order.
     */
    private final class Table {

        private final Map<SchemaNode, String> labels;
        private final Map<String, Integer> indexByLabel = new HashMap<>();
        private final List<Entry> entries = new ArrayList<>();

        private Table(Map<SchemaNode, String> labels) {
            this.labels = labels;
        }

        int visit(SchemaNode node) {
            String label = labels.get(node);
            Integer existing = indexByLabel.get(label);
            if (existing != null) {
                return existing;
            }

            int index = entries.size();
            Entry entry = new Entry(node);
            indexByLabel.put(label, index);
            entries.add(entry);

            if (node.getKind() == NodeKind.RECURSIVE_REFERENCE) {
                entry.target = visit(node.getTarget());
            } else {
                for (SchemaNode child : labeler.orderedChildren(node, labels::get)) {
                    entry.children.add(visit(child));
                }
            }
            return index;
        }
    }
}
