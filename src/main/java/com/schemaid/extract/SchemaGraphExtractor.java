package com.schemaid.extract;

import com.schemaid.describe.FieldDescription;
import com.schemaid.describe.ModelDescription;
import com.schemaid.describe.ModelDescriptionProvider;
import com.schemaid.describe.TypeDescriptor;
import com.schemaid.exception.CycleDepthExceededException;
import com.schemaid.exception.UnsupportedSchemaNodeException;
import com.schemaid.model.BehaviorHandle;
import com.schemaid.model.Constraint;
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
 * Expands a model into its schema graph.
 *
 * Referenced models are expanded depth-first. A reference to a model that is still being expanded
 * further up the current path becomes a {@link NodeKind#RECURSIVE_REFERENCE} node pointing at that
 * ancestor, so self and mutually recursive models terminate.
 *
 * A model whose expansion closed no cycle through itself or an ancestor is expanded once. Later
 * positions get a fresh model node of their own, carrying the position's field attributes, that
 * shares the field nodes of the first expansion. The graph is therefore a DAG and grows linearly
 * with the number of distinct models.
 *
 * Each {@link #extract(Class)} call keeps its own state, so one extractor can be shared across
 * threads.
 */
public class SchemaGraphExtractor {

    private static final Logger log = LoggerFactory.getLogger(SchemaGraphExtractor.class);

    public static final int DEFAULT_MAX_NODES = 10_000;

    private final ModelDescriptionProvider provider;
    private final int maxNodes;

    public SchemaGraphExtractor(ModelDescriptionProvider provider) {
        this(provider, DEFAULT_MAX_NODES);
    }

    public SchemaGraphExtractor(ModelDescriptionProvider provider, int maxNodes) {
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        this.provider = Objects.requireNonNull(provider, "provider");
        this.maxNodes = maxNodes;
    }

    public SchemaGraph extract(Class<?> model) {
        Objects.requireNonNull(model, "model");
        Extraction extraction = new Extraction();
        SchemaNode root = extraction.expandModel(model, model.getName());
        log.debug("Extracted {} nodes for {}", extraction.nodes.size(), model.getName());
        return new SchemaGraph(root, List.copyOf(extraction.nodes));
    }

    /**
     * State of one extraction: the models on the current path, the finished models that can be
     * shared and every node created so far.
     */
    private final class Extraction {

        private final Map<Class<?>, Frame> inProgress = new HashMap<>();
        private final List<Frame> path = new ArrayList<>();
        private final Map<Class<?>, ModelBody> finished = new HashMap<>();
        private final List<SchemaNode> nodes = new ArrayList<>();

        SchemaNode expandModel(Class<?> model, String origin) {
            SchemaNode modelNode = newNode(NodeKind.MODEL, "model", origin);
            Frame frame = new Frame(modelNode, path.size());
            inProgress.put(model, frame);
            path.add(frame);
            try {
                ModelDescription description = provider.describe(model);
                modelNode.setDescription(description.getDescription());
                modelNode.addConstraints(description.getConstraints());
                modelNode.addBehaviors(description.getConstraintBehaviors());
                modelNode.addBehaviors(provider.listModelBehaviors(model));

                for (FieldDescription field : description.getFields()) {
                    modelNode.addChild(fieldNode(model, field));
                }
            } finally {
                inProgress.remove(model);
                path.remove(path.size() - 1);
            }
            if (frame.selfContained) {
                finished.put(model, new ModelBody(modelNode));
            }
            return modelNode;
        }

        private SchemaNode fieldNode(Class<?> model, FieldDescription field) {
            SchemaNode node = fromDescriptor(field.getType());
            node.setFieldName(field.getName());
            node.setAlias(field.getAlias());
            if (field.getDescription() != null) {
                node.setDescription(field.getDescription());
            }
            node.setDefaultPresent(field.isDefaultPresent());
            node.addBehaviors(provider.listFieldBehaviors(model, field.getName()));
            return node;
        }

        private SchemaNode fromDescriptor(TypeDescriptor descriptor) {
            String origin = descriptor.getOrigin();
            switch (descriptor.getKind()) {
                case MODEL:
                    return modelReference(descriptor);
                case RECURSIVE_REFERENCE:
                    throw new UnsupportedSchemaNodeException("provider-built recursive reference", origin);
                default:
                    break;
            }
            if (descriptor.getTag() == null) {
                throw new UnsupportedSchemaNodeException(descriptor.getKind() + " without tag", origin);
            }

            SchemaNode node = newNode(descriptor.getKind(), descriptor.getTag(), origin);
            node.addConstraints(descriptor.getConstraints());
            node.addBehaviors(descriptor.getBehaviors());
            for (TypeDescriptor argument : descriptor.getArguments()) {
                node.addChild(fromDescriptor(argument));
            }
            return node;
        }

        private SchemaNode modelReference(TypeDescriptor descriptor) {
            Class<?> type = descriptor.getModelType();
            if (type == null) {
                throw new UnsupportedSchemaNodeException("model descriptor without model type", descriptor.getOrigin());
            }

            SchemaNode node;
            Frame ancestor = inProgress.get(type);
            if (ancestor != null) {
                node = newNode(NodeKind.RECURSIVE_REFERENCE, "ref", descriptor.getOrigin());
                node.setTarget(ancestor.node);
                openFrom(ancestor.depth);
                log.trace("Closed cycle at {} -> {}", descriptor.getOrigin(), type.getName());
            } else if (finished.containsKey(type)) {
                node = finished.get(type).share(newNode(NodeKind.MODEL, "model", descriptor.getOrigin()));
            } else {
                node = expandModel(type, descriptor.getOrigin());
            }
            // constraints declared at the referencing position, e.g. @NotNull on the field
            node.addConstraints(descriptor.getConstraints());
            node.addBehaviors(descriptor.getBehaviors());
            return node;
        }

        private SchemaNode newNode(NodeKind kind, String tag, String origin) {
            if (nodes.size() >= maxNodes) {
                throw new CycleDepthExceededException(maxNodes, origin);
            }
            SchemaNode node = new SchemaNode(kind, tag);
            node.setOrigin(origin);
            nodes.add(node);
            return node;
        }

        // a cycle into path[depth] makes that model and everything below it position dependent
        private void openFrom(int depth) {
            for (int i = depth; i < path.size(); i++) {
                path.get(i).selfContained = false;
            }
        }
    }

    private static final class Frame {

        private final SchemaNode node;
        private final int depth;
        private boolean selfContained = true;

        Frame(SchemaNode node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }

    /**
     * Model-level attributes and field nodes of a finished expansion, captured before any
     * referencing position decorated the model node.
     */
    private static final class ModelBody {

        private final String description;
        private final List<Constraint> constraints;
        private final List<BehaviorHandle> behaviors;
        private final List<SchemaNode> fields;

        ModelBody(SchemaNode modelNode) {
            this.description = modelNode.getDescription();
            this.constraints = List.copyOf(modelNode.getConstraints());
            this.behaviors = List.copyOf(modelNode.getBehaviors());
            this.fields = List.copyOf(modelNode.getChildren());
        }

        SchemaNode share(SchemaNode shell) {
            shell.setDescription(description);
            shell.addConstraints(constraints);
            shell.addBehaviors(behaviors);
            fields.forEach(shell::addChild);
            return shell;
        }
    }
}
