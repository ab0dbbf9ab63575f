package com.schemaid.canonical;

import com.schemaid.exception.SchemaIdentityException;
import com.schemaid.model.AlgorithmVersion;
import com.schemaid.model.BehaviorRef;
import com.schemaid.model.Constraint;
import com.schemaid.model.IdentitySettings;
import com.schemaid.model.SchemaNode;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Byte-level encoding of the canonical form.
 *
 * Integers are fixed-width big-endian, strings are int32 length-prefixed UTF-8 with -1 for null,
 * node references are int32 indexes into the node table.
 */
public class CanonicalWriter {

    public static final String FORMAT_NAME = "schema-identity";

    static final int FLAG_DESCRIPTIONS = 1;
    static final int FLAG_FIELD_ORDER = 1 << 1;
    static final int FLAG_TYPE_ORDER = 1 << 2;

    private static final Comparator<Constraint> CONSTRAINT_ORDER = Comparator
            .comparing(Constraint::getName)
            .thenComparingInt(c -> c.getValueType().getCode())
            .thenComparing(c -> String.valueOf(c.getValue()));

    private final IdentitySettings settings;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final DataOutputStream out = new DataOutputStream(buffer);

    public CanonicalWriter(IdentitySettings settings) {
        this.settings = settings;
    }

    public CanonicalWriter writeHeader(AlgorithmVersion version) {
        writeString(FORMAT_NAME);
        writeString(version.getTag());
        writeByte(flags(settings));
        Map<String, String> extra = settings.getSortedExtraData();
        writeInt(extra.size());
        extra.forEach((key, value) -> {
            writeString(key);
            writeString(value);
        });
        return this;
    }

    /**
     * Everything about a node except its children and recursion target.
     */
    public CanonicalWriter writeAttributes(SchemaNode node) {
        writeByte(node.getKind().getCode());
        writeString(node.getTag());
        writeString(node.getFieldName());
        writeString(node.getAlias());
        writeString(settings.isTrackDescriptions() ? node.getDescription() : null);
        writeByte(node.isDefaultPresent() ? 1 : 0);
        writeConstraints(node.getConstraints());
        writeBehaviors(node);
        return this;
    }

    public CanonicalWriter writeIndexes(List<Integer> indexes) {
        writeInt(indexes.size());
        for (int index : indexes) {
            writeInt(index);
        }
        return this;
    }

    public CanonicalWriter writeInt(int value) {
        try {
            out.writeInt(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public CanonicalWriter writeBytes(byte[] bytes) {
        writeInt(bytes.length);
        try {
            out.write(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public byte[] toByteArray() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }

    private void writeConstraints(List<Constraint> constraints) {
        List<Constraint> sorted = new ArrayList<>(constraints);
        sorted.sort(CONSTRAINT_ORDER);
        writeInt(sorted.size());
        for (Constraint constraint : sorted) {
            writeString(constraint.getName());
            writeByte(constraint.getValueType().getCode());
            switch (constraint.getValueType()) {
                case BOOLEAN:
                    writeByte(Boolean.TRUE.equals(constraint.getValue()) ? 1 : 0);
                    break;
                case INTEGER:
                    writeLong((Long) constraint.getValue());
                    break;
                case STRING:
                    writeString((String) constraint.getValue());
                    break;
                case LIST:
                    writeValues(constraint.getValues());
                    break;
                default:
                    throw new IllegalStateException("Unhandled constraint type " + constraint.getValueType());
            }
        }
    }

    private void writeValues(List<String> values) {
        List<String> ordered = new ArrayList<>(values);
        if (!settings.isTrackTypeOrder()) {
            ordered.sort(Comparator.naturalOrder());
        }
        writeInt(ordered.size());
        ordered.forEach(this::writeString);
    }

    private void writeBehaviors(SchemaNode node) {
        List<BehaviorRef> refs = node.getBehaviorRefs();
        if (refs == null) {
            if (!node.getBehaviors().isEmpty()) {
                throw new SchemaIdentityException("Behaviors of " + node + " were not resolved before canonicalization");
            }
            refs = List.of();
        }
        writeInt(refs.size());
        for (BehaviorRef ref : refs) {
            writeByte(ref.getKind().getCode());
            writeByte(ref.getStrategy().getCode());
            writeBytes(ref.getPayload());
        }
    }

    private void writeString(String value) {
        if (value == null) {
            writeInt(-1);
            return;
        }
        writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    private void writeLong(long value) {
        try {
            out.writeLong(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void writeByte(int value) {
        try {
            out.writeByte(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static int flags(IdentitySettings settings) {
        int flags = 0;
        if (settings.isTrackDescriptions()) {
            flags |= FLAG_DESCRIPTIONS;
        }
        if (settings.isTrackFieldOrder()) {
            flags |= FLAG_FIELD_ORDER;
        }
        if (settings.isTrackTypeOrder()) {
            flags |= FLAG_TYPE_ORDER;
        }
        return flags;
    }
}
