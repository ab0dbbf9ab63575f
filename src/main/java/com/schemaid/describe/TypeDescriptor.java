package com.schemaid.describe;

import com.schemaid.model.BehaviorHandle;
import com.schemaid.model.Constraint;
import com.schemaid.model.NodeKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Shallow description of one type position as reported by a {@link ModelDescriptionProvider}.
 *
 * Referenced models stay unexpanded: a {@link NodeKind#MODEL} descriptor only carries the model
 * class, and the extractor decides whether to expand it or close a cycle.
 */
@Value
@Builder(toBuilder = true)
public class TypeDescriptor {

    @NonNull
    NodeKind kind;

    String tag;

    @NonNull
    @Singular
    List<Constraint> constraints;

    /**
     * Container elements (positional), union members, nothing otherwise.
     */
    @NonNull
    @Singular("argument")
    List<TypeDescriptor> arguments;

    /**
     * Referenced model, only for {@link NodeKind#MODEL}.
     */
    Class<?> modelType;

    /**
     * Behaviors that come with constraints at this position (custom constraint validators).
     */
    @NonNull
    @Singular
    List<BehaviorHandle> behaviors;

    String origin;

    public static TypeDescriptor scalar(String tag, String origin) {
        return TypeDescriptor.builder().kind(NodeKind.SCALAR).tag(tag).origin(origin).build();
    }

    public static TypeDescriptor literal(List<String> values, String origin) {
        return TypeDescriptor.builder()
                .kind(NodeKind.LITERAL)
                .tag("enum")
                .constraint(Constraint.values("values", values))
                .origin(origin)
                .build();
    }

    public static TypeDescriptor container(String tag, List<TypeDescriptor> elements, String origin) {
        return TypeDescriptor.builder().kind(NodeKind.CONTAINER).tag(tag).arguments(elements).origin(origin).build();
    }

    public static TypeDescriptor union(String tag, List<TypeDescriptor> members, String origin) {
        return TypeDescriptor.builder().kind(NodeKind.UNION).tag(tag).arguments(members).origin(origin).build();
    }

    public static TypeDescriptor model(Class<?> modelType, String origin) {
        return TypeDescriptor.builder().kind(NodeKind.MODEL).tag("model").modelType(modelType).origin(origin).build();
    }
}
