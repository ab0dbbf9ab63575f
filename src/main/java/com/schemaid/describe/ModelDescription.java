package com.schemaid.describe;

import com.schemaid.model.BehaviorHandle;
import com.schemaid.model.Constraint;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Shallow description of a model: its own metadata and its fields, in declaration order.
 */
@Value
@Builder(toBuilder = true)
public class ModelDescription {

    @NonNull
    Class<?> modelType;

    String description;

    /**
     * Class-level constraints.
     */
    @NonNull
    @Singular
    List<Constraint> constraints;

    /**
     * Validators of class-level custom constraints.
     */
    @NonNull
    @Singular
    List<BehaviorHandle> constraintBehaviors;

    @NonNull
    @Singular
    List<FieldDescription> fields;
}
