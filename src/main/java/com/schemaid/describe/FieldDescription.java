package com.schemaid.describe;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One named field of a model.
 */
@Value
@Builder(toBuilder = true)
public class FieldDescription {

    @NonNull
    String name;

    String alias;

    String description;

    boolean defaultPresent;

    /**
     * Field type, carrying the field-level constraints.
     */
    @NonNull
    TypeDescriptor type;
}
