package com.schemaid.identity;

import com.schemaid.model.IdentitySettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Human-facing summary of a model's identity, for logs, files and CLI output.
 */
@Value
@Builder
public class SchemaIdentityReport {

    /**
     * Fully qualified model class name. Diagnostic only; names never enter identifiers.
     */
    @NonNull
    String modelName;

    @NonNull
    String identifier;

    /**
     * Start of the process that computed the identifier.
     */
    @NonNull
    Instant computedAt;

    @NonNull
    IdentitySettings settings;

    int nodeCount;

    int tableSize;

    int canonicalLength;

    int degradedBehaviors;
}
