package com.schemaid.identity;

import com.schemaid.model.CanonicalForm;
import com.schemaid.model.Identifier;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything one pass through the pipeline produced for a model.
 */
@Value
public class FingerprintResult {

    @NonNull
    Class<?> model;

    @NonNull
    Identifier identifier;

    @NonNull
    CanonicalForm canonicalForm;

    /**
     * Behaviors fingerprinted with a weaker strategy than their name.
     */
    int degradedBehaviors;
}
