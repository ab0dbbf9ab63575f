package com.schemaid.behavior;

import com.schemaid.model.FingerprintStrategy;
import lombok.NonNull;
import lombok.Value;

/**
 * Raised when a behavior could not be fingerprinted by name and a weaker strategy was used.
 * Never an exception: the identifier is still produced.
 */
@Value
public class BehaviorResolutionDegraded {

    /**
     * Schema position the behavior is attached to.
     */
    String origin;

    @NonNull
    String qualifiedName;

    @NonNull
    FingerprintStrategy strategy;

    @NonNull
    String reason;
}
