package com.schemaid.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Symbolic, portable stand-in for an attached behavior. The strategy travels with the
 * payload so refs built under different strategies never compare equal.
 */
@Value
public class BehaviorRef {

    @NonNull
    BehaviorKind kind;

    /**
     * Best-effort readable name. Diagnostic only, not part of the canonical form.
     */
    @NonNull
    String qualifiedName;

    @NonNull
    FingerprintStrategy strategy;

    @NonNull
    byte[] payload;

    public BehaviorRef(@NonNull BehaviorKind kind, @NonNull String qualifiedName,
                       @NonNull FingerprintStrategy strategy, @NonNull byte[] payload) {
        this.kind = kind;
        this.qualifiedName = qualifiedName;
        this.strategy = strategy;
        this.payload = payload.clone();
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public boolean isDegraded() {
        return strategy != FingerprintStrategy.BY_NAME;
    }
}
