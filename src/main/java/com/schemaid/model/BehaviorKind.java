package com.schemaid.model;

/**
 * What an attached behavior does to a value.
 */
public enum BehaviorKind {
    VALIDATOR(1),
    SERIALIZER(2);

    private final int code;

    BehaviorKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
