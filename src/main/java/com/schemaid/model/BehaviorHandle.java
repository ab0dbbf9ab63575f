package com.schemaid.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.lang.reflect.Method;

/**
 * A validator or serializer attached to a field or a whole model, as handed over by the
 * model description provider. Never executed, only fingerprinted.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BehaviorHandle {

    @NonNull
    BehaviorKind kind;

    @NonNull
    Form form;

    /**
     * A {@link Method}, a {@link Class}, or a function object, depending on {@link #form}.
     */
    @NonNull
    Object implementation;

    public static BehaviorHandle ofMethod(BehaviorKind kind, Method method) {
        return new BehaviorHandle(kind, Form.METHOD, method);
    }

    public static BehaviorHandle ofClass(BehaviorKind kind, Class<?> type) {
        return new BehaviorHandle(kind, Form.CLASS, type);
    }

    public static BehaviorHandle ofFunction(BehaviorKind kind, Object function) {
        return new BehaviorHandle(kind, Form.FUNCTION, function);
    }

    public enum Form {
        METHOD,
        CLASS,
        FUNCTION
    }
}
