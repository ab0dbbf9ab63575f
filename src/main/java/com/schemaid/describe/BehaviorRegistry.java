package com.schemaid.describe;

import com.schemaid.model.BehaviorHandle;
import com.schemaid.model.BehaviorKind;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Behaviors attached in code rather than with annotations: lambdas, anonymous classes and
 * function objects.
 *
 * Register everything before the first identifier of an affected model is computed; identifiers
 * are cached and do not see later registrations (see {@code SchemaIdentityEngine#rebuild}).
 */
public class BehaviorRegistry {

    private final Map<Class<?>, List<BehaviorHandle>> modelBehaviors = new ConcurrentHashMap<>();
    private final Map<FieldKey, List<BehaviorHandle>> fieldBehaviors = new ConcurrentHashMap<>();

    public BehaviorRegistry fieldValidator(Class<?> model, String fieldName, Object function) {
        return addField(model, fieldName, BehaviorHandle.ofFunction(BehaviorKind.VALIDATOR, function));
    }

    public BehaviorRegistry fieldSerializer(Class<?> model, String fieldName, Object function) {
        return addField(model, fieldName, BehaviorHandle.ofFunction(BehaviorKind.SERIALIZER, function));
    }

    public BehaviorRegistry modelValidator(Class<?> model, Object function) {
        return addModel(model, BehaviorHandle.ofFunction(BehaviorKind.VALIDATOR, function));
    }

    public BehaviorRegistry modelSerializer(Class<?> model, Object function) {
        return addModel(model, BehaviorHandle.ofFunction(BehaviorKind.SERIALIZER, function));
    }

    public List<BehaviorHandle> forModel(Class<?> model) {
        return List.copyOf(modelBehaviors.getOrDefault(model, List.of()));
    }

    public List<BehaviorHandle> forField(Class<?> model, String fieldName) {
        return List.copyOf(fieldBehaviors.getOrDefault(new FieldKey(model, fieldName), List.of()));
    }

    private BehaviorRegistry addField(Class<?> model, String fieldName, BehaviorHandle handle) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(fieldName, "fieldName");
        fieldBehaviors.computeIfAbsent(new FieldKey(model, fieldName), k -> new CopyOnWriteArrayList<>()).add(handle);
        return this;
    }

    private BehaviorRegistry addModel(Class<?> model, BehaviorHandle handle) {
        Objects.requireNonNull(model, "model");
        modelBehaviors.computeIfAbsent(model, k -> new CopyOnWriteArrayList<>()).add(handle);
        return this;
    }

    @Value
    private static class FieldKey {
        Class<?> model;
        String fieldName;
    }
}
