package com.schemaid.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * A named bound value attached to a schema node (min/max length, pattern, numeric bounds,
 * enumerations, custom constraint attributes).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Constraint {

    @NonNull
    String name;

    @NonNull
    ValueType valueType;

    /**
     * One of {@link Boolean}, {@link Long}, {@link String} or an immutable {@code List<String>},
     * matching {@link #valueType}.
     */
    @NonNull
    Object value;

    public static Constraint flag(String name) {
        return new Constraint(name, ValueType.BOOLEAN, Boolean.TRUE);
    }

    public static Constraint of(String name, boolean value) {
        return new Constraint(name, ValueType.BOOLEAN, value);
    }

    public static Constraint of(String name, long value) {
        return new Constraint(name, ValueType.INTEGER, value);
    }

    public static Constraint of(String name, String value) {
        return new Constraint(name, ValueType.STRING, value);
    }

    public static Constraint values(String name, List<String> values) {
        return new Constraint(name, ValueType.LIST, List.copyOf(values));
    }

    @SuppressWarnings("unchecked")
    public List<String> getValues() {
        if (valueType != ValueType.LIST) {
            throw new IllegalStateException("Constraint " + name + " is not a list constraint");
        }
        return (List<String>) value;
    }

    public enum ValueType {
        BOOLEAN(1),
        INTEGER(2),
        STRING(3),
        LIST(4);

        private final int code;

        ValueType(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
