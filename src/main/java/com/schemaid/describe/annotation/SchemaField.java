package com.schemaid.describe.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Schema metadata for a model field (or record component) that Java types cannot express.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface SchemaField {

    /**
     * Serialization name of the field. Empty means the field name is used.
     */
    String alias() default "";

    /**
     * Human-readable description. Only fingerprinted when descriptions are tracked.
     */
    String description() default "";

    /**
     * Whether the field has a default value. Only presence is fingerprinted, never the value.
     */
    boolean hasDefault() default false;
}
