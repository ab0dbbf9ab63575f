package com.schemaid.describe.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method of a model class as a validator of one or more of its fields.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface FieldValidator {

    /**
     * Names of the validated fields.
     */
    String[] value();

    /**
     * Position among the behaviors of the same field; lower runs first.
     */
    int order() default 0;
}
