package com.dbc.contracts.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Specifies a class invariant that must hold for all instances
 * at all observable states (before/after method calls through the derived type).
 * The predicate is a static boolean method of the class taking an instance.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Repeatable(Invariant.List.class)
public @interface Invariant {
    String value() default "";

    String predicate();

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.TYPE)
    @interface List {
        Invariant[] value();
    }
}
