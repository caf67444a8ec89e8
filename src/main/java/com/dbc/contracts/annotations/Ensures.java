package com.dbc.contracts.annotations;

import java.lang.annotation.*;

/**
 * Postcondition on a static method, checked after the method returns.
 * The predicate takes (CallRecord, result) or (CallRecord, result, Snapshot).
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(Ensures.List.class)
public @interface Ensures {
    /**
     * Description reported on failure; empty to derive one from the predicate's source.
     * @return The postcondition description
     */
    String value() default "";

    /**
     * @return Name of the static predicate method
     */
    String predicate();

    int errno() default 0;

    /**
     * @return Name of a static method taking the call record, run when the postcondition fails
     */
    String cleanup() default "";

    /**
     * Container annotation for multiple @Ensures.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        Ensures[] value();
    }
}
