package com.dbc.contracts.annotations;

import java.lang.annotation.*;

/**
 * Precondition on a static method, checked before the method body runs.
 *
 * The predicate is a static boolean method of the same class taking the call record:
 * <pre>
 * {@code
 * @Requires(value = "i positive", predicate = "iPositive")
 * public static int add2(int i, int j) { ... }
 *
 * static boolean iPositive(CallRecord args) { return args.getInt("i") > 0; }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(Requires.List.class)
public @interface Requires {
    /**
     * Description reported on failure; empty to derive one from the predicate's source.
     * @return The precondition description
     */
    String value() default "";

    /**
     * @return Name of the static predicate method
     */
    String predicate();

    int errno() default 0;

    /**
     * Container annotation for multiple @Requires.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        Requires[] value();
    }
}
