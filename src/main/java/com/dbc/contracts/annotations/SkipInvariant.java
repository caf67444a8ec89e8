package com.dbc.contracts.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an implementation method that invariant propagation should leave unchecked.
 *
 * This is useful for:
 * - Methods that legitimately run while the object is in an intermediate state
 * - Diagnostic accessors that must work on a broken object
 *
 * Example usage:
 * <pre>
 * {@code
 * @SkipInvariant(reason = "used to report on broken instances")
 * public String dump() { ... }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface SkipInvariant {

    /**
     * Optional reason explaining why the method is not checked.
     *
     * @return The reason for skipping, or empty string if not specified
     */
    String reason() default "";
}
