package com.dbc.contracts.analysis;

import com.dbc.contracts.annotations.SkipInvariant;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Set;

/**
 * Decides which methods of a derived type get invariant checks.
 *
 * Excluded:
 * - static methods, which belong to the type rather than an instance
 * - special members: those declared by {@code java.lang.Object}, plus synthetic and bridge
 *   methods, unless allow-listed ({@code equals}, {@code compareTo}, the initializer)
 * - implementation methods annotated {@link SkipInvariant}
 *
 * Everything else is an ordinary instance method and is checked.
 */
public final class MethodEligibility {

    /**
     * Name under which the initializer (constructor) appears in the allow-list.
     */
    public static final String INITIALIZER = "<init>";

    private static final Set<String> ALLOWED_SPECIAL = Set.of("equals", "compareTo", INITIALIZER);

    public enum Verdict {
        CHECKED,
        TYPE_LEVEL,
        SPECIAL,
        SKIPPED
    }

    private MethodEligibility() {
    }

    public static Verdict classify(Method method, Class<?> implementation) {
        if (Modifier.isStatic(method.getModifiers())) {
            return Verdict.TYPE_LEVEL;
        }
        if (method.isSynthetic() || method.isBridge()) {
            return Verdict.SPECIAL;
        }
        if (isObjectMember(method) && !ALLOWED_SPECIAL.contains(method.getName())) {
            return Verdict.SPECIAL;
        }
        Method implementationMethod = findImplementation(method, implementation);
        if (implementationMethod != null && implementationMethod.isAnnotationPresent(SkipInvariant.class)) {
            return Verdict.SKIPPED;
        }
        return Verdict.CHECKED;
    }

    static boolean isObjectMember(Method method) {
        if (method.getDeclaringClass() == Object.class) {
            return true;
        }
        for (Method objectMethod : Object.class.getMethods()) {
            if (objectMethod.getName().equals(method.getName())
                    && Arrays.equals(objectMethod.getParameterTypes(), method.getParameterTypes())) {
                return true;
            }
        }
        return false;
    }

    private static Method findImplementation(Method method, Class<?> implementation) {
        for (Class<?> current = implementation; current != null; current = current.getSuperclass()) {
            for (Method candidate : current.getDeclaredMethods()) {
                if (candidate.getName().equals(method.getName())
                        && Arrays.equals(candidate.getParameterTypes(), method.getParameterTypes())
                        && !candidate.isBridge()) {
                    return candidate;
                }
            }
        }
        return null;
    }
}
