package com.dbc.contracts.analysis;

import com.dbc.contracts.model.Condition;

import java.lang.reflect.*;
import java.util.*;

/**
 * A type whose instances have their invariants checked at every eligible method boundary.
 *
 * The method table is computed once, when the type is derived; the implementation class
 * itself is never modified. Instances belong to a generated subclass of the implementation
 * that overrides each checked method, so calls an instance makes on itself are checked too,
 * once per boundary crossed.
 *
 * Methods added to the implementation later and static methods are not checked. Invariant
 * checks are not mutually exclusive: two threads or tasks acting on one instance can observe
 * each other's intermediate state.
 *
 * @param <I> the type instances are exposed as
 */
public final class DerivedType<I> {

    private final Class<I> type;
    private final Class<? extends I> implementation;
    private final Class<? extends I> instanceClass;
    private final List<Condition> invariants;
    private final Map<Method, MethodEligibility.Verdict> methodTable;
    private final InvariantInterceptor interceptor;
    private final Field ready;

    DerivedType(Class<I> type, Class<? extends I> implementation, Class<? extends I> instanceClass,
                List<Condition> invariants,
                Map<Method, MethodEligibility.Verdict> methodTable, InvariantInterceptor interceptor) {
        this.type = type;
        this.implementation = implementation;
        this.instanceClass = instanceClass;
        this.invariants = List.copyOf(invariants);
        this.methodTable = Collections.unmodifiableMap(new LinkedHashMap<>(methodTable));
        this.interceptor = interceptor;
        this.ready = interceptor == null ? null : readyField(instanceClass);
    }

    /**
     * Constructs an instance with the given arguments. The initializer is checked on exit only,
     * since the object is not valid before it completes; methods it calls run unchecked.
     * A {@code null} argument array stands for a single {@code null} argument.
     *
     * @throws com.dbc.contracts.PostconditionFailure if the new object breaks an invariant
     * @throws IllegalArgumentException if no constructor accepts the arguments
     */
    public I newInstance(Object... args) {
        Object[] actual = args == null ? new Object[]{null} : args;
        I instance = construct(actual);
        if (interceptor == null) {
            return instance;
        }

        try {
            ready.setBoolean(instance, true);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot mark " + instanceClass.getName() + " as initialized", e);
        }
        interceptor.checkExit(instance);
        return instance;
    }

    public Class<I> type() {
        return type;
    }

    public Class<? extends I> implementation() {
        return implementation;
    }

    /**
     * The class instances are created from: a generated subclass of the implementation when
     * checking, the implementation itself otherwise.
     */
    public Class<? extends I> instanceClass() {
        return instanceClass;
    }

    /**
     * Invariants, outermost first.
     */
    public List<Condition> invariants() {
        return invariants;
    }

    public boolean isChecking() {
        return interceptor != null;
    }

    /**
     * Names of the methods wrapped with invariant checks, sorted.
     */
    public SortedSet<String> checkedMethodNames() {
        SortedSet<String> names = new TreeSet<>();
        methodTable.forEach((method, verdict) -> {
            if (verdict == MethodEligibility.Verdict.CHECKED) {
                names.add(method.getName());
            }
        });
        return names;
    }

    /**
     * Verdict for a method of the type, its implementation, or {@code Object}.
     */
    public Optional<MethodEligibility.Verdict> verdictFor(String name, Class<?>... parameterTypes) {
        for (Map.Entry<Method, MethodEligibility.Verdict> entry : methodTable.entrySet()) {
            Method method = entry.getKey();
            if (method.getName().equals(name) && Arrays.equals(method.getParameterTypes(), parameterTypes)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private I construct(Object[] args) {
        Constructor<?> constructor = findConstructor(args);
        try {
            return type.cast(constructor.newInstance(args));
        } catch (InvocationTargetException e) {
            throw propagate(e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot construct " + implementation.getName(), e);
        }
    }

    private Constructor<?> findConstructor(Object[] args) {
        for (Constructor<?> constructor : instanceClass.getDeclaredConstructors()) {
            if (accepts(constructor.getParameterTypes(), args)) {
                constructor.trySetAccessible();
                return constructor;
            }
        }
        throw new IllegalArgumentException("No constructor of " + implementation.getName()
                + " accepts " + Arrays.toString(args));
    }

    private static boolean accepts(Class<?>[] parameterTypes, Object[] args) {
        if (parameterTypes.length != args.length) {
            return false;
        }
        for (int i = 0; i < args.length; i++) {
            Class<?> parameterType = parameterTypes[i];
            if (args[i] == null) {
                if (parameterType.isPrimitive()) {
                    return false;
                }
            } else if (!box(parameterType).isInstance(args[i])) {
                return false;
            }
        }
        return true;
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        return Character.class;
    }

    private static Field readyField(Class<?> instanceClass) {
        try {
            Field field = instanceClass.getDeclaredField(InvariantInterceptor.READY_FIELD);
            if (!field.trySetAccessible()) {
                throw new IllegalStateException(field + " is not accessible");
            }
            return field;
        } catch (NoSuchFieldException e) {
            throw new IllegalStateException(instanceClass.getName() + " was not generated by this library", e);
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new UndeclaredThrowableException(cause);
    }

    @Override
    public String toString() {
        return "DerivedType[" + type.getName() + " via " + instanceClass.getName() + "]";
    }
}
