package com.dbc.contracts.analysis;

import com.dbc.contracts.ContractAttachmentException;
import com.dbc.contracts.model.Condition;
import com.dbc.contracts.model.ConditionKind;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.modifier.Visibility;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.implementation.MethodDelegation;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.matcher.ElementMatchers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * Builds {@link DerivedType}s. The method table is computed once and every method is classified
 * with {@link MethodEligibility}; the checked ones are overridden in a class generated as a
 * subclass of the implementation, so calls an instance makes on itself cross the same checks.
 */
public final class InvariantPropagator {

    private static final Logger logger = LoggerFactory.getLogger(InvariantPropagator.class);

    private InvariantPropagator() {
    }

    /**
     * Derives a checked type from a concrete class.
     */
    public static <T> DerivedType<T> propagate(Class<T> type, List<Condition> invariants) {
        return propagate(type, type, invariants);
    }

    /**
     * Derives a checked type.
     *
     * @param type the type instances are exposed as, an interface or a class
     * @param implementation concrete, non-final class assignable to {@code type}
     * @param invariants invariant conditions, outermost first
     */
    public static <I> DerivedType<I> propagate(Class<I> type, Class<? extends I> implementation,
                                               List<Condition> invariants) {
        validate(type, implementation);
        for (Condition invariant : invariants) {
            if (invariant.kind() != ConditionKind.INVARIANT) {
                throw new ContractAttachmentException("only invariants propagate onto types, got " + invariant);
            }
        }
        if (Modifier.isFinal(implementation.getModifiers())) {
            throw new ContractAttachmentException(implementation.getName() + " is final and cannot be derived");
        }
        if (Arrays.stream(implementation.getDeclaredConstructors())
                .allMatch(constructor -> Modifier.isPrivate(constructor.getModifiers()))) {
            throw new ContractAttachmentException(implementation.getName() + " has no non-private constructor");
        }

        Map<Method, MethodEligibility.Verdict> methodTable = buildMethodTable(type, implementation);
        InvariantInterceptor interceptor = new InvariantInterceptor(type.getSimpleName(), invariants);
        Class<? extends I> derivedClass = generate(implementation, methodTable, interceptor);

        if (logger.isDebugEnabled()) {
            long checked = methodTable.values().stream()
                    .filter(verdict -> verdict == MethodEligibility.Verdict.CHECKED)
                    .count();
            logger.debug("Derived {} from {} as {}: {} invariant(s), {} of {} methods checked",
                    type.getSimpleName(), implementation.getSimpleName(), derivedClass.getSimpleName(),
                    invariants.size(), checked, methodTable.size());
        }

        return new DerivedType<>(type, implementation, derivedClass, invariants, methodTable, interceptor);
    }

    /**
     * A derived type that performs no checks and hands out plain implementation objects.
     */
    public static <I> DerivedType<I> passThrough(Class<I> type, Class<? extends I> implementation) {
        validate(type, implementation);
        return new DerivedType<>(type, implementation, implementation, Collections.emptyList(),
                Collections.emptyMap(), null);
    }

    private static void validate(Class<?> type, Class<?> implementation) {
        if (implementation.isInterface() || Modifier.isAbstract(implementation.getModifiers())) {
            throw new ContractAttachmentException(implementation.getName() + " is not a concrete class");
        }
        if (!type.isAssignableFrom(implementation)) {
            throw new ContractAttachmentException(
                    implementation.getName() + " does not implement " + type.getName());
        }
    }

    private static Map<Method, MethodEligibility.Verdict> buildMethodTable(Class<?> type, Class<?> implementation) {
        Map<String, Method> methods = new LinkedHashMap<>();
        for (Class<?> current = implementation; current != null && current != Object.class;
             current = current.getSuperclass()) {
            // a bridge shares its name and parameters with the method it forwards to
            for (Method method : current.getDeclaredMethods()) {
                if (!method.isBridge() && isOverridableFrom(method, implementation)) {
                    methods.putIfAbsent(key(method), method);
                }
            }
            for (Method method : current.getDeclaredMethods()) {
                if (method.isBridge() && isOverridableFrom(method, implementation)) {
                    methods.putIfAbsent(key(method), method);
                }
            }
        }
        for (Method method : implementation.getMethods()) {
            methods.putIfAbsent(key(method), method);
        }
        for (Method method : type.getMethods()) {
            methods.putIfAbsent(key(method), method);
        }

        Map<Method, MethodEligibility.Verdict> table = new LinkedHashMap<>();
        for (Method method : methods.values()) {
            MethodEligibility.Verdict verdict = MethodEligibility.classify(method, implementation);
            if (verdict == MethodEligibility.Verdict.CHECKED && Modifier.isFinal(method.getModifiers())) {
                throw new ContractAttachmentException(method + " is final and cannot carry invariant checks");
            }
            table.put(method, verdict);
        }
        return table;
    }

    private static <I> Class<? extends I> generate(Class<? extends I> implementation,
                                                   Map<Method, MethodEligibility.Verdict> methodTable,
                                                   InvariantInterceptor interceptor) {
        ElementMatcher.Junction<MethodDescription> checked = ElementMatchers.none();
        for (Map.Entry<Method, MethodEligibility.Verdict> entry : methodTable.entrySet()) {
            if (entry.getValue() == MethodEligibility.Verdict.CHECKED) {
                Method method = entry.getKey();
                checked = checked.or(ElementMatchers.<MethodDescription>named(method.getName())
                        .and(ElementMatchers.takesArguments(method.getParameterTypes())));
            }
        }

        MethodHandles.Lookup lookup;
        try {
            lookup = MethodHandles.privateLookupIn(implementation, MethodHandles.lookup());
        } catch (IllegalAccessException e) {
            throw new ContractAttachmentException("Cannot define a subclass next to " + implementation.getName(), e);
        }

        return new ByteBuddy()
                .subclass(implementation)
                .defineField(InvariantInterceptor.READY_FIELD, boolean.class, Visibility.PRIVATE)
                .method(checked)
                .intercept(MethodDelegation.withDefaultConfiguration()
                        .filter(ElementMatchers.named("intercept"))
                        .to(interceptor))
                .make()
                .load(implementation.getClassLoader(), ClassLoadingStrategy.UsingLookup.of(lookup))
                .getLoaded();
    }

    private static boolean isOverridableFrom(Method method, Class<?> implementation) {
        int modifiers = method.getModifiers();
        if (Modifier.isPrivate(modifiers)) {
            return false;
        }
        if (Modifier.isPublic(modifiers) || Modifier.isProtected(modifiers)) {
            return true;
        }
        return method.getDeclaringClass().getPackageName().equals(implementation.getPackageName());
    }

    private static String key(Method method) {
        return method.getName() + Arrays.toString(method.getParameterTypes());
    }
}
