package com.dbc.contracts.analysis;

import com.dbc.contracts.ContractAttachmentException;
import com.dbc.contracts.annotations.Ensures;
import com.dbc.contracts.annotations.Invariant;
import com.dbc.contracts.annotations.Requires;
import com.dbc.contracts.function.Cleanup;
import com.dbc.contracts.function.ContractFunction;
import com.dbc.contracts.function.Functions;
import com.dbc.contracts.model.*;
import com.dbc.contracts.processor.DescriptionSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.*;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

/**
 * Reads contracts declared with {@link Requires}, {@link Ensures} and {@link Invariant}
 * using reflection, and turns static methods into contracted functions.
 *
 * Predicates are static methods of the annotated class (or its superclasses), resolved and
 * validated when the annotations are read.
 */
public class AnnotationContractReader {

    private static final Logger logger = LoggerFactory.getLogger(AnnotationContractReader.class);

    private final DescriptionSynthesizer synthesizer;

    public AnnotationContractReader(DescriptionSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /**
     * Finds the single static method with the given name.
     */
    public Method findFunction(Class<?> owner, String name) {
        Method found = null;
        for (Method method : owner.getDeclaredMethods()) {
            if (!method.getName().equals(name) || method.isSynthetic()) {
                continue;
            }
            if (!Modifier.isStatic(method.getModifiers())) {
                throw new ContractAttachmentException("contracted functions must be static methods: " + method);
            }
            if (found != null) {
                throw new ContractAttachmentException("ambiguous function " + owner.getName() + "." + name);
            }
            found = method;
        }
        if (found == null) {
            throw new ContractAttachmentException("no method " + owner.getName() + "." + name);
        }
        return found;
    }

    /**
     * Builds the original function for a static method. Parameter names come from reflection;
     * the array parameter of a varargs method becomes the catch-all. A method returning a
     * {@link CompletionStage} is a suspending function.
     */
    public ContractFunction<Object> functionOf(Method method) {
        if (!Modifier.isStatic(method.getModifiers())) {
            throw new ContractAttachmentException("contracted functions must be static methods: " + method);
        }
        method.trySetAccessible();

        Parameter[] parameters = method.getParameters();
        Signature.Builder builder = Signature.builder(method.getName());
        for (int i = 0; i < parameters.length; i++) {
            if (!parameters[i].isNamePresent()) {
                logger.warn("Parameter names of {} are not available; compile with -parameters", method);
            }
            if (i == parameters.length - 1 && method.isVarArgs()) {
                builder.catchAll(parameters[i].getName());
            } else {
                builder.param(parameters[i].getName());
            }
        }
        Signature signature = builder.build();
        boolean suspending = CompletionStage.class.isAssignableFrom(method.getReturnType());

        return Functions.of(signature, args -> invoke(method, toArguments(method, signature, args)), suspending);
    }

    /**
     * Method conditions in attachment order, outermost first.
     */
    public List<Condition> readMethodConditions(Method method) {
        List<Condition> conditions = new ArrayList<>();
        Class<?> owner = method.getDeclaringClass();
        for (Annotation annotation : expand(method.getDeclaredAnnotations())) {
            if (annotation instanceof Requires) {
                conditions.add(precondition(owner, (Requires) annotation));
            } else if (annotation instanceof Ensures) {
                conditions.add(postcondition(owner, (Ensures) annotation));
            }
        }
        logger.debug("Read {} condition(s) from {}", conditions.size(), method);
        return conditions;
    }

    /**
     * Invariants declared on an implementation class, outermost first.
     */
    public List<Condition> readInvariants(Class<?> implementation) {
        List<Condition> invariants = new ArrayList<>();
        for (Invariant invariant : implementation.getAnnotationsByType(Invariant.class)) {
            Method predicate = resolvePredicate(implementation, invariant.predicate(), ConditionKind.INVARIANT);
            String description = describe(invariant.value(), ConditionKind.INVARIANT, predicate);
            invariants.add(new Condition(ConditionKind.INVARIANT, PredicateArity.UNARY, description, 0, null,
                    (subject, result, old) -> test(predicate, subject)));
        }
        return invariants;
    }

    private Condition precondition(Class<?> owner, Requires requires) {
        Method predicate = resolvePredicate(owner, requires.predicate(), ConditionKind.PRECONDITION);
        String description = describe(requires.value(), ConditionKind.PRECONDITION, predicate);
        return new Condition(ConditionKind.PRECONDITION, PredicateArity.UNARY, description, requires.errno(), null,
                (subject, result, old) -> test(predicate, subject));
    }

    private Condition postcondition(Class<?> owner, Ensures ensures) {
        Method predicate = resolvePredicate(owner, ensures.predicate(), ConditionKind.POSTCONDITION);
        String description = describe(ensures.value(), ConditionKind.POSTCONDITION, predicate);
        PredicateArity arity = PredicateArity.ofParameterCount(predicate.getParameterCount());
        Cleanup cleanup = ensures.cleanup().isEmpty() ? null : resolveCleanup(owner, ensures.cleanup());
        ConditionPredicate check = arity == PredicateArity.TERNARY
                ? (subject, result, old) -> test(predicate, subject, result, old)
                : (subject, result, old) -> test(predicate, subject, result);
        return new Condition(ConditionKind.POSTCONDITION, arity, description, ensures.errno(), cleanup, check);
    }

    private String describe(String declared, ConditionKind kind, Method predicate) {
        return declared.isEmpty() ? synthesizer.describeMethod(kind, predicate) : declared;
    }

    private Method resolvePredicate(Class<?> owner, String name, ConditionKind kind) {
        List<Method> candidates = staticMethods(owner, name);
        if (candidates.isEmpty()) {
            throw new ContractAttachmentException(
                    "contract predicates must be callable: no static method " + owner.getName() + "." + name);
        }
        Method predicate = null;
        for (Method candidate : candidates) {
            if (fitsArity(candidate.getParameterCount(), kind)) {
                predicate = candidate;
                break;
            }
        }
        if (predicate == null) {
            throw new ContractAttachmentException(kind == ConditionKind.POSTCONDITION
                    ? "postcondition predicates must take two or three arguments: " + name
                    : "precondition and invariant predicates must take one argument: " + name);
        }
        Class<?> returnType = predicate.getReturnType();
        if (CompletionStage.class.isAssignableFrom(returnType) || Future.class.isAssignableFrom(returnType)) {
            throw new ContractAttachmentException("contract predicates cannot be suspending: " + predicate);
        }
        if (returnType != boolean.class && returnType != Boolean.class) {
            throw new ContractAttachmentException("contract predicates must return boolean: " + predicate);
        }
        predicate.trySetAccessible();
        return predicate;
    }

    private Cleanup resolveCleanup(Class<?> owner, String name) {
        for (Method candidate : staticMethods(owner, name)) {
            if (candidate.getParameterCount() == 1) {
                candidate.trySetAccessible();
                return args -> invoke(candidate, args);
            }
        }
        throw new ContractAttachmentException(
                "clean up actions must be static methods taking the call record: " + owner.getName() + "." + name);
    }

    private static List<Method> staticMethods(Class<?> owner, String name) {
        List<Method> methods = new ArrayList<>();
        for (Class<?> current = owner; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                if (method.getName().equals(name) && Modifier.isStatic(method.getModifiers())) {
                    methods.add(method);
                }
            }
        }
        return methods;
    }

    private static boolean fitsArity(int parameterCount, ConditionKind kind) {
        return kind == ConditionKind.POSTCONDITION
                ? parameterCount == 2 || parameterCount == 3
                : parameterCount == 1;
    }

    private static List<Annotation> expand(Annotation[] annotations) {
        List<Annotation> expanded = new ArrayList<>();
        for (Annotation annotation : annotations) {
            if (annotation instanceof Requires.List) {
                expanded.addAll(List.of(((Requires.List) annotation).value()));
            } else if (annotation instanceof Ensures.List) {
                expanded.addAll(List.of(((Ensures.List) annotation).value()));
            } else {
                expanded.add(annotation);
            }
        }
        return expanded;
    }

    private static Object[] toArguments(Method method, Signature signature, CallRecord args) {
        Object[] values = new Object[method.getParameterCount()];
        List<String> positional = signature.positional();
        for (int i = 0; i < positional.size(); i++) {
            values[i] = args.get(positional.get(i));
        }
        if (signature.catchAll().isPresent()) {
            List<?> rest = args.getList(signature.catchAll().get());
            Class<?> component = method.getParameterTypes()[values.length - 1].getComponentType();
            Object array = Array.newInstance(component, rest.size());
            for (int i = 0; i < rest.size(); i++) {
                Array.set(array, i, rest.get(i));
            }
            values[values.length - 1] = array;
        }
        return values;
    }

    private static boolean test(Method predicate, Object... args) {
        try {
            return Boolean.TRUE.equals(invoke(predicate, args));
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Exception e) {
            throw new UndeclaredThrowableException(e, "predicate " + predicate.getName() + " failed");
        }
    }

    private static Object invoke(Method method, Object... args) throws Exception {
        try {
            return method.invoke(null, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw (Error) cause;
        }
    }
}
