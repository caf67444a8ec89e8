package com.dbc.contracts;

import com.dbc.contracts.analysis.DerivedType;
import com.dbc.contracts.config.ContractsConfiguration;
import com.dbc.contracts.evaluation.TypeCheck;
import com.dbc.contracts.function.*;
import com.dbc.contracts.model.CallRecord;

import java.util.HashMap;
import java.util.Map;

/**
 * Static entry point for attaching contracts, backed by one process-wide {@link ContractFactory}.
 *
 * <pre>
 * {@code
 * ContractFunction<Integer> add2 = Contracts.apply(
 *         Functions.of(Signature.of("add2", "i", "j"), args -> args.getInt("i") + args.getInt("j")),
 *         Contracts.requires("i positive", args -> args.getInt("i") > 0),
 *         Contracts.ensures("result is sum", (args, result) -> result == args.getInt("i") + args.getInt("j")));
 * }
 * </pre>
 *
 * The configuration is read from {@link ContractsConfiguration#load()} the first time a contract
 * is attached, unless {@link #initialize(ContractsConfiguration)} installed one before.
 */
public final class Contracts {

    private static final Object lock = new Object();
    private static volatile ContractFactory factory;

    private Contracts() {
    }

    /**
     * Installs the process-wide configuration.
     *
     * @throws IllegalStateException if a configuration is already in use
     */
    public static void initialize(ContractsConfiguration configuration) {
        synchronized (lock) {
            if (factory != null) {
                throw new IllegalStateException("contracts are already configured with "
                        + factory.getConfiguration());
            }
            factory = new ContractFactory(configuration);
        }
    }

    public static ContractFactory factory() {
        ContractFactory current = factory;
        if (current == null) {
            synchronized (lock) {
                if (factory == null) {
                    factory = new ContractFactory(ContractsConfiguration.load());
                }
                current = factory;
            }
        }
        return current;
    }

    public static ContractsConfiguration configuration() {
        return factory().getConfiguration();
    }

    public static Attachment requires(String description, Precondition predicate) {
        return factory().requires(description, predicate);
    }

    public static Attachment requires(String description, Precondition predicate, int errno) {
        return factory().requires(description, predicate, errno);
    }

    public static Attachment requires(Precondition predicate) {
        return factory().requires(predicate);
    }

    public static Attachment requires(Precondition predicate, int errno) {
        return factory().requires(predicate, errno);
    }

    public static <R> Attachment ensures(String description, Postcondition<R> predicate) {
        return factory().ensures(description, predicate);
    }

    public static <R> Attachment ensures(String description, Postcondition<R> predicate, int errno,
                                         Cleanup cleanup) {
        return factory().ensures(description, predicate, errno, cleanup);
    }

    public static <R> Attachment ensures(Postcondition<R> predicate) {
        return factory().ensures(predicate);
    }

    public static <R> Attachment ensures(String description, SnapshotPostcondition<R> predicate) {
        return factory().ensures(description, predicate);
    }

    public static <R> Attachment ensures(String description, SnapshotPostcondition<R> predicate, int errno,
                                         Cleanup cleanup) {
        return factory().ensures(description, predicate, errno, cleanup);
    }

    public static <R> Attachment ensures(SnapshotPostcondition<R> predicate) {
        return factory().ensures(predicate);
    }

    public static <C> InvariantAttachment<C> invariant(String description, InvariantPredicate<C> predicate) {
        return factory().invariant(description, predicate);
    }

    public static <C> InvariantAttachment<C> invariant(InvariantPredicate<C> predicate) {
        return factory().invariant(predicate);
    }

    public static Attachment transform(Transformer transformer) {
        return factory().transform(transformer);
    }

    public static Attachment preserve(Preserver preserver) {
        return factory().preserve(preserver);
    }

    public static TypeCheck typeCheck() {
        return factory().typeCheck();
    }

    public static CallRecord rewrite(CallRecord args, Map<String, ?> overrides) {
        return factory().rewrite(args, overrides);
    }

    public static CallRecord rewrite(CallRecord args, String name, Object value) {
        Map<String, Object> override = new HashMap<>();
        override.put(name, value);
        return factory().rewrite(args, override);
    }

    public static <R> ContractFunction<R> apply(ContractFunction<R> function, Attachment... attachments) {
        return factory().apply(function, attachments);
    }

    public static ContractFunction<Object> annotated(Class<?> owner, String methodName) {
        return factory().annotated(owner, methodName);
    }

    public static <I> DerivedType<I> annotatedType(Class<I> type, Class<? extends I> implementation) {
        return factory().annotatedType(type, implementation);
    }

    public static <T> DerivedType<T> annotatedType(Class<T> type) {
        return factory().annotatedType(type, type);
    }
}
