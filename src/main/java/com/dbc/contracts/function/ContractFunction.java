package com.dbc.contracts.function;

import com.dbc.contracts.model.Invocation;
import com.dbc.contracts.model.Signature;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A callable unit that contracts can be attached to.
 *
 * Every wrapping layer keeps the visible {@link #signature()} of the function it wraps and
 * links back to the innermost original through {@link #unwrap()}, so preservers attached at
 * any depth end up on the same original.
 *
 * Suspending functions return a {@link java.util.concurrent.CompletionStage}; their
 * postconditions are checked once the stage resolves.
 *
 * @param <R> result type
 */
public abstract class ContractFunction<R> {

    private final List<Preserver> preservers = new CopyOnWriteArrayList<>();

    public abstract Signature signature();

    public abstract R call(Invocation invocation);

    public final R call(Object... positional) {
        return call(Invocation.of(positional));
    }

    /**
     * Whether the body suspends, i.e. returns a stage that resolves later.
     */
    public boolean isSuspending() {
        return false;
    }

    /**
     * The innermost original function, this one for an unwrapped function.
     */
    public ContractFunction<R> unwrap() {
        return this;
    }

    /**
     * Registers a preserver on the innermost original function.
     */
    public final void addPreserver(Preserver preserver) {
        unwrap().preservers.add(preserver);
    }

    /**
     * Preservers attached to the innermost original, in attachment order.
     */
    public final List<Preserver> preservers() {
        return Collections.unmodifiableList(unwrap().preservers);
    }

    @Override
    public String toString() {
        return signature().toString();
    }
}
