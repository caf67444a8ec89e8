package com.dbc.contracts.function;

import com.dbc.contracts.model.Signature;

import java.util.Objects;

/**
 * Base for layers that add behavior around another function while looking exactly like it.
 */
public abstract class WrappingFunction<R> extends ContractFunction<R> {

    protected final ContractFunction<R> inner;

    protected WrappingFunction(ContractFunction<R> inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override
    public Signature signature() {
        return inner.signature();
    }

    @Override
    public boolean isSuspending() {
        return inner.isSuspending();
    }

    @Override
    public ContractFunction<R> unwrap() {
        return inner.unwrap();
    }
}
