package com.dbc.contracts.function;

/**
 * Class invariant, tested against the receiver only.
 *
 * @param <C> implementation type the invariant inspects
 */
@FunctionalInterface
public interface InvariantPredicate<C> {

    boolean test(C self);
}
