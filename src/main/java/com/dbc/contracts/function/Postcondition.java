package com.dbc.contracts.function;

import com.dbc.contracts.model.CallRecord;

/**
 * Binary predicate over the arguments and the result of a call, checked after the body returns.
 *
 * @param <R> result type of the contracted function (the resolved value for suspending functions)
 */
@FunctionalInterface
public interface Postcondition<R> {

    boolean test(CallRecord args, R result);
}
