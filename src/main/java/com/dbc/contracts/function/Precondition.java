package com.dbc.contracts.function;

import com.dbc.contracts.model.CallRecord;

/**
 * Unary predicate over the arguments of a call, checked before the body runs.
 */
@FunctionalInterface
public interface Precondition {

    boolean test(CallRecord args);
}
