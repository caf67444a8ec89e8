package com.dbc.contracts.function;

import com.dbc.contracts.model.CallRecord;

/**
 * The code of a contracted function, run against its normalized arguments.
 *
 * @param <R> result type
 */
@FunctionalInterface
public interface Body<R> {

    R apply(CallRecord args) throws Exception;
}
