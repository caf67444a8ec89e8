package com.dbc.contracts.function;

import com.dbc.contracts.model.CallRecord;
import com.dbc.contracts.model.Snapshot;

/**
 * Ternary postcondition that also receives the values preserved before the call.
 *
 * @param <R> result type of the contracted function
 */
@FunctionalInterface
public interface SnapshotPostcondition<R> {

    boolean test(CallRecord args, R result, Snapshot old);
}
