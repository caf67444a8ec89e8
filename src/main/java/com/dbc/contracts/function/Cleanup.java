package com.dbc.contracts.function;

import com.dbc.contracts.model.CallRecord;

/**
 * Action attempted when a postcondition fails, before the failure is signaled.
 */
@FunctionalInterface
public interface Cleanup {

    void run(CallRecord args) throws Exception;
}
