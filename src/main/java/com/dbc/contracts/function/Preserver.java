package com.dbc.contracts.function;

import com.dbc.contracts.model.CallRecord;

import java.util.Map;

/**
 * Captures named values before a call body runs. Deep copies of mutable state are
 * the preserver's job; the engine only copies the returned map.
 */
@FunctionalInterface
public interface Preserver {

    Map<String, ?> capture(CallRecord args);
}
