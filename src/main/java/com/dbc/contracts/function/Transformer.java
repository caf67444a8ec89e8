package com.dbc.contracts.function;

import com.dbc.contracts.model.CallRecord;

/**
 * Rewrites the arguments of a call before the body and any nested precondition see them.
 * The returned record must keep the same parameter names.
 */
@FunctionalInterface
public interface Transformer {

    CallRecord apply(CallRecord args);
}
