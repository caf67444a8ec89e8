package com.dbc.contracts.model;

/**
 * Variant tag of a condition predicate, fixed when the condition is attached.
 * Preconditions and invariants are unary; postconditions are binary (args, result)
 * or ternary (args, result, old).
 */
public enum PredicateArity {
    UNARY(1),
    BINARY(2),
    TERNARY(3);

    private final int parameterCount;

    PredicateArity(int parameterCount) {
        this.parameterCount = parameterCount;
    }

    public int parameterCount() {
        return parameterCount;
    }

    public static PredicateArity ofParameterCount(int count) {
        for (PredicateArity arity : values()) {
            if (arity.parameterCount == count) {
                return arity;
            }
        }
        throw new IllegalArgumentException("predicates take one to three arguments, not " + count);
    }
}
