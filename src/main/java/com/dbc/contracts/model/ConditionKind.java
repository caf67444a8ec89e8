package com.dbc.contracts.model;

/**
 * Kind of a contract condition, named after the combinator that attaches it.
 */
public enum ConditionKind {
    PRECONDITION("requires"),
    POSTCONDITION("ensures"),
    INVARIANT("invariant");

    private final String combinator;

    ConditionKind(String combinator) {
        this.combinator = combinator;
    }

    public String combinator() {
        return combinator;
    }
}
