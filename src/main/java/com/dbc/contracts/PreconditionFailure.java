package com.dbc.contracts;

/**
 * Raised before the body runs when a precondition (or the entry check of an invariant) fails.
 * The body is never executed.
 */
public class PreconditionFailure extends ContractViolation {

    private static final long serialVersionUID = 1L;

    public PreconditionFailure(String description, int errno) {
        super(description, errno);
    }
}
