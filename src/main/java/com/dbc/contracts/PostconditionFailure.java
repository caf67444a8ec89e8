package com.dbc.contracts;

/**
 * Raised after the body returns when a postcondition or invariant fails. If a cleanup action
 * was attached it has already been attempted; its failure, if any, is appended to the
 * description and recorded as a suppressed exception.
 */
public class PostconditionFailure extends ContractViolation {

    private static final long serialVersionUID = 1L;

    public PostconditionFailure(String description, int errno) {
        super(description, errno);
    }
}
