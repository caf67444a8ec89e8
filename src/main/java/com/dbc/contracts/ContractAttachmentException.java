package com.dbc.contracts;

/**
 * A contract was declared with malformed input: an empty description, a missing predicate,
 * a predicate of the wrong arity, or a suspending predicate. Raised at definition time.
 */
public class ContractAttachmentException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ContractAttachmentException(String message) {
        super(message);
    }

    public ContractAttachmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
