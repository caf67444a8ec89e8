package com.dbc.contracts;

/**
 * A contract did not hold at a call boundary.
 *
 * Violations are assertion failures: they can be caught specifically as
 * {@link PreconditionFailure} or {@link PostconditionFailure}, or generically as
 * {@code ContractViolation} or {@link AssertionError}.
 */
public abstract class ContractViolation extends AssertionError {

    private static final long serialVersionUID = 1L;

    private final String description;
    private final int errno;

    protected ContractViolation(String description, int errno) {
        super(description);
        this.description = description;
        this.errno = errno;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Error number supplied with the contract, 0 when none was given.
     */
    public int getErrno() {
        return errno;
    }
}
